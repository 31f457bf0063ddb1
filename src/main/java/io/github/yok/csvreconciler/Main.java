package io.github.yok.csvreconciler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.csvreconciler.config.ConnectionConfig;
import io.github.yok.csvreconciler.config.PathsConfig;
import io.github.yok.csvreconciler.config.ReconcileConfig;
import io.github.yok.csvreconciler.core.DualWriteReconciler;
import io.github.yok.csvreconciler.core.ErrorLedger;
import io.github.yok.csvreconciler.core.ReconcileRunner;
import io.github.yok.csvreconciler.core.SchemaValidator;
import io.github.yok.csvreconciler.core.TabularLoader;
import io.github.yok.csvreconciler.db.ConnectionFactory;
import io.github.yok.csvreconciler.db.DbDialect;
import io.github.yok.csvreconciler.db.DbDialectFactory;
import io.github.yok.csvreconciler.db.DriverManagerConnectionFactory;
import io.github.yok.csvreconciler.util.ErrorHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line option {@code --target}/{@code -t}, checks the connection settings,
 * waits for the configured startup delay and runs one reconciliation batch with
 * {@link ReconcileRunner}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --target [e1,e2,…]} or {@code -t [e1,e2,…]} restricts the run to the listed entities.
 * If omitted, every entity declared under {@code reconcile.entities} is processed.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link ConnectionConfig}, {@link PathsConfig} and {@link ReconcileConfig} from
 * {@code application.yml} and the environment.
 * </p>
 *
 * <p>
 * A fatal error (missing connection settings, or a failed flush of the error ledger) makes the
 * process exit with {@link #FATAL_EXIT_CODE}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see ReconcileConfig
 * @see DbDialectFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, PathsConfig.class, ReconcileConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    /**
     * Process exit status of a run that ended with a fatal error.
     */
    public static final int FATAL_EXIT_CODE = 1;

    private final ConnectionConfig connectionConfig;
    private final PathsConfig pathsConfig;
    private final ReconcileConfig reconcileConfig;
    private final DbDialectFactory dialectFactory;

    private volatile int exitCode = 0;

    /**
     * Bootstraps the application and ends the JVM with a non-zero status when the run failed.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        int status = SpringApplication.exit(context);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        long startNanos = System.nanoTime();
        log.info("Application started. Args: {}", Arrays.toString(args));

        List<String> targetEntities = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targetEntities = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        try {
            connectionConfig.validate();
            log.info("Executing in {}...", connectionConfig.getEnv());
            awaitStartupDelay(reconcileConfig.getStartupDelay());

            DbDialect dialect = dialectFactory.create(connectionConfig);
            ConnectionFactory connectionFactory =
                    new DriverManagerConnectionFactory(connectionConfig);
            ObjectMapper objectMapper = new ObjectMapper();
            String schema = connectionConfig.getSchema();
            ErrorLedger ledger = new ErrorLedger(dialect, schema, objectMapper);

            new ReconcileRunner(pathsConfig, reconcileConfig.toTableDescriptors(),
                    new TabularLoader(), new SchemaValidator(),
                    new DualWriteReconciler(connectionFactory, dialect, schema, objectMapper),
                    connectionFactory, ledger).execute(targetEntities);
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = FATAL_EXIT_CODE;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        } finally {
            double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            log.info(String.format("Execution completed in %.2f seconds.", seconds));
        }
    }

    /**
     * Returns {@link #FATAL_EXIT_CODE} once {@link #run(String...)} has reported a fatal error,
     * {@code 0} otherwise.
     *
     * @return process exit status
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static void awaitStartupDelay(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        log.info("Waiting {} ms before connecting to the database", delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the database", e);
        }
    }
}
