package io.github.yok.csvreconciler.db;

import io.github.yok.csvreconciler.config.ConnectionConfig;
import io.github.yok.csvreconciler.config.DialectMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialect} according to the database type.
 *
 * <p>
 * The selected dialect is based on {@link ConnectionConfig#getDialect()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectFactory {

    /**
     * Creates the dialect configured for the given connection.
     *
     * @param connectionConfig connection settings
     * @return a dialect instance
     * @throws IllegalArgumentException if the configured mode is not supported
     */
    public DbDialect create(ConnectionConfig connectionConfig) {
        return create(connectionConfig.getDialect());
    }

    /**
     * Creates the dialect for the given mode.
     *
     * <p>
     * Supported modes:
     * </p>
     * <ul>
     * <li>{@code POSTGRESQL}: instantiate {@link PostgresqlDialect}</li>
     * <li>{@code H2}: instantiate {@link H2Dialect}</li>
     * </ul>
     *
     * @param mode dialect mode
     * @return a dialect instance
     * @throws IllegalArgumentException if {@code mode} is {@code null} or unsupported
     */
    public DbDialect create(DialectMode mode) {
        if (mode == null) {
            String msg = "Dialect mode is not configured (connection.dialect).";
            log.error(msg);
            throw new IllegalArgumentException(msg);
        }
        switch (mode) {
            case POSTGRESQL:
                return new PostgresqlDialect();
            case H2:
                return new H2Dialect();
            default:
                String msg = "Unsupported dialect mode: " + mode;
                log.error(msg);
                throw new IllegalArgumentException(msg);
        }
    }
}
