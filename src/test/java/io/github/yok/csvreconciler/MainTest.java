package io.github.yok.csvreconciler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.csvreconciler.config.ConnectionConfig;
import io.github.yok.csvreconciler.config.DialectMode;
import io.github.yok.csvreconciler.config.PathsConfig;
import io.github.yok.csvreconciler.config.ReconcileConfig;
import io.github.yok.csvreconciler.core.ReconcileRunner;
import io.github.yok.csvreconciler.db.DbDialectFactory;
import io.github.yok.csvreconciler.util.ErrorHandler;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private ConnectionConfig connectionConfig;
    private PathsConfig pathsConfig;
    private ReconcileConfig reconcileConfig;

    private Main main;

    @BeforeEach
    void setup() {
        connectionConfig = new ConnectionConfig();
        connectionConfig.setEnv("test");
        connectionConfig.setUrl("jdbc:h2:mem:main_test");
        connectionConfig.setDriverClass("org.h2.Driver");
        connectionConfig.setDialect(DialectMode.H2);
        connectionConfig.setSchema("reconcile");
        connectionConfig.setUser("sa");
        connectionConfig.setPassword("pw");

        pathsConfig = new PathsConfig();
        reconcileConfig = new ReconcileConfig();

        main = new Main(connectionConfig, pathsConfig, reconcileConfig, new DbDialectFactory());
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(context);

                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--target", "orders"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--target"), eq("orders"));
            verify(context).close();
        }
    }

    @Test
    void run_正常ケース_対象指定ありで実行する_正規化された対象一覧でReconcileRunnerが呼ばれること() {
        try (MockedConstruction<ReconcileRunner> mocked =
                mockConstruction(ReconcileRunner.class)) {

            main.run("-t", " products , orders ", "--verbose");

            assertEquals(1, mocked.constructed().size());
            ReconcileRunner runner = mocked.constructed().get(0);
            verify(runner).execute(List.of("products", "orders"));
            assertEquals(0, main.getExitCode());
        } catch (SQLException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    void run_正常ケース_対象指定なしで実行する_空の対象一覧で全エンティティが処理されること()
            throws Exception {
        try (MockedConstruction<ReconcileRunner> mocked =
                mockConstruction(ReconcileRunner.class)) {

            main.run();

            verify(mocked.constructed().get(0)).execute(List.of());
        }
    }

    @Test
    void run_異常ケース_接続設定が欠落している_ErrorHandlerが呼ばれReconcileRunnerは生成されないこと() {
        connectionConfig.setUser(null);

        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class);
                MockedConstruction<ReconcileRunner> mocked =
                        mockConstruction(ReconcileRunner.class)) {

            main.run();

            handler.verify(() -> ErrorHandler.errorAndExit(
                    eq("Fatal error: Missing required connection settings: "
                            + "POSTGRES_USER (connection.user)"),
                    any(IllegalStateException.class)));
            assertTrue(mocked.constructed().isEmpty());
            assertEquals(Main.FATAL_EXIT_CODE, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_エラー保存に失敗する_ErrorHandlerへ例外が渡されること() {
        SQLException failure = new SQLException("errors table missing");
        try (MockedConstruction<ReconcileRunner> mocked = mockConstruction(ReconcileRunner.class,
                (runner, ctx) -> when(runner.execute(any())).thenThrow(failure))) {

            ErrorHandler.disableExitForCurrentThread();
            try {
                IllegalStateException ex =
                        assertThrows(IllegalStateException.class, () -> main.run());
                assertEquals("Fatal error: errors table missing", ex.getMessage());
                assertEquals(failure, ex.getCause());
                assertEquals(Main.FATAL_EXIT_CODE, main.getExitCode());
            } finally {
                ErrorHandler.restoreExitForCurrentThread();
            }
        }
    }

    @Test
    void run_異常ケース_未対応の方言を指定する_ErrorHandlerが呼ばれること() {
        DbDialectFactory factory = mock(DbDialectFactory.class);
        when(factory.create(any(ConnectionConfig.class)))
                .thenThrow(new IllegalArgumentException("Unsupported"));
        Main sut = new Main(connectionConfig, pathsConfig, reconcileConfig, factory);

        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class)) {
            sut.run();
            handler.verify(() -> ErrorHandler.errorAndExit(anyString(),
                    any(IllegalArgumentException.class)));
        }
    }

    @Test
    void getExitCode_異常ケース_エラー保存に失敗する_SpringApplicationの終了コードが1になること() {
        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class);
                MockedConstruction<ReconcileRunner> mocked = mockConstruction(
                        ReconcileRunner.class, (runner, ctx) -> when(runner.execute(any()))
                                .thenThrow(new SQLException("errors table missing")))) {

            main.run();

            ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
            when(context.getBeansOfType(ExitCodeGenerator.class))
                    .thenReturn(Map.of("main", main));
            assertEquals(Main.FATAL_EXIT_CODE, SpringApplication.exit(context));
        }
    }
}
