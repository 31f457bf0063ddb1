package io.github.yok.csvreconciler.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

    private static ConnectionConfig complete() {
        ConnectionConfig config = new ConnectionConfig();
        config.setEnv("dev");
        config.setHost("localhost");
        config.setPort("5432");
        config.setDatabase("company");
        config.setSchema("company_schema");
        config.setUser("app");
        config.setPassword("secret");
        return config;
    }

    @Test
    void getJdbcUrl_正常ケース_url未指定である_ホストとポートとDB名から組み立てられること() {
        assertEquals("jdbc:postgresql://localhost:5432/company", complete().getJdbcUrl());
    }

    @Test
    void getJdbcUrl_正常ケース_urlを指定する_指定値がそのまま返ること() {
        ConnectionConfig config = complete();
        config.setUrl("jdbc:h2:mem:test");
        assertEquals("jdbc:h2:mem:test", config.getJdbcUrl());
    }

    @Test
    void validate_正常ケース_全項目を指定する_例外が送出されないこと() {
        assertDoesNotThrow(() -> complete().validate());
    }

    @Test
    void validate_異常ケース_必須項目が欠落している_欠落した環境変数名が列挙されること() {
        ConnectionConfig config = complete();
        config.setUser(null);
        config.setPort(" ");

        IllegalStateException ex = assertThrows(IllegalStateException.class, config::validate);
        assertEquals("Missing required connection settings: POSTGRES_USER (connection.user), "
                + "POSTGRES_PORT (connection.port)", ex.getMessage());
    }

    @Test
    void validate_正常ケース_urlを指定する_ホスト等は省略できること() {
        ConnectionConfig config = complete();
        config.setUrl("jdbc:h2:mem:test");
        config.setHost(null);
        config.setPort(null);
        config.setDatabase(null);
        assertDoesNotThrow(config::validate);
    }

    @Test
    void デフォルト値_正常ケース_新規生成する_PostgreSQLドライバと方言が設定されていること() {
        ConnectionConfig config = new ConnectionConfig();
        assertEquals("org.postgresql.Driver", config.getDriverClass());
        assertEquals(DialectMode.POSTGRESQL, config.getDialect());
    }

    @Test
    void toString_正常ケース_パスワードを設定する_出力にパスワードが含まれないこと() {
        String text = complete().toString();
        assertTrue(text.contains("company_schema"));
        assertFalse(text.contains("secret"));
    }
}
