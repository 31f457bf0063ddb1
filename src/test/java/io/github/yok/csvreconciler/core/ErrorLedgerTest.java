package io.github.yok.csvreconciler.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.csvreconciler.db.H2Dialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ErrorLedgerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private H2TestDatabase db;

    private ErrorLedger ledger;

    @BeforeEach
    void setup() throws Exception {
        db = new H2TestDatabase();
        ledger = new ErrorLedger(new H2Dialect(), H2TestDatabase.SCHEMA, objectMapper);
    }

    @AfterEach
    void teardown() throws Exception {
        db.shutdown();
    }

    @Test
    void add_正常ケース_種別とメッセージを指定する_UUIDと時刻付きで保持されること() {
        ErrorRecord record = ledger.add("orders", "No data found in CSV file.");

        assertEquals(1, ledger.size());
        assertSame(record, ledger.getRecords().get(0));
        assertEquals("orders", record.getRecordType());
        assertEquals("No data found in CSV file.", record.getErrors());
        assertNotNull(UUID.fromString(record.getRecordId()));
        assertNotNull(record.getTimestamp());
    }

    @Test
    void countByType_正常ケース_複数種別を追加する_種別ごとの件数が返ること() {
        ledger.add("orders", "a");
        ledger.add("products", "b");
        ledger.add("id-1", "orders", "c");

        assertEquals(2, ledger.countByType("orders"));
        assertEquals(1, ledger.countByType("products"));
        assertEquals(0, ledger.countByType("raw_orders"));
    }

    @Test
    void getRecords_異常ケース_返却リストを変更する_UnsupportedOperationExceptionが送出されること() {
        ledger.add("orders", "a");
        assertThrows(UnsupportedOperationException.class, () -> ledger.getRecords().clear());
    }

    @Test
    void flush_正常ケース_記録ありでフラッシュする_errors表へ保存され台帳が空になること() throws Exception {
        ledger.add("rec-1", "orders", "Invalid fields for columns in row O3: [(quantity, ten)]");
        ledger.add("rec-2", "raw_orders", "Error saving data to raw table raw_orders. Error: x");

        try (Connection conn = db.open()) {
            ledger.flush(conn);
            assertTrue(conn.getAutoCommit());
        }

        assertTrue(ledger.isEmpty());
        assertEquals(2, db.count("ERRORS"));
        try (Connection conn = db.open();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT \"RECORDTYPE\", \"ERRORS\", \"TIMESTAMP\" "
                        + "FROM RECONCILE.ERRORS WHERE \"RECORDID\" = 'rec-1'")) {
            assertTrue(rs.next());
            assertEquals("orders", rs.getString(1));
            // メッセージはJSON文字列として保存される
            assertEquals("Invalid fields for columns in row O3: [(quantity, ten)]",
                    objectMapper.readValue(rs.getString(2), String.class));
            assertNotNull(rs.getTimestamp(3));
        }
    }

    @Test
    void flush_正常ケース_記録なしでフラッシュする_接続が使われないこと() throws Exception {
        Connection conn = mock(Connection.class);
        ledger.flush(conn);
        verifyNoInteractions(conn);
    }

    @Test
    void flush_異常ケース_バッチ実行が失敗する_ロールバックされ例外が伝播し記録が残ること()
            throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeBatch()).thenThrow(new SQLException("disk full"));

        ledger.add("orders", "No data found in CSV file.");

        SQLException ex = assertThrows(SQLException.class, () -> ledger.flush(conn));
        assertEquals("disk full", ex.getMessage());
        verify(conn).rollback();
        verify(conn, never()).commit();
        verify(conn).setAutoCommit(true);
        assertEquals(1, ledger.size());
    }

    @Test
    void flush_異常ケース_errors表が存在しない_SQLExceptionが伝播すること() throws Exception {
        ErrorLedger missingSchema = new ErrorLedger(new H2Dialect(), "nowhere", objectMapper);
        missingSchema.add("orders", "x");

        try (Connection conn = db.open()) {
            assertThrows(SQLException.class, () -> missingSchema.flush(conn));
        }
        assertEquals(1, missingSchema.size());
    }
}
