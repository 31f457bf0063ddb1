package io.github.yok.csvreconciler.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.csvreconciler.db.ConnectionFactory;
import io.github.yok.csvreconciler.db.DbDialect;
import io.github.yok.csvreconciler.schema.ColumnDescriptor;
import io.github.yok.csvreconciler.schema.TableDescriptor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each row twice: an immutable copy into the raw archive table, then an idempotent upsert
 * into the canonical table.
 *
 * <p>
 * <strong>Transactions:</strong> each write opens its own connection and commits on its own. The
 * two writes of a row are not atomic: a crash between them leaves an archived row without a
 * canonical counterpart, never the opposite.
 * </p>
 *
 * <p>
 * <strong>Failures:</strong> a failing write (exception or zero rows affected) is rolled back,
 * recorded in the {@link ErrorLedger} and reported through the return value. Nothing is retried
 * and nothing is thrown; the batch continues with the next row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DualWriteReconciler {

    private static final List<String> RAW_COLUMNS = List.of("payload", "timestamp");

    private final ConnectionFactory connectionFactory;

    private final DbDialect dialect;

    private final String schema;

    private final ObjectMapper objectMapper;

    // canonical table → resolved key columns
    private final Map<String, List<String>> keyCache = new HashMap<>();

    /**
     * Creates a reconciler.
     *
     * @param connectionFactory source of per-write connections
     * @param dialect dialect of the target database
     * @param schema schema holding raw and canonical tables (may be blank)
     * @param objectMapper mapper used to encode raw payloads
     */
    public DualWriteReconciler(ConnectionFactory connectionFactory, DbDialect dialect,
            String schema, ObjectMapper objectMapper) {
        this.connectionFactory = connectionFactory;
        this.dialect = dialect;
        this.schema = schema;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts the full row payload and a capture timestamp into {@code raw_<entity>}.
     *
     * <p>
     * Attempted for every loaded row, valid or not.
     * </p>
     *
     * @param row row to archive
     * @param descriptor entity descriptor
     * @param ledger ledger receiving the failure, if any
     * @return {@code true} when one raw record was inserted
     */
    public boolean archive(SourceRow row, TableDescriptor descriptor, ErrorLedger ledger) {
        String rawTable = descriptor.getRawTableName();
        String sql = dialect.buildInsertSql(dialect.qualify(schema, rawTable), RAW_COLUMNS,
                List.of(dialect.getJsonParameter(), "?"));
        try {
            String payload = objectMapper.writeValueAsString(row.getValues());
            executeSingleRowWrite(sql, List.of(payload, LocalDateTime.now()), null,
                    "No rows inserted into raw table.");
            log.debug("[{}] Archived row {}", descriptor.getName(), row.getIndex());
            return true;
        } catch (SQLException | JsonProcessingException | RuntimeException e) {
            ledger.add(rawTable,
                    "Error saving data to raw table " + rawTable + ". Error: " + e.getMessage());
            return false;
        }
    }

    /**
     * Inserts the row into the canonical table, or overwrites every non-key column when a row
     * with the same key exists (last write wins).
     *
     * <p>
     * Only call this for rows accepted by {@link SchemaValidator#validateRow}.
     * </p>
     *
     * @param row validated row
     * @param descriptor entity descriptor
     * @param ledger ledger receiving the failure, if any
     * @return {@code true} when the canonical row was written
     */
    public boolean upsert(SourceRow row, TableDescriptor descriptor, ErrorLedger ledger) {
        String table = descriptor.getName();
        try {
            List<String> keyColumns = resolveKeyColumns(descriptor);
            List<String> insertColumns = descriptor.getColumnNames();
            List<String> updateColumns = new ArrayList<>(insertColumns);
            updateColumns.removeAll(keyColumns);

            String sql = dialect.buildUpsertSql(dialect.qualify(schema, table), keyColumns,
                    insertColumns, updateColumns);
            List<Object> values = new ArrayList<>();
            List<Integer> sqlTypes = new ArrayList<>();
            for (ColumnDescriptor column : descriptor.getColumns().values()) {
                values.add(column.convert(row.get(column.getName())));
                sqlTypes.add(column.getType().getSqlType());
            }
            executeSingleRowWrite(sql, values, sqlTypes, "Could not insert row.");
            log.debug("[{}] Upserted row {}", table, row.getLeadingValue());
            return true;
        } catch (SQLException | RuntimeException e) {
            ledger.add(table, "Error inserting row " + row.getLeadingValue() + ": "
                    + e.getMessage() + ".");
            return false;
        }
    }

    /**
     * Resolves the key columns of a canonical table: the declared primary key, else the primary
     * key found in database metadata, else the first column of the uniqueness constraint.
     *
     * @param descriptor entity descriptor
     * @return key columns (never empty)
     * @throws SQLException if metadata cannot be read or no key can be determined
     */
    List<String> resolveKeyColumns(TableDescriptor descriptor) throws SQLException {
        List<String> cached = keyCache.get(descriptor.getName());
        if (cached != null) {
            return cached;
        }
        List<String> keys;
        Optional<String> declared = descriptor.getDeclaredPrimaryKey();
        if (declared.isPresent()) {
            keys = List.of(declared.get());
        } else {
            try (Connection conn = connectionFactory.open()) {
                keys = dialect.getPrimaryKeyColumns(conn, schema, descriptor.getName());
            }
            if (keys.isEmpty() && !descriptor.getUniqueColumns().isEmpty()) {
                keys = List.of(descriptor.getUniqueColumns().get(0));
            }
        }
        if (keys.isEmpty()) {
            throw new SQLException(
                    "No primary key could be determined for table " + descriptor.getName());
        }
        log.info("[{}] Upsert key columns: {}", descriptor.getName(), keys);
        keyCache.put(descriptor.getName(), keys);
        return keys;
    }

    private void executeSingleRowWrite(String sql, List<Object> values, List<Integer> sqlTypes,
            String noRowsMessage) throws SQLException {
        try (Connection conn = connectionFactory.open()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < values.size(); i++) {
                    Object value = values.get(i);
                    if (value == null && sqlTypes != null) {
                        ps.setNull(i + 1, sqlTypes.get(i));
                    } else {
                        ps.setObject(i + 1, value);
                    }
                }
                int affected = ps.executeUpdate();
                if (affected == 0) {
                    throw new SQLException(noRowsMessage);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(conn);
                throw e;
            }
        }
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
    }
}
