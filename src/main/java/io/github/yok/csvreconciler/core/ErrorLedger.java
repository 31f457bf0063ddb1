package io.github.yok.csvreconciler.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.csvreconciler.db.DbDialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates the error records of a run and persists them once, at the end of the run.
 *
 * <p>
 * Every record is logged at ERROR level as soon as it is added, so a long run can be followed
 * live. {@link #flush(Connection)} writes all records to the {@code errors} table in a single
 * transaction; a failure there is fatal to the run and propagates to the caller.
 * </p>
 *
 * <p>
 * One ledger is owned by the orchestrator and passed to every operation that can fail.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorLedger {

    /**
     * Name of the durable error table.
     */
    public static final String ERRORS_TABLE = "errors";

    private static final List<String> ERROR_COLUMNS =
            List.of("recordid", "recordtype", "errors", "timestamp");

    private final List<ErrorRecord> records = new ArrayList<>();

    private final DbDialect dialect;

    private final String schema;

    private final ObjectMapper objectMapper;

    /**
     * Creates an empty ledger.
     *
     * @param dialect dialect of the target database
     * @param schema schema holding the {@code errors} table (may be blank)
     * @param objectMapper mapper used to encode messages as JSON strings
     */
    public ErrorLedger(DbDialect dialect, String schema, ObjectMapper objectMapper) {
        this.dialect = dialect;
        this.schema = schema;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends an error record and logs it.
     *
     * @param recordId identifier of the failure
     * @param recordType entity, table or file the failure relates to
     * @param message human-readable message
     * @return the appended record
     */
    public ErrorRecord add(String recordId, String recordType, String message) {
        log.error("Record: {} - id: {} - error: {}", recordType, recordId, message);
        ErrorRecord record = new ErrorRecord(recordId, recordType, message, LocalDateTime.now());
        records.add(record);
        return record;
    }

    /**
     * Appends an error record with a freshly generated random identifier.
     *
     * @param recordType entity, table or file the failure relates to
     * @param message human-readable message
     * @return the appended record
     */
    public ErrorRecord add(String recordType, String message) {
        return add(UUID.randomUUID().toString(), recordType, message);
    }

    /**
     * Returns the accumulated records in insertion order.
     *
     * @return unmodifiable view of the records
     */
    public List<ErrorRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    /**
     * Returns the number of accumulated records.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Returns whether no record has been accumulated.
     *
     * @return {@code true} when empty
     */
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Counts the records of one record type.
     *
     * @param recordType entity, table or file
     * @return number of records with that type
     */
    public long countByType(String recordType) {
        return records.stream().filter(r -> r.getRecordType().equals(recordType)).count();
    }

    /**
     * Writes every accumulated record to the {@code errors} table in one transaction and drains
     * the ledger. Does nothing when the ledger is empty.
     *
     * <p>
     * The caller owns {@code connection} and closes it. On failure the transaction is rolled
     * back, the ledger keeps its records, and the exception propagates.
     * </p>
     *
     * @param connection JDBC connection
     * @throws SQLException if the records cannot be persisted
     */
    public void flush(Connection connection) throws SQLException {
        log.info("Saving {} error record(s) to database", records.size());
        if (records.isEmpty()) {
            return;
        }

        String sql = dialect.buildInsertSql(dialect.qualify(schema, ERRORS_TABLE), ERROR_COLUMNS,
                List.of("?", "?", dialect.getJsonParameter(), "?"));
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (ErrorRecord record : records) {
                ps.setString(1, record.getRecordId());
                ps.setString(2, record.getRecordType());
                ps.setString(3, toJson(record.getErrors()));
                ps.setObject(4, record.getTimestamp());
                ps.addBatch();
            }
            ps.executeBatch();
            connection.commit();
        } catch (SQLException e) {
            try {
                connection.rollback();
                log.warn("Error flush rolled back.");
            } catch (SQLException rollbackEx) {
                log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }

        log.info("Saved {} error record(s) to {}", records.size(), ERRORS_TABLE);
        records.clear();
    }

    private String toJson(String message) throws SQLException {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to encode error message as JSON", e);
        }
    }
}
