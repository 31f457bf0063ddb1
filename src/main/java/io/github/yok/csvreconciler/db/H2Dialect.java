package io.github.yok.csvreconciler.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Dialect for the H2 database.
 *
 * <p>
 * H2 folds unquoted identifiers to upper case, so logical names are upper-cased before quoting.
 * Payload columns are plain character columns; JSON text is bound with a plain {@code ?}. Upsert
 * uses {@code MERGE INTO ... KEY (...) VALUES (...)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class H2Dialect implements DbDialect {

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.toUpperCase(Locale.ROOT).replace("\"", "\"\"") + "\"";
    }

    @Override
    public String getJsonParameter() {
        return "?";
    }

    @Override
    public String buildUpsertSql(String qualifiedTable, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns) {
        // MERGE ... KEY overwrites every non-key column given in the column list
        return "MERGE INTO " + qualifiedTable + " ("
                + insertColumns.stream().map(this::quoteIdentifier)
                        .collect(Collectors.joining(", "))
                + ") KEY ("
                + keyColumns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "))
                + ") VALUES (" + String.join(", ", DbDialect.plainParameters(insertColumns.size()))
                + ")";
    }

    @Override
    public List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String physicalSchema =
                StringUtils.isBlank(schema) ? null : schema.toUpperCase(Locale.ROOT);
        Map<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs =
                meta.getPrimaryKeys(null, physicalSchema, table.toUpperCase(Locale.ROOT))) {
            while (rs.next()) {
                bySequence.put(rs.getShort("KEY_SEQ"),
                        rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(bySequence.values());
    }
}
