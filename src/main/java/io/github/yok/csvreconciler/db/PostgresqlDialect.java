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

/**
 * Dialect for PostgreSQL.
 *
 * <ul>
 * <li>Identifiers are quoted with double quotes and kept lower case.</li>
 * <li>JSON payloads are bound as {@code CAST(? AS jsonb)}.</li>
 * <li>Upsert uses {@code INSERT ... ON CONFLICT (key) DO UPDATE SET col = EXCLUDED.col}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialect implements DbDialect {

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String getJsonParameter() {
        return "CAST(? AS jsonb)";
    }

    /**
     * Builds {@code INSERT ... ON CONFLICT} upsert SQL.
     *
     * <p>
     * When {@code updateColumns} is empty the conflict action is {@code DO NOTHING}.
     * </p>
     *
     * @param qualifiedTable table name already qualified and quoted
     * @param keyColumns conflict target columns
     * @param insertColumns insert columns
     * @param updateColumns columns overwritten on conflict
     * @return upsert SQL
     */
    @Override
    public String buildUpsertSql(String qualifiedTable, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns) {
        StringBuilder sb = new StringBuilder();
        sb.append(buildInsertSql(qualifiedTable, insertColumns,
                DbDialect.plainParameters(insertColumns.size())));
        sb.append(" ON CONFLICT (");
        sb.append(keyColumns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", ")));
        sb.append(")");
        if (updateColumns.isEmpty()) {
            sb.append(" DO NOTHING");
            return sb.toString();
        }
        sb.append(" DO UPDATE SET ");
        List<String> sets = new ArrayList<>();
        for (String col : updateColumns) {
            String quoted = quoteIdentifier(col);
            sets.add(quoted + " = EXCLUDED." + quoted);
        }
        sb.append(String.join(", ", sets));
        return sb.toString();
    }

    @Override
    public List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        Map<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(null, schema, table)) {
            while (rs.next()) {
                bySequence.put(rs.getShort("KEY_SEQ"),
                        rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(bySequence.values());
    }
}
