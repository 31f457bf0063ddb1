package io.github.yok.csvreconciler.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * SQL grammar and metadata operations that differ between database products.
 *
 * <p>
 * Identifiers passed to this interface are lower-case logical names; each dialect decides how they
 * map to physical identifiers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialect {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier logical identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns the parameter expression used to bind a JSON document given as text.
     *
     * @return parameter expression (contains exactly one {@code ?})
     */
    String getJsonParameter();

    /**
     * Builds dialect-specific upsert SQL: insert, or overwrite {@code updateColumns} when a row
     * with the same key already exists. Parameters follow {@code insertColumns} order.
     *
     * @param qualifiedTable table name already qualified and quoted
     * @param keyColumns key columns
     * @param insertColumns insert columns
     * @param updateColumns update columns
     * @return upsert SQL
     */
    String buildUpsertSql(String qualifiedTable, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns);

    /**
     * Returns the primary key column names of a table, lower-cased, in key sequence order.
     *
     * @param connection JDBC connection
     * @param schema logical schema name (may be blank)
     * @param table logical table name
     * @return PK column names (empty if none)
     * @throws SQLException on SQL error while reading PK metadata
     */
    List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException;

    /**
     * Qualifies a table name with its schema.
     *
     * @param schema logical schema name; blank for none
     * @param table logical table name
     * @return quoted, qualified table name
     */
    default String qualify(String schema, String table) {
        if (StringUtils.isBlank(schema)) {
            return quoteIdentifier(table);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    /**
     * Builds a plain INSERT statement.
     *
     * @param qualifiedTable table name already qualified and quoted
     * @param columns logical column names
     * @param parameters parameter expressions, one per column (e.g. {@code ?})
     * @return INSERT SQL
     */
    default String buildInsertSql(String qualifiedTable, List<String> columns,
            List<String> parameters) {
        if (columns.size() != parameters.size()) {
            throw new IllegalArgumentException("columns and parameters differ in size: "
                    + columns.size() + " != " + parameters.size());
        }
        return "INSERT INTO " + qualifiedTable + " ("
                + columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "))
                + ") VALUES (" + String.join(", ", parameters) + ")";
    }

    /**
     * Returns {@code count} plain {@code ?} parameter expressions.
     *
     * @param count number of parameters
     * @return list of {@code ?}
     */
    static List<String> plainParameters(int count) {
        List<String> marks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            marks.add("?");
        }
        return marks;
    }
}
