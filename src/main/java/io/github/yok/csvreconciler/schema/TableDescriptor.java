package io.github.yok.csvreconciler.schema;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable declaration of one entity: its canonical table, its columns in declaration order and
 * its uniqueness constraint.
 *
 * <p>
 * The raw archive table of an entity is always {@code raw_<name>}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class TableDescriptor {

    /**
     * Prefix of the raw archive table.
     */
    public static final String RAW_TABLE_PREFIX = "raw_";

    // Entity name, also the canonical table name (lower case)
    private final String name;

    // Source CSV file name, relative to the data directory
    private final String file;

    // Column name (lower case) → descriptor, in declaration order
    private final Map<String, ColumnDescriptor> columns;

    // Columns forming the table uniqueness constraint (lower case)
    private final List<String> uniqueColumns;

    // Declared primary key column (lower case); null to resolve from database metadata
    @Getter(AccessLevel.NONE)
    private final String primaryKey;

    /**
     * Creates a table descriptor.
     *
     * @param name entity / canonical table name
     * @param file source CSV file name; {@code <name>.csv} when blank
     * @param columns columns in declaration order
     * @param uniqueColumns columns forming the uniqueness constraint (may be empty)
     * @param primaryKey declared primary key column, or {@code null}
     * @throws IllegalArgumentException if a name is blank, a column is duplicated, or a unique /
     *         primary key column is not declared
     */
    public TableDescriptor(String name, String file, List<ColumnDescriptor> columns,
            List<String> uniqueColumns, String primaryKey) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "table name must not be blank");
        Preconditions.checkArgument(columns != null && !columns.isEmpty(),
                "table %s must declare at least one column", name);
        this.name = name.trim().toLowerCase(Locale.ROOT);
        this.file = StringUtils.isBlank(file) ? this.name + ".csv" : file.trim();

        Map<String, ColumnDescriptor> cols = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            Preconditions.checkArgument(cols.put(column.getName(), column) == null,
                    "duplicate column %s in table %s", column.getName(), this.name);
        }
        this.columns = Collections.unmodifiableMap(cols);

        List<String> unique = new ArrayList<>();
        if (uniqueColumns != null) {
            for (String col : uniqueColumns) {
                String normalized = normalize(col);
                Preconditions.checkArgument(cols.containsKey(normalized),
                        "unique column %s is not declared in table %s", col, this.name);
                unique.add(normalized);
            }
        }
        this.uniqueColumns = Collections.unmodifiableList(unique);

        if (StringUtils.isBlank(primaryKey)) {
            this.primaryKey = null;
        } else {
            String normalized = normalize(primaryKey);
            Preconditions.checkArgument(cols.containsKey(normalized),
                    "primary key column %s is not declared in table %s", primaryKey, this.name);
            this.primaryKey = normalized;
        }
    }

    /**
     * Returns the raw archive table name ({@code raw_<name>}).
     *
     * @return raw table name
     */
    public String getRawTableName() {
        return RAW_TABLE_PREFIX + name;
    }

    /**
     * Looks up a column case-insensitively.
     *
     * @param columnName column name in any case
     * @return the descriptor, or empty when not declared
     */
    public Optional<ColumnDescriptor> getColumn(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(normalize(columnName)));
    }

    /**
     * Returns the declared column names in order.
     *
     * @return lower-cased column names
     */
    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /**
     * Returns the declared primary key column.
     *
     * @return primary key column, or empty when it must be resolved from database metadata
     */
    public Optional<String> getDeclaredPrimaryKey() {
        return Optional.ofNullable(primaryKey);
    }

    private static String normalize(String columnName) {
        return columnName.trim().toLowerCase(Locale.ROOT);
    }
}
