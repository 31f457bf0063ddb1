package io.github.yok.csvreconciler.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * One row of a loaded dataset: lower-cased column name → CSV text ({@code null} for an empty
 * cell), in file column order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class SourceRow {

    // Zero-based row index in the dataset
    private final int index;

    // Column → text, in file column order
    private final Map<String, String> values;

    /**
     * Creates a row.
     *
     * @param index zero-based row index
     * @param values column → text, in file column order
     */
    public SourceRow(int index, Map<String, String> values) {
        this.index = index;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the text of a column, or {@code null} when empty or absent.
     *
     * @param column column name in any case
     * @return cell text or {@code null}
     */
    public String get(String column) {
        return values.get(column.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the row's leading identifying value: the value of its first column.
     *
     * @return first column value, or {@code null}
     */
    public String getLeadingValue() {
        return values.isEmpty() ? null : values.values().iterator().next();
    }

    /**
     * Extracts every row of a dataset.
     *
     * @param table dataset produced by {@link TabularLoader}
     * @return rows in dataset order
     * @throws DataSetException if a value cannot be read
     */
    public static List<SourceRow> listOf(ITable table) throws DataSetException {
        Column[] columns = table.getTableMetaData().getColumns();
        List<SourceRow> rows = new ArrayList<>();
        for (int i = 0; i < table.getRowCount(); i++) {
            Map<String, String> values = new LinkedHashMap<>();
            for (Column column : columns) {
                Object value = table.getValue(i, column.getColumnName());
                values.put(column.getColumnName(), value == null ? null : value.toString());
            }
            rows.add(new SourceRow(i, values));
        }
        return rows;
    }
}
