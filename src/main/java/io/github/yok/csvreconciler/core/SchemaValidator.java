package io.github.yok.csvreconciler.core;

import io.github.yok.csvreconciler.schema.ColumnDescriptor;
import io.github.yok.csvreconciler.schema.TableDescriptor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Validates loaded datasets and single rows against a {@link TableDescriptor}.
 *
 * <ul>
 * <li><strong>Dataset validation</strong> checks every constraint across the whole dataset
 * (presence, type, nullability, pattern, uniqueness) and reports all failures in one aggregated
 * error record. It is advisory: rows are still processed afterwards.</li>
 * <li><strong>Row validation</strong> is the enforcement point: only rows it accepts are
 * upserted into the canonical table.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaValidator {

    // Maximum number of offending values quoted per failing constraint
    private static final int MAX_FAILURE_CASES = 5;

    /**
     * Validates a whole dataset against a descriptor.
     *
     * <p>
     * All failing constraints are collected and reported as a single error record tagged with the
     * descriptor name. Columns present in the dataset but not declared are ignored.
     * </p>
     *
     * @param dataset loaded dataset
     * @param descriptor table descriptor
     * @param ledger ledger receiving the aggregated error
     * @return {@code true} when no constraint fails
     */
    public boolean validateDataset(ITable dataset, TableDescriptor descriptor,
            ErrorLedger ledger) {
        log.info("[{}] Validating schema", descriptor.getName());
        List<String> failures;
        try {
            failures = collectFailures(dataset, descriptor);
        } catch (DataSetException e) {
            failures = List.of("dataset could not be read: " + e.getMessage());
        }
        if (failures.isEmpty()) {
            log.info("[{}] Schema validation passed", descriptor.getName());
            return true;
        }
        ledger.add(descriptor.getName(), "Error validating schema for " + descriptor.getName()
                + ": " + String.join("; ", failures));
        return false;
    }

    /**
     * Validates one row against a descriptor.
     *
     * <p>
     * For every declared column, the value is acceptable if the column is nullable and the value
     * is {@code null}, or if the value is accepted by the column type. Offending
     * {@code (column, value)} pairs are reported in one error record naming the row's leading
     * value.
     * </p>
     *
     * @param row row to validate
     * @param descriptor table descriptor
     * @param ledger ledger receiving the row error
     * @return {@code true} when the row may be upserted
     */
    public boolean validateRow(SourceRow row, TableDescriptor descriptor, ErrorLedger ledger) {
        List<String> errorFields = new ArrayList<>();
        for (ColumnDescriptor column : descriptor.getColumns().values()) {
            String value = row.get(column.getName());
            if (!column.accepts(value)) {
                errorFields.add("(" + column.getName() + ", " + value + ")");
            }
        }
        if (errorFields.isEmpty()) {
            return true;
        }
        ledger.add(descriptor.getName(), "Invalid fields for columns in row "
                + row.getLeadingValue() + ": [" + String.join(", ", errorFields) + "]");
        return false;
    }

    private List<String> collectFailures(ITable dataset, TableDescriptor descriptor)
            throws DataSetException {
        Set<String> present = new HashSet<>();
        for (Column column : dataset.getTableMetaData().getColumns()) {
            present.add(column.getColumnName());
        }
        List<SourceRow> rows = SourceRow.listOf(dataset);

        List<String> failures = new ArrayList<>();
        for (ColumnDescriptor column : descriptor.getColumns().values()) {
            String name = column.getName();
            if (!present.contains(name)) {
                failures.add("column '" + name + "': missing from dataset");
                continue;
            }
            List<String> nulls = new ArrayList<>();
            List<String> wrongType = new ArrayList<>();
            List<String> patternMismatch = new ArrayList<>();
            for (SourceRow row : rows) {
                String value = row.get(name);
                if (value == null) {
                    if (!column.isNullable()) {
                        nulls.add("row " + row.getIndex());
                    }
                    continue;
                }
                if (!column.getType().accepts(value, column.getPattern())) {
                    wrongType.add(value);
                } else if (!column.matchesPattern(value)) {
                    patternMismatch.add(value);
                }
            }
            addFailure(failures, name, nulls, "null value(s) in non-nullable column");
            addFailure(failures, name, wrongType,
                    "value(s) not of type " + column.getType().name());
            addFailure(failures, name, patternMismatch,
                    "value(s) not matching pattern " + column.getPattern());
            if (column.isUnique()) {
                addFailure(failures, name, duplicates(rows, List.of(name)),
                        "duplicated value(s)");
            }
        }

        List<String> uniqueColumns = descriptor.getUniqueColumns();
        if (!uniqueColumns.isEmpty() && present.containsAll(uniqueColumns)) {
            List<String> duplicated = duplicates(rows, uniqueColumns);
            if (!duplicated.isEmpty()) {
                failures.add("unique constraint " + uniqueColumns + ": " + duplicated.size()
                        + " duplicated row(s), e.g. " + sample(duplicated));
            }
        }
        return failures;
    }

    private static List<String> duplicates(List<SourceRow> rows, List<String> columns) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicated = new LinkedHashSet<>();
        for (SourceRow row : rows) {
            String key = columns.stream().map(row::get).map(String::valueOf)
                    .collect(Collectors.joining("|"));
            if (!seen.add(key)) {
                duplicated.add(key);
            }
        }
        return new ArrayList<>(duplicated);
    }

    private static void addFailure(List<String> failures, String column, List<String> cases,
            String description) {
        if (!cases.isEmpty()) {
            failures.add("column '" + column + "': " + cases.size() + " " + description
                    + ", e.g. " + sample(cases));
        }
    }

    private static String sample(List<String> cases) {
        return cases.stream().limit(MAX_FAILURE_CASES).collect(Collectors.toList()).toString();
    }
}
