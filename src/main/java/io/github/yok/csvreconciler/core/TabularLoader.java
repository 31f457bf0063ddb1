package io.github.yok.csvreconciler.core;

import io.github.yok.csvreconciler.util.CsvUtils;
import io.github.yok.csvreconciler.util.LogPathUtil;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Reads one CSV extract into an in-memory DBUnit {@link ITable}.
 *
 * <p>
 * Column names are normalized to lower case; empty cells become {@code null}; all values are kept
 * as text. Type interpretation is left to the {@link SchemaValidator}.
 * </p>
 *
 * <p>
 * Files are decoded as strict UTF-8: an invalid byte sequence is a read failure.
 * </p>
 *
 * <p>
 * A read or parse failure never halts the batch: it is recorded in the {@link ErrorLedger} under
 * the file path and an empty table is returned. The caller treats an empty table as "no data".
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TabularLoader {

    /**
     * Loads a CSV file.
     *
     * @param entity entity name, used as the table name of the dataset
     * @param file CSV file
     * @param ledger ledger receiving the load error, if any
     * @return loaded dataset, or an empty dataset on failure
     */
    public ITable load(String entity, Path file, ErrorLedger ledger) {
        log.info("[{}] Reading CSV file: {}", entity, LogPathUtil.renderPathForLog(file));
        if (!FilenameUtils.isExtension(String.valueOf(file.getFileName()), "csv")) {
            log.warn("[{}] Source file has no .csv extension: {}", entity, file.getFileName());
        }
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), strictUtf8());
                CSVParser parser = CSVParser.parse(reader, CsvUtils.readFormat())) {
            List<String> headers = parser.getHeaderNames();
            Column[] columns = toColumns(headers);
            DefaultTable table = new DefaultTable(entity, columns);
            for (CSVRecord record : parser) {
                Object[] values = new Object[headers.size()];
                for (int i = 0; i < headers.size(); i++) {
                    values[i] = CsvUtils.cellOrNull(record, headers.get(i));
                }
                table.addRow(values);
            }
            log.info("[{}] Loaded rows={}, columns={}", entity, table.getRowCount(),
                    columns.length);
            return table;
        } catch (IOException | UncheckedIOException | DataSetException
                | IllegalArgumentException | IllegalStateException e) {
            ledger.add(file.toString(),
                    "Error reading CSV file: " + file + ". Error: " + e.getMessage());
            return new DefaultTable(entity, new Column[0]);
        }
    }

    // malformed bytes fail the load instead of turning into U+FFFD
    private static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static Column[] toColumns(List<String> headers) throws IOException {
        Set<String> names = new LinkedHashSet<>();
        for (String header : headers) {
            String name = CsvUtils.normalizeHeader(header);
            if (name.isEmpty()) {
                throw new IOException("Blank column header at position " + (names.size() + 1));
            }
            if (!names.add(name)) {
                throw new IOException("Duplicate column header: " + name);
            }
        }
        return names.stream().map(name -> new Column(name, DataType.VARCHAR))
                .toArray(Column[]::new);
    }
}
