package io.github.yok.csvreconciler.util;

import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for reading CSV extracts.
 *
 * <p>
 * Extracts are UTF-8, comma separated, with a header record. Empty lines are skipped, cells are
 * not trimmed, and an empty cell stands for {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    // Byte order mark some exporters put in front of the first header
    private static final String BOM = "\uFEFF";

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the format used to read extracts: first record is the header, empty lines are
     * ignored.
     *
     * @return CSV format for reading
     */
    public static CSVFormat readFormat() {
        return CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true).get();
    }

    /**
     * Normalizes a header name: strips a leading byte order mark, trims, and lower-cases.
     *
     * @param header raw header name
     * @return normalized column name
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return StringUtils.removeStart(header, BOM).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the cell of {@code record} under the given header, or {@code null} when the cell is
     * empty or missing from a short record.
     *
     * @param record CSV record
     * @param header header name as it appears in the file
     * @return cell text or {@code null}
     */
    public static String cellOrNull(CSVRecord record, String header) {
        if (!record.isSet(header)) {
            return null;
        }
        return StringUtils.defaultIfEmpty(record.get(header), null);
    }
}
