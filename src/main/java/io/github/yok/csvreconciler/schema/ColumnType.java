package io.github.yok.csvreconciler.schema;

import java.sql.Types;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Enumerates the value types a column descriptor can declare.
 *
 * <p>
 * Each constant carries its own acceptance predicate and its own conversion from the CSV text
 * representation to the value bound to the canonical table. No runtime type introspection takes
 * place: a value is valid for a column exactly when the column type accepts its text.
 * </p>
 *
 * <ul>
 * <li>{@link #STRING}: any non-null text, bound as {@link String}</li>
 * <li>{@link #INTEGER}: integral text within the {@code long} range, bound as {@link Long}</li>
 * <li>{@link #FLOAT}: decimal text (integral text included), bound as {@link Double}</li>
 * <li>{@link #TIMESTAMP}: text matching the column pattern, bound as a UTC
 * {@link LocalDateTime}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ColumnType {

    STRING(Types.VARCHAR) {
        @Override
        public boolean accepts(String value, Pattern pattern) {
            return value != null;
        }

        @Override
        public Object convert(String value) {
            return value;
        }
    },

    INTEGER(Types.BIGINT) {
        @Override
        public boolean accepts(String value, Pattern pattern) {
            if (value == null || !INTEGER_TEXT.matcher(value).matches()) {
                return false;
            }
            try {
                Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        @Override
        public Object convert(String value) {
            return Long.valueOf(value.startsWith("+") ? value.substring(1) : value);
        }
    },

    FLOAT(Types.DOUBLE) {
        @Override
        public boolean accepts(String value, Pattern pattern) {
            if (value == null || !DECIMAL_TEXT.matcher(value).matches()) {
                return false;
            }
            return Double.isFinite(Double.parseDouble(value));
        }

        @Override
        public Object convert(String value) {
            return Double.valueOf(value);
        }
    },

    TIMESTAMP(Types.TIMESTAMP) {
        @Override
        public boolean accepts(String value, Pattern pattern) {
            if (value == null) {
                return false;
            }
            Pattern effective = pattern != null ? pattern : DEFAULT_TIMESTAMP_PATTERN;
            if (!effective.matcher(value).matches()) {
                return false;
            }
            try {
                TimestampParsers.toUtcLocalDateTime(value);
                return true;
            } catch (DateTimeException e) {
                return false;
            }
        }

        @Override
        public Object convert(String value) {
            return TimestampParsers.toUtcLocalDateTime(value);
        }
    };

    /**
     * Pattern applied to {@link #TIMESTAMP} columns that declare none.
     */
    public static final Pattern DEFAULT_TIMESTAMP_PATTERN =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z");

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    private static final Pattern DECIMAL_TEXT =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    // java.sql.Types code used when binding null
    private final int sqlType;

    ColumnType(int sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Returns the {@link Types} code used when binding a {@code null} of this type.
     *
     * @return JDBC type code
     */
    public int getSqlType() {
        return sqlType;
    }

    /**
     * Returns whether the given CSV text is a value of this type.
     *
     * @param value CSV text; {@code null} is never accepted
     * @param pattern column pattern, or {@code null}; only {@link #TIMESTAMP} consults it
     * @return {@code true} when the value belongs to this type
     */
    public abstract boolean accepts(String value, Pattern pattern);

    /**
     * Converts CSV text already accepted by {@link #accepts(String, Pattern)} to its bind value.
     *
     * @param value accepted CSV text
     * @return value to bind to the canonical table
     */
    public abstract Object convert(String value);

    /**
     * Resolves a type from its configuration name, case-insensitively.
     *
     * <p>
     * Besides the constant names, the aliases {@code str}, {@code int}, {@code double} and
     * {@code datetime} are recognized.
     * </p>
     *
     * @param name configuration value (e.g. {@code "integer"})
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ColumnType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column type must not be null.");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string":
            case "str":
                return STRING;
            case "integer":
            case "int":
                return INTEGER;
            case "float":
            case "double":
                return FLOAT;
            case "timestamp":
            case "datetime":
                return TIMESTAMP;
            default:
                throw new IllegalArgumentException("Unsupported column type: " + name);
        }
    }
}
