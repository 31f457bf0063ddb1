package io.github.yok.csvreconciler.schema;

import com.google.common.base.Preconditions;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable declaration of one column of an entity.
 *
 * <p>
 * The name is normalized to lower case so that CSV headers match case-insensitively.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ColumnDescriptor {

    // Lower-cased column name
    private final String name;

    // Declared value type
    private final ColumnType type;

    // Whether null (empty CSV cell) is allowed
    private final boolean nullable;

    // Optional full-match constraint; null when none
    private final Pattern pattern;

    // Whether values must be unique within one file
    private final boolean unique;

    /**
     * Creates a column descriptor.
     *
     * @param name column name (any case)
     * @param type declared type
     * @param nullable whether null is allowed
     * @param pattern regular expression the value must fully match, or {@code null}
     * @param unique whether values must be unique within a dataset
     * @throws IllegalArgumentException if {@code name} is blank
     * @throws NullPointerException if {@code type} is {@code null}
     */
    public ColumnDescriptor(String name, ColumnType type, boolean nullable, String pattern,
            boolean unique) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "column name must not be blank");
        Preconditions.checkNotNull(type, "type must not be null (column=%s)", name);
        this.name = name.trim().toLowerCase(Locale.ROOT);
        this.type = type;
        this.nullable = nullable;
        this.pattern = StringUtils.isBlank(pattern) ? null : Pattern.compile(pattern);
        this.unique = unique;
    }

    /**
     * Returns whether a single cell value satisfies this column at row level.
     *
     * <p>
     * A value is acceptable when the column is nullable and the value is {@code null}, or when the
     * value is accepted by the declared {@link ColumnType}.
     * </p>
     *
     * @param value CSV text, {@code null} for an empty cell
     * @return {@code true} when acceptable
     */
    public boolean accepts(String value) {
        if (value == null) {
            return nullable;
        }
        return type.accepts(value, pattern);
    }

    /**
     * Returns whether the value matches the declared pattern. Always {@code true} without a
     * pattern or for {@code null}.
     *
     * @param value CSV text
     * @return {@code true} when the pattern is absent or fully matches
     */
    public boolean matchesPattern(String value) {
        return pattern == null || value == null || pattern.matcher(value).matches();
    }

    /**
     * Converts an accepted value to its bind value.
     *
     * @param value accepted CSV text, may be {@code null} for nullable columns
     * @return converted value or {@code null}
     */
    public Object convert(String value) {
        return value == null ? null : type.convert(value);
    }
}
