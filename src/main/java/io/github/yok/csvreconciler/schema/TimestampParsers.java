package io.github.yok.csvreconciler.schema;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import lombok.Generated;

/**
 * Shared flexible {@link DateTimeFormatter} used to convert CSV timestamp text.
 *
 * <p>
 * Accepts {@code yyyy-MM-dd'T'HH:mm[:ss][.fraction][offset]} with either {@code T} or a blank as
 * the date/time separator. When an offset ({@code Z}, {@code +09:00}) is present the value is
 * shifted to UTC; otherwise it is taken as UTC already. Out-of-range fields such as
 * {@code 2024-02-30} fail to parse.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TimestampParsers {

    /**
     * Flexible ISO-like date-time parser with optional seconds, fraction and offset. Resolves
     * strictly: impossible dates and {@code 24:00} are rejected, never adjusted.
     */
    public static final DateTimeFormatter FLEXIBLE_DATE_TIME_PARSER =
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart().appendLiteral('T')
                    .optionalEnd().optionalStart().appendLiteral(' ').optionalEnd()
                    .appendPattern("HH:mm").optionalStart().appendPattern(":ss").optionalEnd()
                    .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                    .optionalEnd().optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                    .toFormatter().withResolverStyle(ResolverStyle.STRICT);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TimestampParsers() {}

    /**
     * Parses timestamp text into a UTC {@link LocalDateTime}.
     *
     * @param text timestamp text (e.g. {@code 2024-03-01T10:15:30Z})
     * @return the UTC local date-time
     * @throws DateTimeParseException if the text cannot be parsed
     */
    public static LocalDateTime toUtcLocalDateTime(String text) {
        TemporalAccessor parsed = FLEXIBLE_DATE_TIME_PARSER.parse(text.trim());
        LocalDateTime local = LocalDateTime.from(parsed);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            ZoneOffset offset = ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS));
            return local.atOffset(offset).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        return local;
    }
}
