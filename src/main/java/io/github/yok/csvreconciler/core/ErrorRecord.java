package io.github.yok.csvreconciler.core;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One failure encountered during a run, as persisted to the {@code errors} table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public final class ErrorRecord {

    // Identifier generated per failure
    private final String recordId;

    // Entity, table or file path the failure relates to
    private final String recordType;

    // Human-readable message
    private final String errors;

    // Time the failure was recorded
    private final LocalDateTime timestamp;
}
