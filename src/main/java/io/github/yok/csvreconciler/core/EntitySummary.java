package io.github.yok.csvreconciler.core;

import lombok.Getter;
import lombok.ToString;

/**
 * Row counters of one entity within a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class EntitySummary {

    private final String entity;

    private int loaded;

    private int archived;

    private int archiveFailed;

    private int valid;

    private int upserted;

    private int upsertFailed;

    private int rejected;

    // Set when the file produced no rows
    private boolean skipped;

    /**
     * Creates zeroed counters for an entity.
     *
     * @param entity entity name
     */
    public EntitySummary(String entity) {
        this.entity = entity;
    }

    void setLoaded(int loaded) {
        this.loaded = loaded;
    }

    void markSkipped() {
        this.skipped = true;
    }

    void recordArchive(boolean success) {
        if (success) {
            archived++;
        } else {
            archiveFailed++;
        }
    }

    void recordRejected() {
        rejected++;
    }

    void recordUpsert(boolean success) {
        valid++;
        if (success) {
            upserted++;
        } else {
            upsertFailed++;
        }
    }
}
