package io.github.yok.csvreconciler.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one reconciliation run: counters per processed entity, in processing order, and the
 * number of error records persisted.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public class RunSummary {

    private final Map<String, EntitySummary> entities = new LinkedHashMap<>();

    @Getter
    private int errorCount;

    EntitySummary start(String entity) {
        return entities.computeIfAbsent(entity, EntitySummary::new);
    }

    void setErrorCount(int errorCount) {
        this.errorCount = errorCount;
    }

    /**
     * Returns the counters of every processed entity.
     *
     * @return unmodifiable entity → counters map, in processing order
     */
    public Map<String, EntitySummary> getEntities() {
        return Collections.unmodifiableMap(entities);
    }

    /**
     * Returns the counters of one entity.
     *
     * @param entity entity name
     * @return counters, or empty when the entity was not processed
     */
    public Optional<EntitySummary> getEntity(String entity) {
        return Optional.ofNullable(entities.get(entity));
    }
}
