package com.entity.extraction.merge;

import com.entity.extraction.core.model.EntityCollection;

import java.util.List;
import java.util.Objects;

/**
 * Result of a composite merge.
 *
 * @param collection          the merged collection
 * @param failures            capabilities that failed, in capability order
 * @param entitiesAdded       entities appended as new
 * @param duplicatesCollapsed entities folded into an existing entity with the same name and type
 * @param relationshipsAdded  relationships appended
 */
public record MergeResult(
        EntityCollection collection,
        List<CapabilityFailure> failures,
        int entitiesAdded,
        int duplicatesCollapsed,
        int relationshipsAdded
) {
    public MergeResult {
        Objects.requireNonNull(collection, "collection is required");
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    /**
     * True when every capability contributed.
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
