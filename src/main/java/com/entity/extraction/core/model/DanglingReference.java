package com.entity.extraction.core.model;

import java.util.Objects;

/**
 * A relationship whose source and/or target entity is missing from its collection.
 *
 * @param relationshipId the offending relationship
 * @param sourceEntity   the relationship's source entity id
 * @param targetEntity   the relationship's target entity id
 * @param sourceMissing  whether the source id does not resolve
 * @param targetMissing  whether the target id does not resolve
 */
public record DanglingReference(
        String relationshipId,
        String sourceEntity,
        String targetEntity,
        boolean sourceMissing,
        boolean targetMissing
) {
    public DanglingReference {
        Objects.requireNonNull(relationshipId, "relationshipId is required");
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("Relationship ").append(relationshipId).append(" references missing ");
        if (sourceMissing && targetMissing) {
            sb.append("source ").append(sourceEntity).append(" and target ").append(targetEntity);
        } else if (sourceMissing) {
            sb.append("source ").append(sourceEntity);
        } else {
            sb.append("target ").append(targetEntity);
        }
        return sb.toString();
    }
}
