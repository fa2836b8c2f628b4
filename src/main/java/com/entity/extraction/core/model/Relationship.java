package com.entity.extraction.core.model;

import com.entity.extraction.confidence.ConfidenceCalculator;

import java.util.Objects;

/**
 * Directed, typed link between two entities of the same collection.
 *
 * Relationships are never merged; a composite merge keeps every relationship
 * reported by every extractor.
 */
public final class Relationship {

    private final String id;
    private final String sourceEntity;
    private final String targetEntity;
    private final String type;
    private double confidence;
    private final Metadata metadata;

    private Relationship(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.sourceEntity = Objects.requireNonNull(builder.sourceEntity, "sourceEntity is required");
        this.targetEntity = Objects.requireNonNull(builder.targetEntity, "targetEntity is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.confidence = ConfidenceCalculator.clamp(builder.confidence);
        this.metadata = builder.metadata != null ? builder.metadata : new Metadata();
    }

    public String getId() {
        return id;
    }

    public String getSourceEntity() {
        return sourceEntity;
    }

    public String getTargetEntity() {
        return targetEntity;
    }

    public String getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = ConfidenceCalculator.clamp(confidence);
    }

    public Metadata getMetadata() {
        return metadata;
    }

    /**
     * True when the entity is either endpoint of this relationship.
     */
    public boolean involves(String entityId) {
        return sourceEntity.equals(entityId) || targetEntity.equals(entityId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", sourceEntity='" + sourceEntity + '\'' +
                ", targetEntity='" + targetEntity + '\'' +
                ", type='" + type + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from an existing relationship, metadata deep-copied.
     */
    public static Builder builder(Relationship relationship) {
        return new Builder()
                .id(relationship.id)
                .sourceEntity(relationship.sourceEntity)
                .targetEntity(relationship.targetEntity)
                .type(relationship.type)
                .confidence(relationship.confidence)
                .metadata(relationship.metadata.copy());
    }

    public static class Builder {
        private String id;
        private String sourceEntity;
        private String targetEntity;
        private String type;
        private double confidence = 1.0;
        private Metadata metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceEntity(String sourceEntity) {
            this.sourceEntity = sourceEntity;
            return this;
        }

        public Builder targetEntity(String targetEntity) {
            this.targetEntity = targetEntity;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
