package com.entity.extraction.core.model;

import com.entity.extraction.confidence.ConfidenceCalculator;

import java.util.Objects;

/**
 * An entity mention extracted from source text.
 *
 * <p>Identity ({@link #getId()}) never changes. Only the confidence (raised during a
 * composite merge) and the metadata (observations, metadata union) are mutable.</p>
 */
public class Entity {
    private final String id;
    private final String name;
    private final String type;
    private final String sourceText;
    private final int startPosition;
    private final int endPosition;
    private double confidence;
    private final Metadata metadata;

    private Entity(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.sourceText = builder.sourceText != null ? builder.sourceText : builder.name;
        if (builder.startPosition < 0 || builder.endPosition < builder.startPosition) {
            throw new IllegalArgumentException("Invalid position range [" + builder.startPosition
                    + ", " + builder.endPosition + "] for entity '" + builder.name + "'");
        }
        this.startPosition = builder.startPosition;
        this.endPosition = builder.endPosition;
        this.confidence = ConfidenceCalculator.clamp(builder.confidence);
        this.metadata = builder.metadata != null ? builder.metadata : new Metadata();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getSourceText() {
        return sourceText;
    }

    public int getStartPosition() {
        return startPosition;
    }

    public int getEndPosition() {
        return endPosition;
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
     * True when both entities carry the same {@code (name, type)} pair.
     */
    public boolean hasSameKey(Entity other) {
        return other != null && name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", position=[" + startPosition + ", " + endPosition + ']' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from an existing entity, metadata deep-copied.
     */
    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .type(entity.type)
                .sourceText(entity.sourceText)
                .startPosition(entity.startPosition)
                .endPosition(entity.endPosition)
                .confidence(entity.confidence)
                .metadata(entity.metadata.copy());
    }

    public static class Builder {
        private String id;
        private String name;
        private String type;
        private String sourceText;
        private int startPosition;
        private int endPosition;
        private double confidence = 1.0;
        private Metadata metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder sourceText(String sourceText) {
            this.sourceText = sourceText;
            return this;
        }

        public Builder startPosition(int startPosition) {
            this.startPosition = startPosition;
            return this;
        }

        public Builder endPosition(int endPosition) {
            this.endPosition = endPosition;
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

        public Entity build() {
            return new Entity(this);
        }
    }
}
