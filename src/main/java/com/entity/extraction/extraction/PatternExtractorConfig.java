package com.entity.extraction.extraction;

/**
 * Configuration for {@link PatternEntityExtractor}.
 *
 * @param baseConfidence         confidence given to every matched entity
 * @param relationshipConfidence confidence given to every same-type relationship
 * @param relationshipType       type of the same-type relationships
 * @param contextWindow          characters of context recorded on each side of a mention
 * @param linkSameType           whether to link entities of the same type pairwise
 */
public record PatternExtractorConfig(
        double baseConfidence,
        double relationshipConfidence,
        String relationshipType,
        int contextWindow,
        boolean linkSameType
) {

    public static final String DEFAULT_RELATIONSHIP_TYPE = "relatesTo";

    public PatternExtractorConfig {
        if (baseConfidence < 0.0 || baseConfidence > 1.0) {
            throw new IllegalArgumentException("baseConfidence must be between 0.0 and 1.0");
        }
        if (relationshipConfidence < 0.0 || relationshipConfidence > 1.0) {
            throw new IllegalArgumentException("relationshipConfidence must be between 0.0 and 1.0");
        }
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("relationshipType is required");
        }
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must be >= 0");
        }
    }

    /**
     * Defaults: confidence 0.8, relationships "relatesTo" at 0.7, 50 characters of context.
     */
    public static PatternExtractorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double baseConfidence = 0.8;
        private double relationshipConfidence = 0.7;
        private String relationshipType = DEFAULT_RELATIONSHIP_TYPE;
        private int contextWindow = TextContext.DEFAULT_WINDOW;
        private boolean linkSameType = true;

        public Builder baseConfidence(double baseConfidence) {
            this.baseConfidence = baseConfidence;
            return this;
        }

        public Builder relationshipConfidence(double relationshipConfidence) {
            this.relationshipConfidence = relationshipConfidence;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder contextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
            return this;
        }

        public Builder linkSameType(boolean linkSameType) {
            this.linkSameType = linkSameType;
            return this;
        }

        public PatternExtractorConfig build() {
            return new PatternExtractorConfig(baseConfidence, relationshipConfidence,
                    relationshipType, contextWindow, linkSameType);
        }
    }
}
