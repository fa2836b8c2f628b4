package com.entity.extraction.llm;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link LanguageModelEntityExtractor}.
 */
public class LanguageModelExtractorConfig {

    private static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    private static final double DEFAULT_RELATION_STRENGTH = 0.7;
    private static final int DEFAULT_CONTEXT_WINDOW = 50;

    /**
     * Model labels and the entity types they map to. Labels missing here are dropped.
     */
    public static final Map<String, String> DEFAULT_LABEL_MAPPING = defaultLabelMapping();

    private final Map<String, String> labelMapping;
    private final double minConfidence;
    private final double relationStrength;
    private final int contextWindow;

    private LanguageModelExtractorConfig(Builder builder) {
        this.labelMapping = Map.copyOf(builder.labelMapping);
        this.minConfidence = builder.minConfidence;
        this.relationStrength = builder.relationStrength;
        this.contextWindow = builder.contextWindow;
    }

    public Map<String, String> getLabelMapping() {
        return labelMapping;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getRelationStrength() {
        return relationStrength;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public static LanguageModelExtractorConfig defaults() {
        return builder().build();
    }

    private static Map<String, String> defaultLabelMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("PERSON", "Person");
        mapping.put("ORG", "Organization");
        mapping.put("GPE", "Location");
        mapping.put("LOC", "Location");
        mapping.put("PRODUCT", "Product");
        mapping.put("EVENT", "Event");
        mapping.put("WORK_OF_ART", "CreativeWork");
        mapping.put("LAW", "Resource");
        mapping.put("LANGUAGE", "Technology");
        mapping.put("DATE", "Time");
        mapping.put("TIME", "Time");
        mapping.put("MONEY", "Value");
        mapping.put("QUANTITY", "Value");
        mapping.put("PERCENT", "Value");
        mapping.put("CARDINAL", "Value");
        mapping.put("ORDINAL", "Value");
        return Map.copyOf(mapping);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Map<String, String> labelMapping = DEFAULT_LABEL_MAPPING;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private double relationStrength = DEFAULT_RELATION_STRENGTH;
        private int contextWindow = DEFAULT_CONTEXT_WINDOW;

        public Builder labelMapping(Map<String, String> labelMapping) {
            if (labelMapping == null || labelMapping.isEmpty()) {
                throw new IllegalArgumentException("labelMapping must not be empty");
            }
            this.labelMapping = labelMapping;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            validateScore(minConfidence, "minConfidence");
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder relationStrength(double relationStrength) {
            validateScore(relationStrength, "relationStrength");
            this.relationStrength = relationStrength;
            return this;
        }

        public Builder contextWindow(int contextWindow) {
            if (contextWindow < 0) {
                throw new IllegalArgumentException("contextWindow must be >= 0");
            }
            this.contextWindow = contextWindow;
            return this;
        }

        public LanguageModelExtractorConfig build() {
            return new LanguageModelExtractorConfig(this);
        }

        private void validateScore(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
