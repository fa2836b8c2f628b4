package com.entity.extraction.llm;

import java.util.List;
import java.util.Objects;

/**
 * Request asking a language model to find entity mentions and relations in a text.
 *
 * @param text   the text to analyse
 * @param labels the entity labels the model may use (e.g. PERSON, ORG)
 */
public record LLMExtractionRequest(
        String text,
        List<String> labels
) {
    public LLMExtractionRequest {
        Objects.requireNonNull(text, "text is required");
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private List<String> labels;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public LLMExtractionRequest build() {
            return new LLMExtractionRequest(text, labels);
        }
    }
}
