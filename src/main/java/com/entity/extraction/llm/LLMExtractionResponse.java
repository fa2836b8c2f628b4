package com.entity.extraction.llm;

import java.util.List;
import java.util.Objects;

/**
 * Mentions and relations reported by a language model, before they are mapped
 * onto entities of a collection.
 */
public record LLMExtractionResponse(
        List<Mention> mentions,
        List<Relation> relations
) {
    public LLMExtractionResponse {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    public static LLMExtractionResponse empty() {
        return new LLMExtractionResponse(List.of(), List.of());
    }

    /**
     * An entity mention.
     *
     * @param text       the mention exactly as it appears in the text
     * @param label      the model's label, e.g. PERSON
     * @param confidence the model's confidence (0-1)
     */
    public record Mention(String text, String label, double confidence) {
        public Mention {
            Objects.requireNonNull(text, "text is required");
            Objects.requireNonNull(label, "label is required");
        }
    }

    /**
     * A relation between two mentions, named by its verb.
     */
    public record Relation(String source, String target, String verb) {
        public Relation {
            Objects.requireNonNull(source, "source is required");
            Objects.requireNonNull(target, "target is required");
            verb = verb != null ? verb : "";
        }
    }
}
