package com.entity.extraction.extraction;

import com.entity.extraction.core.model.EntityCollection;

/**
 * An extraction capability: turns text into entities and relationships.
 *
 * <p>Implementations must be pure with respect to their inputs. The same text and
 * parameters yield semantically equivalent entities (ids aside, since every run
 * mints fresh ones), and the text is never modified. An implementation that cannot
 * run (a missing model, malformed input) reports it by throwing
 * {@link ExtractionException}; a composite treats that as an empty contribution.</p>
 */
public interface EntityExtractor {

    /**
     * Extracts entities and relationships from the text.
     *
     * @param text       the text to analyse
     * @param parameters open parameter bag; at least an optional source id
     * @return a new collection owned by the caller
     * @throws ExtractionException if the extractor cannot produce a result
     */
    EntityCollection extractEntities(String text, ExtractionParameters parameters);

    default EntityCollection extractEntities(String text) {
        return extractEntities(text, ExtractionParameters.empty());
    }

    /**
     * Name recorded as the {@code extractor} of observations and failures.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
