package com.entity.extraction.llm;

/**
 * Interface for language-model integration.
 * Implementations find entity mentions and the relations between them.
 *
 * Providers only report mentions; mapping them to entities, positions and
 * observations is done by {@link LanguageModelEntityExtractor}.
 */
public interface LLMProvider {

    /**
     * Asks the model for mentions and relations in the request's text.
     *
     * @param request the text and the labels the model may use
     * @return the model's mentions and relations
     * @throws com.entity.extraction.extraction.ExtractionException if the model call fails
     */
    LLMExtractionResponse extract(LLMExtractionRequest request);

    /**
     * Returns the name/identifier of this LLM provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is available and configured.
     */
    boolean isAvailable();
}
