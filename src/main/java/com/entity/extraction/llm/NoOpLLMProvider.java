package com.entity.extraction.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-operation LLM provider for when no model is configured.
 * Reports itself unavailable and finds nothing.
 */
public class NoOpLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMProvider.class);

    @Override
    public LLMExtractionResponse extract(LLMExtractionRequest request) {
        log.debug("NoOp LLM provider called for text of length {}", request.text().length());
        return LLMExtractionResponse.empty();
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
