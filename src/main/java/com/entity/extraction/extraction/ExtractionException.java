package com.entity.extraction.extraction;

/**
 * Runtime exception thrown by an extractor that cannot produce a result,
 * for example when its model is unavailable.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
