package com.entity.extraction.serialization;

/**
 * Thrown when a collection cannot be encoded or decoded. Decoding is all-or-nothing:
 * when this is thrown no partial collection has been produced.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
