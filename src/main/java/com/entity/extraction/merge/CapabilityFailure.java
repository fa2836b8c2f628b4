package com.entity.extraction.merge;

/**
 * Diagnostic for a capability that failed or timed out during a merge.
 * The capability contributed nothing to the merged collection.
 *
 * @param extractorName the failing capability's {@code getName()}
 * @param message       the failure message
 * @param exceptionType simple name of the exception raised
 */
public record CapabilityFailure(String extractorName, String message, String exceptionType) {

    public static CapabilityFailure of(String extractorName, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new CapabilityFailure(extractorName, message, error.getClass().getSimpleName());
    }

    public boolean isTimeout() {
        return "TimeoutException".equals(exceptionType);
    }
}
