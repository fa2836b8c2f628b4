package com.entity.extraction.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Open, immutable parameter bag passed verbatim to every extractor.
 *
 * <p>The only well-known key is {@value #SOURCE_ID}. Extractors read any other keys
 * they understand and ignore the rest.</p>
 */
public final class ExtractionParameters {

    public static final String SOURCE_ID = "source_id";

    private static final ExtractionParameters EMPTY = new ExtractionParameters(Map.of());

    private final Map<String, Object> values;

    private ExtractionParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ExtractionParameters empty() {
        return EMPTY;
    }

    public static ExtractionParameters forSource(String sourceId) {
        return builder().sourceId(sourceId).build();
    }

    public static ExtractionParameters of(Map<String, ?> values) {
        Builder builder = builder();
        if (values != null) {
            values.forEach(builder::put);
        }
        return builder.build();
    }

    /**
     * Source identifier of the text, or {@code null}.
     */
    public String getSourceId() {
        return getString(SOURCE_ID);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    public double getDouble(String key, double defaultValue) {
        return values.get(key) instanceof Number n ? n.doubleValue() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        return values.get(key) instanceof Number n ? n.intValue() : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return values.get(key) instanceof Boolean b ? b : defaultValue;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ExtractionParameters) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "ExtractionParameters" + values;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder sourceId(String sourceId) {
            return put(SOURCE_ID, sourceId);
        }

        /**
         * Sets a parameter; a {@code null} value removes it.
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key is required");
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }

        public ExtractionParameters build() {
            return new ExtractionParameters(values);
        }
    }
}
