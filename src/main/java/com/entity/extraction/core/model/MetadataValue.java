package com.entity.extraction.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single value in an entity's or relationship's metadata.
 *
 * <p>Metadata is open-ended, so values form a small recursive schema:
 * strings, integers, decimals, booleans, null, lists of values and
 * string-keyed maps of values. Every variant converts back to the plain
 * Java object it was built from via {@link #toObject()}.</p>
 */
public sealed interface MetadataValue
        permits MetadataValue.StringValue, MetadataValue.IntegerValue, MetadataValue.DecimalValue,
        MetadataValue.BooleanValue, MetadataValue.NullValue, MetadataValue.ListValue,
        MetadataValue.MapValue {

    /**
     * Returns the plain Java representation ({@code String}, {@code Long}, {@code Double},
     * {@code Boolean}, {@code null}, {@code List} or {@code Map}).
     */
    Object toObject();

    /**
     * Wraps a plain Java object. Nested lists and maps are converted recursively;
     * {@code Integer}, {@code Long}, {@code Short} and {@code Byte} become integers,
     * other numbers become decimals, and {@code Instant}s or enums are stored as strings.
     *
     * @throws IllegalArgumentException if the object (or a nested element) has no metadata form
     */
    static MetadataValue of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof MetadataValue metadataValue) {
            return metadataValue;
        }
        if (value instanceof String s) {
            return new StringValue(s);
        }
        if (value instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new DecimalValue(n.doubleValue());
        }
        if (value instanceof CharSequence || value instanceof Enum<?> || value instanceof java.time.temporal.Temporal) {
            return new StringValue(value.toString());
        }
        if (value instanceof List<?> list) {
            List<MetadataValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, MetadataValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Metadata map keys must be strings, got: " + entry.getKey());
                }
                entries.put(key, of(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported metadata value type: " + value.getClass().getName());
    }

    record StringValue(String value) implements MetadataValue {
        public StringValue {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Object toObject() {
            return value;
        }
    }

    record IntegerValue(long value) implements MetadataValue {
        @Override
        public Object toObject() {
            return value;
        }
    }

    record DecimalValue(double value) implements MetadataValue {
        @Override
        public Object toObject() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements MetadataValue {
        @Override
        public Object toObject() {
            return value;
        }
    }

    final class NullValue implements MetadataValue {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public Object toObject() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    /**
     * List of values. The backing list is mutable so observation ledgers can append to it.
     */
    record ListValue(List<MetadataValue> values) implements MetadataValue {
        public ListValue {
            values = values != null ? new ArrayList<>(values) : new ArrayList<>();
        }

        public ListValue() {
            this(null);
        }

        public void add(MetadataValue value) {
            values.add(Objects.requireNonNull(value, "value is required"));
        }

        public int size() {
            return values.size();
        }

        public List<MetadataValue> asList() {
            return Collections.unmodifiableList(values);
        }

        ListValue copy() {
            List<MetadataValue> copied = new ArrayList<>(values.size());
            for (MetadataValue value : values) {
                copied.add(deepCopy(value));
            }
            return new ListValue(copied);
        }

        @Override
        public Object toObject() {
            List<Object> out = new ArrayList<>(values.size());
            for (MetadataValue value : values) {
                out.add(value.toObject());
            }
            return out;
        }
    }

    record MapValue(Map<String, MetadataValue> entries) implements MetadataValue {
        public MapValue {
            entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
        }

        public MetadataValue get(String key) {
            return entries.get(key);
        }

        public String getString(String key) {
            return entries.get(key) instanceof StringValue s ? s.value() : null;
        }

        MapValue copy() {
            Map<String, MetadataValue> copied = new LinkedHashMap<>();
            entries.forEach((k, v) -> copied.put(k, deepCopy(v)));
            return new MapValue(copied);
        }

        @Override
        public Object toObject() {
            Map<String, Object> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k, v.toObject()));
            return out;
        }
    }

    /**
     * Copies lists and maps so the result shares no mutable state with the input.
     */
    static MetadataValue deepCopy(MetadataValue value) {
        if (value instanceof ListValue list) {
            return list.copy();
        }
        if (value instanceof MapValue map) {
            return map.copy();
        }
        return value;
    }
}
