package com.entity.extraction.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Open key/value bag attached to entities and relationships.
 *
 * <p>Keys keep insertion order. Values are {@link MetadataValue}s, so the bag can be
 * serialized without losing type information. Merging two bags uses union semantics
 * (see {@link #mergeFrom(Metadata)}) rather than replace-on-write, which keeps
 * list-valued keys such as {@code observations} intact across composite merges.</p>
 */
public final class Metadata {

    public static final String OBSERVATIONS = "observations";
    public static final String CREATED_AT = "created_at";

    private final Map<String, MetadataValue> values;

    public Metadata() {
        this.values = new LinkedHashMap<>();
    }

    private Metadata(Map<String, MetadataValue> values) {
        this.values = values;
    }

    /**
     * Builds metadata from plain Java values. {@code null} yields an empty bag.
     */
    public static Metadata of(Map<String, ?> source) {
        Metadata metadata = new Metadata();
        if (source != null) {
            source.forEach(metadata::put);
        }
        return metadata;
    }

    /**
     * Deep copy; the copy shares no lists or maps with this bag.
     */
    public Metadata copy() {
        Map<String, MetadataValue> copied = new LinkedHashMap<>();
        values.forEach((k, v) -> copied.put(k, MetadataValue.deepCopy(v)));
        return new Metadata(copied);
    }

    public Metadata put(String key, Object value) {
        Objects.requireNonNull(key, "key is required");
        values.put(key, MetadataValue.of(value));
        return this;
    }

    public MetadataValue get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Returns the string stored under the key, or {@code null} when absent or not a string.
     */
    public String getString(String key) {
        return values.get(key) instanceof MetadataValue.StringValue s ? s.value() : null;
    }

    /**
     * Returns the list stored under the key, creating and storing an empty list when absent.
     *
     * @throws IllegalStateException if the key holds a non-list value
     */
    public MetadataValue.ListValue getOrCreateList(String key) {
        MetadataValue existing = values.get(key);
        if (existing == null) {
            MetadataValue.ListValue list = new MetadataValue.ListValue();
            values.put(key, list);
            return list;
        }
        if (existing instanceof MetadataValue.ListValue list) {
            return list;
        }
        throw new IllegalStateException("Metadata key '" + key + "' is not a list");
    }

    /**
     * Merges {@code other} into this bag.
     * <ul>
     *   <li>keys missing here are copied over;</li>
     *   <li>list against list: incoming elements are appended after the existing ones;</li>
     *   <li>map against map: merged recursively with the same rules;</li>
     *   <li>anything else: the incoming value overwrites, except that an existing
     *       {@value #OBSERVATIONS} list is never replaced by a non-list value.</li>
     * </ul>
     * The incoming bag is never modified.
     */
    public void mergeFrom(Metadata other) {
        if (other == null || other == this) {
            return;
        }
        MetadataValue observations = values.get(OBSERVATIONS);
        mergeInto(values, other.values);
        if (observations instanceof MetadataValue.ListValue
                && !(values.get(OBSERVATIONS) instanceof MetadataValue.ListValue)) {
            values.put(OBSERVATIONS, observations);
        }
    }

    private static void mergeInto(Map<String, MetadataValue> target, Map<String, MetadataValue> incoming) {
        for (Map.Entry<String, MetadataValue> entry : incoming.entrySet()) {
            MetadataValue current = target.get(entry.getKey());
            MetadataValue next = entry.getValue();
            if (current instanceof MetadataValue.ListValue currentList
                    && next instanceof MetadataValue.ListValue nextList) {
                for (MetadataValue item : nextList.values()) {
                    currentList.add(MetadataValue.deepCopy(item));
                }
            } else if (current instanceof MetadataValue.MapValue currentMap
                    && next instanceof MetadataValue.MapValue nextMap) {
                mergeInto(currentMap.entries(), nextMap.entries());
            } else {
                target.put(entry.getKey(), MetadataValue.deepCopy(next));
            }
        }
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, MetadataValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Plain Java view ({@code Map<String, Object>} with nested lists and maps), as a fresh copy.
     */
    public Map<String, Object> toObjectMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.toObject()));
        return out;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Metadata) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + values;
    }
}
