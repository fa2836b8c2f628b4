package com.entity.extraction.observation;

import com.entity.extraction.core.model.MetadataValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of one provenance record stored under the {@code observations} key.
 *
 * <p>Entity observations carry a structured context ({@code before/exact/after}) and a
 * position; relationship observations carry a free-form {@code context} string and no
 * position ({@code start} and {@code end} are -1).</p>
 */
public record Observation(
        String timestamp,
        String source,
        String extractor,
        String contextBefore,
        String contextExact,
        String contextAfter,
        String context,
        int start,
        int end,
        double confidence
) {

    public boolean hasPosition() {
        return start >= 0 && end >= 0;
    }

    /**
     * Reads an observation from its stored map form. Missing fields become
     * {@code null} (strings), -1 (positions) or 0.0 (confidence).
     */
    static Observation fromMetadata(MetadataValue.MapValue stored) {
        String before = null;
        String exact = null;
        String after = null;
        String context = null;

        MetadataValue contextValue = stored.get("context");
        if (contextValue instanceof MetadataValue.MapValue contextMap) {
            before = contextMap.getString("before");
            exact = contextMap.getString("exact");
            after = contextMap.getString("after");
        } else if (contextValue instanceof MetadataValue.StringValue contextString) {
            context = contextString.value();
        }

        int start = -1;
        int end = -1;
        if (stored.get("position") instanceof MetadataValue.MapValue position) {
            start = intValue(position.get("start"));
            end = intValue(position.get("end"));
        }

        double confidence = 0.0;
        MetadataValue confidenceValue = stored.get("confidence");
        if (confidenceValue instanceof MetadataValue.DecimalValue d) {
            confidence = d.value();
        } else if (confidenceValue instanceof MetadataValue.IntegerValue i) {
            confidence = i.value();
        }

        return new Observation(stored.getString("timestamp"), stored.getString("source"),
                stored.getString("extractor"), before, exact, after, context, start, end, confidence);
    }

    private static int intValue(MetadataValue value) {
        return value instanceof MetadataValue.IntegerValue i ? (int) i.value() : -1;
    }

    static Map<String, Object> entityObservation(String timestamp, String source, String extractor,
                                                 String before, String exact, String after,
                                                 int start, int end, double confidence) {
        Map<String, Object> contextMap = new LinkedHashMap<>();
        contextMap.put("before", before);
        contextMap.put("exact", exact);
        contextMap.put("after", after);

        Map<String, Object> position = new LinkedHashMap<>();
        position.put("start", start);
        position.put("end", end);

        Map<String, Object> observation = new LinkedHashMap<>();
        observation.put("timestamp", timestamp);
        observation.put("source", source);
        observation.put("extractor", extractor);
        observation.put("context", contextMap);
        observation.put("position", position);
        observation.put("confidence", confidence);
        return observation;
    }

    static Map<String, Object> relationshipObservation(String timestamp, String source, String extractor,
                                                       String context, double confidence) {
        Map<String, Object> observation = new LinkedHashMap<>();
        observation.put("timestamp", timestamp);
        observation.put("source", source);
        observation.put("extractor", extractor);
        observation.put("context", context);
        observation.put("confidence", confidence);
        return observation;
    }
}
