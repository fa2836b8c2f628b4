package com.entity.extraction.observation;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.Metadata;
import com.entity.extraction.core.model.MetadataValue;
import com.entity.extraction.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only provenance ledger for entities and relationships.
 *
 * <p>Each observation documents one detection: when, from which source, by which extractor,
 * in which context, and with what confidence at that moment. Observations are stored in the
 * record's own metadata under {@value Metadata#OBSERVATIONS} and are never modified or removed.
 * This class is the only writer of that key.</p>
 */
public class ObservationRecorder {
    private static final Logger log = LoggerFactory.getLogger(ObservationRecorder.class);

    static final String UNKNOWN = "unknown";

    private static final ObservationRecorder DEFAULT = new ObservationRecorder(Clock.systemDefaultZone());

    private final Clock clock;

    public ObservationRecorder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static ObservationRecorder defaultRecorder() {
        return DEFAULT;
    }

    public void recordEntityObservation(Entity entity, String source) {
        recordEntityObservation(entity, source, "", "", UNKNOWN);
    }

    /**
     * Appends an observation of the entity, taking the exact text, position and confidence
     * from the entity as it is now.
     */
    public void recordEntityObservation(Entity entity, String source,
                                        String contextBefore, String contextAfter, String extractor) {
        recordEntityObservation(entity, source, contextBefore, contextAfter, extractor,
                entity.getStartPosition(), entity.getEndPosition());
    }

    /**
     * Appends an observation of a further mention of the entity at another position.
     */
    public void recordEntityObservation(Entity entity, String source,
                                        String contextBefore, String contextAfter, String extractor,
                                        int start, int end) {
        var observation = Observation.entityObservation(
                now(), orUnknown(source), orUnknown(extractor),
                nullToEmpty(contextBefore), entity.getSourceText(), nullToEmpty(contextAfter),
                start, end, entity.getConfidence());
        observationList(entity.getMetadata(), entity.getId()).add(MetadataValue.of(observation));

        log.debug("observation.entity entityId={} source={} extractor={} position=[{}, {}]",
                entity.getId(), source, extractor, start, end);
    }

    public void recordRelationshipObservation(Relationship relationship, String source) {
        recordRelationshipObservation(relationship, source, "", UNKNOWN);
    }

    public void recordRelationshipObservation(Relationship relationship, String source,
                                              String context, String extractor) {
        var observation = Observation.relationshipObservation(
                now(), orUnknown(source), orUnknown(extractor), nullToEmpty(context),
                relationship.getConfidence());
        observationList(relationship.getMetadata(), relationship.getId()).add(MetadataValue.of(observation));

        log.debug("observation.relationship relationshipId={} source={} extractor={}",
                relationship.getId(), source, extractor);
    }

    /**
     * Observations of an entity in append order.
     */
    public static List<Observation> getObservations(Entity entity) {
        return read(entity.getMetadata());
    }

    /**
     * Observations of a relationship in append order.
     */
    public static List<Observation> getObservations(Relationship relationship) {
        return read(relationship.getMetadata());
    }

    private static List<Observation> read(Metadata metadata) {
        if (!(metadata.get(Metadata.OBSERVATIONS) instanceof MetadataValue.ListValue list)) {
            return List.of();
        }
        List<Observation> observations = new ArrayList<>(list.size());
        for (MetadataValue value : list.values()) {
            if (value instanceof MetadataValue.MapValue map) {
                observations.add(Observation.fromMetadata(map));
            }
        }
        return Collections.unmodifiableList(observations);
    }

    /**
     * The record's observation list. A non-list value found under the key is kept as
     * the first element of a fresh list.
     */
    private static MetadataValue.ListValue observationList(Metadata metadata, String recordId) {
        MetadataValue existing = metadata.get(Metadata.OBSERVATIONS);
        if (existing == null || existing instanceof MetadataValue.ListValue) {
            return metadata.getOrCreateList(Metadata.OBSERVATIONS);
        }
        log.warn("observation.ledger.reset recordId={} reason=non-list value {}",
                recordId, existing.getClass().getSimpleName());
        MetadataValue.ListValue list = new MetadataValue.ListValue(List.of(existing));
        metadata.put(Metadata.OBSERVATIONS, list);
        return list;
    }

    private String now() {
        return LocalDateTime.now(clock).toString();
    }

    private static String orUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
