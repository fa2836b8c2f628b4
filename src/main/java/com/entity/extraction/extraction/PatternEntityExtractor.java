package com.entity.extraction.extraction;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.EntityFactory;
import com.entity.extraction.core.model.Metadata;
import com.entity.extraction.core.model.Relationship;
import com.entity.extraction.observation.ObservationRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-based extractor matching literal patterns per entity type.
 *
 * <p>Matching is case-sensitive and scans left to right for non-overlapping occurrences.
 * Each distinct {@code (pattern, type)} found yields one entity positioned at its first
 * occurrence; every occurrence, the first included, is recorded as an observation on that
 * entity, and {@code mentions} in its metadata holds the occurrence count.</p>
 *
 * <p>When {@link PatternExtractorConfig#linkSameType()} is set, every unordered pair of
 * entities sharing a type is linked by one relationship of the configured type, so a type
 * with n entities contributes n(n-1)/2 relationships.</p>
 *
 * <pre>
 * PatternEntityExtractor extractor = new PatternEntityExtractor(Map.of(
 *     "Person", List.of("Omar", "Alice"),
 *     "Organization", List.of("Acme")));
 * EntityCollection result = extractor.extractEntities(text, ExtractionParameters.forSource("msg-1"));
 * </pre>
 */
public class PatternEntityExtractor implements EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(PatternEntityExtractor.class);

    static final String EXTRACTOR_KEY = "extractor";
    static final String MENTIONS_KEY = "mentions";

    private final Map<String, List<String>> entityPatterns;
    private final PatternExtractorConfig config;
    private final EntityFactory entityFactory;
    private final ObservationRecorder observationRecorder;

    public PatternEntityExtractor(Map<String, List<String>> entityPatterns) {
        this(entityPatterns, PatternExtractorConfig.defaults());
    }

    public PatternEntityExtractor(Map<String, List<String>> entityPatterns, PatternExtractorConfig config) {
        this(entityPatterns, config, EntityFactory.defaultFactory(), ObservationRecorder.defaultRecorder());
    }

    public PatternEntityExtractor(Map<String, List<String>> entityPatterns, PatternExtractorConfig config,
                                  EntityFactory entityFactory, ObservationRecorder observationRecorder) {
        Objects.requireNonNull(entityPatterns, "entityPatterns is required");
        this.entityPatterns = new LinkedHashMap<>();
        entityPatterns.forEach((type, patterns) ->
                this.entityPatterns.put(type, List.copyOf(new LinkedHashSet<>(patterns))));
        this.config = Objects.requireNonNull(config, "config is required");
        this.entityFactory = Objects.requireNonNull(entityFactory, "entityFactory is required");
        this.observationRecorder = Objects.requireNonNull(observationRecorder, "observationRecorder is required");
    }

    @Override
    public EntityCollection extractEntities(String text, ExtractionParameters parameters) {
        Objects.requireNonNull(text, "text is required");
        ExtractionParameters params = parameters != null ? parameters : ExtractionParameters.empty();
        String sourceId = params.getSourceId();
        EntityCollection collection = new EntityCollection(sourceId);

        for (Map.Entry<String, List<String>> entry : entityPatterns.entrySet()) {
            String type = entry.getKey();
            for (String pattern : entry.getValue()) {
                if (pattern.isEmpty()) {
                    continue;
                }
                Entity entity = matchPattern(text, type, pattern, sourceId);
                if (entity != null) {
                    collection.addEntity(entity);
                }
            }
        }

        if (config.linkSameType()) {
            linkEntitiesOfSameType(collection, sourceId);
        }

        log.debug("extraction.completed extractor={} sourceId={} entities={} relationships={}",
                getName(), sourceId, collection.entityCount(), collection.relationshipCount());
        return collection;
    }

    /**
     * Finds every occurrence of the pattern; returns the entity for the first one with all
     * occurrences recorded, or {@code null} if the pattern does not occur.
     */
    private Entity matchPattern(String text, String type, String pattern, String sourceId) {
        Entity entity = null;
        int mentions = 0;
        int from = 0;
        int index;
        while ((index = text.indexOf(pattern, from)) != -1) {
            int end = index + pattern.length();
            if (entity == null) {
                Metadata metadata = new Metadata().put(EXTRACTOR_KEY, getName());
                entity = entityFactory.createEntity(pattern, type, pattern, index, end,
                        config.baseConfidence(), metadata);
            }
            observationRecorder.recordEntityObservation(entity, sourceId,
                    TextContext.before(text, index, config.contextWindow()),
                    TextContext.after(text, end, config.contextWindow()),
                    getName(), index, end);
            mentions++;
            from = end;
        }
        if (entity != null) {
            entity.getMetadata().put(MENTIONS_KEY, mentions);
        }
        return entity;
    }

    private void linkEntitiesOfSameType(EntityCollection collection, String sourceId) {
        Map<String, List<Entity>> entitiesByType = new LinkedHashMap<>();
        for (Entity entity : collection.getEntities()) {
            entitiesByType.computeIfAbsent(entity.getType(), t -> new ArrayList<>()).add(entity);
        }

        for (Map.Entry<String, List<Entity>> entry : entitiesByType.entrySet()) {
            List<Entity> entities = entry.getValue();
            for (int i = 0; i < entities.size() - 1; i++) {
                for (int j = i + 1; j < entities.size(); j++) {
                    Relationship relationship = entityFactory.createRelationship(
                            entities.get(i).getId(), entities.get(j).getId(),
                            config.relationshipType(), config.relationshipConfidence(),
                            new Metadata().put(EXTRACTOR_KEY, getName()));
                    observationRecorder.recordRelationshipObservation(relationship, sourceId,
                            "Both entities are of type " + entry.getKey(), getName());
                    collection.addRelationship(relationship);
                }
            }
        }
    }

    public Map<String, List<String>> getEntityPatterns() {
        return Collections.unmodifiableMap(entityPatterns);
    }

    public PatternExtractorConfig getConfig() {
        return config;
    }
}
