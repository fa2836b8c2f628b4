package com.entity.extraction.core.model;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates entities and relationships with fresh identifiers.
 *
 * <p>This is the only place new ids are minted. Each id is a random (version 4)
 * UUID. Metadata is stamped with {@value Metadata#CREATED_AT} unless the caller
 * already supplied one.</p>
 */
public class EntityFactory {

    private static final EntityFactory DEFAULT = new EntityFactory(Clock.systemDefaultZone());

    private final Clock clock;

    public EntityFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static EntityFactory defaultFactory() {
        return DEFAULT;
    }

    public Entity createEntity(String name, String type, String sourceText,
                               int startPosition, int endPosition, double confidence) {
        return createEntity(name, type, sourceText, startPosition, endPosition, confidence, (Metadata) null);
    }

    public Entity createEntity(String name, String type, String sourceText,
                               int startPosition, int endPosition, double confidence,
                               Map<String, ?> metadata) {
        return createEntity(name, type, sourceText, startPosition, endPosition, confidence, Metadata.of(metadata));
    }

    public Entity createEntity(String name, String type, String sourceText,
                               int startPosition, int endPosition, double confidence,
                               Metadata metadata) {
        return Entity.builder()
                .id(newId())
                .name(name)
                .type(type)
                .sourceText(sourceText)
                .startPosition(startPosition)
                .endPosition(endPosition)
                .confidence(confidence)
                .metadata(stamp(metadata))
                .build();
    }

    public Relationship createRelationship(String sourceEntity, String targetEntity,
                                           String type, double confidence) {
        return createRelationship(sourceEntity, targetEntity, type, confidence, (Metadata) null);
    }

    public Relationship createRelationship(String sourceEntity, String targetEntity,
                                           String type, double confidence,
                                           Map<String, ?> metadata) {
        return createRelationship(sourceEntity, targetEntity, type, confidence, Metadata.of(metadata));
    }

    public Relationship createRelationship(String sourceEntity, String targetEntity,
                                           String type, double confidence,
                                           Metadata metadata) {
        return Relationship.builder()
                .id(newId())
                .sourceEntity(sourceEntity)
                .targetEntity(targetEntity)
                .type(type)
                .confidence(confidence)
                .metadata(stamp(metadata))
                .build();
    }

    private Metadata stamp(Metadata metadata) {
        Metadata target = metadata != null ? metadata : new Metadata();
        if (!target.containsKey(Metadata.CREATED_AT)) {
            target.put(Metadata.CREATED_AT, LocalDateTime.now(clock).toString());
        }
        return target;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
