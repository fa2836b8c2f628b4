package com.entity.extraction.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entities and relationships extracted from one source text.
 *
 * <p>Both sequences keep insertion order. Entities are indexed by id and by type,
 * relationships by type and by endpoint, so every lookup is O(1) amortised plus
 * the size of its result. A composite merge appends contributed records to a fresh
 * collection and updates collapsed entities in place.</p>
 *
 * <p>Not thread-safe. Callers running merges concurrently use separate instances.</p>
 */
public class EntityCollection {

    private final String sourceId;
    private final List<Entity> entities = new ArrayList<>();
    private final List<Relationship> relationships = new ArrayList<>();
    private final Map<String, Entity> entitiesById = new HashMap<>();
    private final Map<String, List<Entity>> entitiesByType = new HashMap<>();
    private final Map<String, List<Relationship>> relationshipsByType = new HashMap<>();
    private final Map<String, List<Relationship>> relationshipsByEntity = new HashMap<>();

    public EntityCollection() {
        this(null);
    }

    public EntityCollection(String sourceId) {
        this.sourceId = sourceId;
    }

    public static EntityCollection empty(String sourceId) {
        return new EntityCollection(sourceId);
    }

    /**
     * Appends an entity.
     *
     * @throws IllegalArgumentException if an entity with the same id is already present
     */
    public void addEntity(Entity entity) {
        Objects.requireNonNull(entity, "entity is required");
        if (entitiesById.putIfAbsent(entity.getId(), entity) != null) {
            throw new IllegalArgumentException("Entity " + entity.getId() + " is already in this collection");
        }
        entities.add(entity);
        entitiesByType.computeIfAbsent(entity.getType(), t -> new ArrayList<>()).add(entity);
    }

    /**
     * Appends a relationship. Endpoints are not validated here;
     * see {@link #findDanglingReferences()}.
     */
    public void addRelationship(Relationship relationship) {
        Objects.requireNonNull(relationship, "relationship is required");
        relationships.add(relationship);
        relationshipsByType.computeIfAbsent(relationship.getType(), t -> new ArrayList<>()).add(relationship);
        relationshipsByEntity.computeIfAbsent(relationship.getSourceEntity(), id -> new ArrayList<>()).add(relationship);
        if (!relationship.getTargetEntity().equals(relationship.getSourceEntity())) {
            relationshipsByEntity.computeIfAbsent(relationship.getTargetEntity(), id -> new ArrayList<>()).add(relationship);
        }
    }

    public Optional<Entity> getEntityById(String entityId) {
        return Optional.ofNullable(entitiesById.get(entityId));
    }

    public List<Entity> getEntitiesByType(String type) {
        return List.copyOf(entitiesByType.getOrDefault(type, List.of()));
    }

    public List<Relationship> getRelationshipsByType(String type) {
        return List.copyOf(relationshipsByType.getOrDefault(type, List.of()));
    }

    /**
     * Relationships in which the entity is the source or the target, each listed once,
     * in insertion order.
     */
    public List<Relationship> getRelationshipsForEntity(String entityId) {
        return List.copyOf(relationshipsByEntity.getOrDefault(entityId, List.of()));
    }

    /**
     * Integrity check: every relationship with an endpoint that does not resolve in this
     * collection. Never throws; an empty list means the collection is consistent.
     */
    public List<DanglingReference> findDanglingReferences() {
        List<DanglingReference> dangling = new ArrayList<>();
        for (Relationship relationship : relationships) {
            boolean sourceMissing = !entitiesById.containsKey(relationship.getSourceEntity());
            boolean targetMissing = !entitiesById.containsKey(relationship.getTargetEntity());
            if (sourceMissing || targetMissing) {
                dangling.add(new DanglingReference(relationship.getId(),
                        relationship.getSourceEntity(), relationship.getTargetEntity(),
                        sourceMissing, targetMissing));
            }
        }
        return dangling;
    }

    public String getSourceId() {
        return sourceId;
    }

    public List<Entity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public List<Relationship> getRelationships() {
        return Collections.unmodifiableList(relationships);
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    @Override
    public String toString() {
        return "EntityCollection{sourceId=" + sourceId +
                ", entities=" + entities.size() +
                ", relationships=" + relationships.size() + '}';
    }
}
