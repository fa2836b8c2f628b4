package com.entity.extraction.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Should create entity with required fields and defaults")
    void testEntityCreation() {
        Entity entity = Entity.builder()
                .id("e-1")
                .name("Omar")
                .type("Person")
                .startPosition(0)
                .endPosition(4)
                .build();

        assertEquals("e-1", entity.getId());
        assertEquals("Omar", entity.getName());
        assertEquals("Person", entity.getType());
        assertEquals("Omar", entity.getSourceText());
        assertEquals(1.0, entity.getConfidence());
        assertTrue(entity.getMetadata().isEmpty());
    }

    @Test
    @DisplayName("Should require id, name and type")
    void testRequiredFields() {
        assertThrows(NullPointerException.class, () -> Entity.builder().name("Omar").type("Person").build());
        assertThrows(NullPointerException.class, () -> Entity.builder().id("e").type("Person").build());
        assertThrows(NullPointerException.class, () -> Entity.builder().id("e").name("Omar").build());
    }

    @Test
    @DisplayName("Should reject negative or inverted positions")
    void testInvalidPositions() {
        assertThrows(IllegalArgumentException.class, () ->
                Entity.builder().id("e").name("Omar").type("Person").startPosition(-1).endPosition(3).build());
        assertThrows(IllegalArgumentException.class, () ->
                Entity.builder().id("e").name("Omar").type("Person").startPosition(5).endPosition(2).build());
    }

    @Test
    @DisplayName("Confidence is clamped to [0, 1]")
    void testConfidenceClamped() {
        Entity entity = Entity.builder().id("e").name("Omar").type("Person").confidence(1.4).build();
        assertEquals(1.0, entity.getConfidence());

        entity.setConfidence(-0.2);
        assertEquals(0.0, entity.getConfidence());
    }

    @Test
    @DisplayName("Equality is by id")
    void testEqualityById() {
        Entity a = Entity.builder().id("same").name("Omar").type("Person").build();
        Entity b = Entity.builder().id("same").name("Other").type("Organization").build();
        Entity c = Entity.builder().id("other").name("Omar").type("Person").build();

        assertEquals(a, b);
        assertNotEquals(a, c);
        assertTrue(a.hasSameKey(c));
        assertFalse(a.hasSameKey(b));
    }

    @Test
    @DisplayName("builder(Entity) copies fields and deep-copies metadata")
    void testCopyBuilder() {
        Entity original = Entity.builder().id("e").name("Omar").type("Person")
                .metadata(new Metadata().put("tags", java.util.List.of("a")))
                .build();

        Entity copy = Entity.builder(original).build();
        copy.getMetadata().getOrCreateList("tags").add(new MetadataValue.StringValue("b"));

        assertEquals(original.getId(), copy.getId());
        assertEquals(1, original.getMetadata().getOrCreateList("tags").size());
    }

    @Test
    @DisplayName("Factory mints unique ids and stamps created_at")
    void testFactory() {
        EntityFactory factory = new EntityFactory(FIXED_CLOCK);
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(factory.createEntity("Omar", "Person", "Omar", 0, 4, 0.8).getId());
        }
        assertEquals(50, ids.size());

        Entity entity = factory.createEntity("Omar", "Person", "Omar", 0, 4, 0.8);
        assertTrue(entity.getId().matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}"));
        assertEquals("2024-03-01T12:00", entity.getMetadata().getString(Metadata.CREATED_AT));
    }

    @Test
    @DisplayName("Factory keeps a caller-supplied created_at and other metadata")
    void testFactoryKeepsCreatedAt() {
        EntityFactory factory = new EntityFactory(FIXED_CLOCK);
        Relationship relationship = factory.createRelationship("a", "b", "uses", 0.7,
                Map.of(Metadata.CREATED_AT, "yesterday", "verb", "use"));

        assertEquals("yesterday", relationship.getMetadata().getString(Metadata.CREATED_AT));
        assertEquals("use", relationship.getMetadata().getString("verb"));
        assertEquals("a", relationship.getSourceEntity());
        assertEquals("b", relationship.getTargetEntity());
        assertTrue(relationship.involves("b"));
        assertFalse(relationship.involves("c"));
    }
}
