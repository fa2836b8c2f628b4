package com.entity.extraction.serialization;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.Metadata;
import com.entity.extraction.core.model.MetadataValue;
import com.entity.extraction.core.model.Relationship;
import com.entity.extraction.extraction.ExtractionParameters;
import com.entity.extraction.extraction.PatternEntityExtractor;
import com.entity.extraction.observation.ObservationRecorder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityCollectionSerializer Tests")
class EntityCollectionSerializerTest {

    private EntityCollectionSerializer serializer;
    private EntityCollection collection;

    @BeforeEach
    void setUp() {
        serializer = new EntityCollectionSerializer();
        collection = new EntityCollection("doc-1");
        collection.addEntity(Entity.builder()
                .id("e-omar").name("Omar").type("Person").sourceText("Omar")
                .startPosition(0).endPosition(4).confidence(0.8)
                .metadata(new Metadata()
                        .put("mentions", 2)
                        .put("score", 1.0)
                        .put("flags", List.of(true, false))
                        .put("source", Map.of("page", 3, "section", "intro"))
                        .put("note", null))
                .build());
        collection.addEntity(Entity.builder()
                .id("e-acme").name("Acme").type("Organization")
                .startPosition(14).endPosition(18).confidence(0.9)
                .build());
        collection.addRelationship(Relationship.builder()
                .id("r-1").sourceEntity("e-omar").targetEntity("e-acme").type("worksOn").confidence(0.7)
                .metadata(new Metadata().put("verb", "works"))
                .build());
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("Uses snake_case field names")
        void snakeCaseFields() {
            ObjectNode tree = serializer.toTree(collection);

            JsonNode entity = tree.get("entities").get(0);
            assertEquals("Omar", entity.get("source_text").asText());
            assertEquals(0, entity.get("start_position").asInt());
            assertEquals(4, entity.get("end_position").asInt());
            JsonNode relationship = tree.get("relationships").get(0);
            assertEquals("e-omar", relationship.get("source_entity").asText());
            assertEquals("e-acme", relationship.get("target_entity").asText());
            assertEquals("doc-1", tree.get("source_id").asText());
        }

        @Test
        @DisplayName("Missing source id is written as null")
        void nullSourceId() {
            ObjectNode tree = serializer.toTree(new EntityCollection());
            assertTrue(tree.get("source_id").isNull());
            assertEquals(0, tree.get("entities").size());
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("JSON round trip preserves records and metadata shapes")
        void jsonRoundTrip() {
            EntityCollection restored = serializer.fromJson(serializer.toJson(collection));

            assertEquals("doc-1", restored.getSourceId());
            assertEquals(2, restored.entityCount());
            Entity omar = restored.getEntityById("e-omar").orElseThrow();
            assertEquals(0.8, omar.getConfidence());
            assertEquals(collection.getEntities().get(0).getMetadata(), omar.getMetadata());
            assertEquals(new MetadataValue.IntegerValue(2), omar.getMetadata().get("mentions"));
            assertEquals(new MetadataValue.DecimalValue(1.0), omar.getMetadata().get("score"));
            assertSame(MetadataValue.NullValue.INSTANCE, omar.getMetadata().get("note"));

            Relationship relationship = restored.getRelationships().get(0);
            assertEquals("worksOn", relationship.getType());
            assertEquals("works", relationship.getMetadata().getString("verb"));
            assertEquals(List.of(relationship), restored.getRelationshipsForEntity("e-acme"));
        }

        @Test
        @DisplayName("Writer and reader round trip")
        void writerReaderRoundTrip() {
            StringWriter writer = new StringWriter();
            serializer.write(collection, writer);

            EntityCollection restored = serializer.read(new StringReader(writer.toString()));

            assertEquals(2, restored.entityCount());
            assertEquals(1, restored.relationshipCount());
        }

        @Test
        @DisplayName("Map round trip")
        void mapRoundTrip() {
            Map<String, Object> document = serializer.toMap(collection);
            assertEquals("doc-1", document.get("source_id"));

            EntityCollection restored = serializer.fromMap(document);

            assertEquals(collection.getEntities().get(0).getMetadata(),
                    restored.getEntityById("e-omar").orElseThrow().getMetadata());
        }

        @Test
        @DisplayName("Extracted observations survive a round trip")
        void observationsSurvive() {
            PatternEntityExtractor extractor = new PatternEntityExtractor(Map.of("Organization", List.of("Acme")));
            EntityCollection extracted = extractor.extractEntities("Omar works at Acme. Alice works at Acme too.",
                    ExtractionParameters.forSource("doc-1"));

            EntityCollection restored = serializer.fromJson(serializer.toJson(extracted));

            Entity acme = restored.getEntities().get(0);
            assertEquals(ObservationRecorder.getObservations(extracted.getEntities().get(0)),
                    ObservationRecorder.getObservations(acme));
            assertEquals(2, ObservationRecorder.getObservations(acme).size());
        }
    }

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        @DisplayName("Absent metadata and source id decode to empty metadata and null")
        void optionalFields() {
            String json = """
                    {"entities": [{"id": "e", "name": "Omar", "type": "Person", "source_text": "Omar",
                                   "start_position": 0, "end_position": 4, "confidence": 0.8}]}
                    """;

            EntityCollection restored = serializer.fromJson(json);

            assertNull(restored.getSourceId());
            Entity omar = restored.getEntities().get(0);
            assertTrue(omar.getMetadata().isEmpty());
            assertEquals("Omar", omar.getSourceText());
            assertEquals(0, restored.relationshipCount());
        }

        @Test
        @DisplayName("A missing required field names the field and record")
        void missingField() {
            String json = """
                    {"entities": [{"id": "e1", "name": "Omar", "type": "Person", "source_text": "Omar", "start_position": 0,
                                   "end_position": 4, "confidence": 0.8},
                                  {"id": "e2", "type": "Person", "source_text": "Alice", "start_position": 5,
                                   "end_position": 9, "confidence": 0.8}]}
                    """;

            SerializationException e = assertThrows(SerializationException.class, () -> serializer.fromJson(json));
            assertTrue(e.getMessage().contains("entities[1]"));
            assertTrue(e.getMessage().contains("'name'"));
        }

        @Test
        @DisplayName("A missing or non-string source text fails the decode")
        void sourceTextRequired() {
            ObjectNode missing = serializer.toTree(collection);
            ((ObjectNode) missing.get("entities").get(1)).remove("source_text");
            ObjectNode numeric = serializer.toTree(collection);
            ((ObjectNode) numeric.get("entities").get(0)).put("source_text", 7);

            SerializationException e = assertThrows(SerializationException.class, () -> serializer.fromTree(missing));
            assertTrue(e.getMessage().contains("entities[1]"));
            assertTrue(e.getMessage().contains("'source_text'"));
            assertThrows(SerializationException.class, () -> serializer.fromTree(numeric));
        }

        @Test
        @DisplayName("One bad relationship fails the whole document")
        void badRelationshipFailsDocument() {
            ObjectNode tree = serializer.toTree(collection);
            ObjectNode relationship = (ObjectNode) tree.get("relationships").get(0);
            relationship.put("confidence", "high");

            SerializationException e = assertThrows(SerializationException.class, () -> serializer.fromTree(tree));
            assertTrue(e.getMessage().contains("relationships[0]"));
            assertTrue(e.getMessage().contains("'confidence'"));
        }

        @Test
        @DisplayName("Wrong node types are rejected")
        void wrongTypes() {
            assertThrows(SerializationException.class, () -> serializer.fromJson("[]"));
            assertThrows(SerializationException.class, () -> serializer.fromJson("{\"entities\": {}}"));
            assertThrows(SerializationException.class, () -> serializer.fromJson("{\"source_id\": 5}"));
            assertThrows(SerializationException.class, () -> serializer.fromJson(
                    "{\"entities\": [{\"id\": \"e\", \"name\": \"n\", \"type\": \"t\", \"source_text\": \"n\", \"start_position\": 1.5,"
                            + " \"end_position\": 4, \"confidence\": 0.8}]}"));
            assertThrows(SerializationException.class, () -> serializer.fromJson(
                    "{\"entities\": [{\"id\": \"e\", \"name\": \"n\", \"type\": \"t\", \"source_text\": \"n\", \"start_position\": 0,"
                            + " \"end_position\": 4, \"confidence\": 0.8, \"metadata\": []}]}"));
        }

        @Test
        @DisplayName("Invalid positions and duplicate ids are rejected")
        void invalidRecords() {
            String inverted = "{\"entities\": [{\"id\": \"e\", \"name\": \"n\", \"type\": \"t\", \"source_text\": \"n\","
                    + " \"start_position\": 9, \"end_position\": 4, \"confidence\": 0.8}]}";
            String duplicate = "{\"entities\": ["
                    + "{\"id\": \"e\", \"name\": \"a\", \"type\": \"t\", \"source_text\": \"n\", \"start_position\": 0, \"end_position\": 1, \"confidence\": 0.8},"
                    + "{\"id\": \"e\", \"name\": \"b\", \"type\": \"t\", \"source_text\": \"n\", \"start_position\": 0, \"end_position\": 1, \"confidence\": 0.8}]}";

            assertThrows(SerializationException.class, () -> serializer.fromJson(inverted));
            SerializationException e = assertThrows(SerializationException.class, () -> serializer.fromJson(duplicate));
            assertTrue(e.getMessage().contains("entities[1]"));
        }

        @Test
        @DisplayName("Malformed JSON is reported as a serialization failure")
        void malformedJson() {
            assertThrows(SerializationException.class, () -> serializer.fromJson("{\"entities\": ["));
        }

        @Test
        @DisplayName("Dangling relationships decode and are reported by the integrity check")
        void danglingRelationshipsDecode() {
            String json = """
                    {"relationships": [{"id": "r", "source_entity": "a", "target_entity": "b",
                                        "type": "knows", "confidence": 0.5}]}
                    """;

            EntityCollection restored = serializer.fromJson(json);

            assertEquals(1, restored.findDanglingReferences().size());
        }
    }
}
