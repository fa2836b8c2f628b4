package com.entity.extraction.serialization;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.Metadata;
import com.entity.extraction.core.model.MetadataValue;
import com.entity.extraction.core.model.Relationship;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson-based encoding of an {@link EntityCollection}.
 *
 * <p>Document layout:</p>
 * <pre>
 * {
 *   "entities": [{"id": "...", "name": "Omar", "type": "Person", "source_text": "Omar",
 *                 "start_position": 0, "end_position": 4, "confidence": 0.8, "metadata": {...}}],
 *   "relationships": [{"id": "...", "source_entity": "...", "target_entity": "...",
 *                      "type": "relatesTo", "confidence": 0.7, "metadata": {...}}],
 *   "source_id": "doc-1"
 * }
 * </pre>
 *
 * <p>Metadata keeps its shape: integers stay integers, decimals stay decimals, and nested
 * lists and maps are preserved. Missing {@code metadata} decodes to empty metadata, a missing
 * {@code source_id} to {@code null}, missing arrays to no records.</p>
 *
 * <p>Decoding is all-or-nothing. Records are decoded into local lists and the collection is
 * only assembled once every record is valid; otherwise a {@link SerializationException}
 * naming the offending field and record index is thrown.</p>
 */
public class EntityCollectionSerializer {
    private static final Logger log = LoggerFactory.getLogger(EntityCollectionSerializer.class);

    static final String ENTITIES = "entities";
    static final String RELATIONSHIPS = "relationships";
    static final String SOURCE_ID = "source_id";
    static final String ID = "id";
    static final String NAME = "name";
    static final String TYPE = "type";
    static final String SOURCE_TEXT = "source_text";
    static final String START_POSITION = "start_position";
    static final String END_POSITION = "end_position";
    static final String CONFIDENCE = "confidence";
    static final String METADATA = "metadata";
    static final String SOURCE_ENTITY = "source_entity";
    static final String TARGET_ENTITY = "target_entity";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes;

    public EntityCollectionSerializer() {
        this(new ObjectMapper());
    }

    public EntityCollectionSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.nodes = objectMapper.getNodeFactory();
    }

    // ---- encoding ----

    public ObjectNode toTree(EntityCollection collection) {
        ObjectNode root = nodes.objectNode();
        ArrayNode entities = root.putArray(ENTITIES);
        for (Entity entity : collection.getEntities()) {
            ObjectNode node = entities.addObject();
            node.put(ID, entity.getId());
            node.put(NAME, entity.getName());
            node.put(TYPE, entity.getType());
            node.put(SOURCE_TEXT, entity.getSourceText());
            node.put(START_POSITION, entity.getStartPosition());
            node.put(END_POSITION, entity.getEndPosition());
            node.put(CONFIDENCE, entity.getConfidence());
            node.set(METADATA, encodeMetadata(entity.getMetadata()));
        }

        ArrayNode relationships = root.putArray(RELATIONSHIPS);
        for (Relationship relationship : collection.getRelationships()) {
            ObjectNode node = relationships.addObject();
            node.put(ID, relationship.getId());
            node.put(SOURCE_ENTITY, relationship.getSourceEntity());
            node.put(TARGET_ENTITY, relationship.getTargetEntity());
            node.put(TYPE, relationship.getType());
            node.put(CONFIDENCE, relationship.getConfidence());
            node.set(METADATA, encodeMetadata(relationship.getMetadata()));
        }

        root.put(SOURCE_ID, collection.getSourceId());
        return root;
    }

    public String toJson(EntityCollection collection) {
        try {
            return objectMapper.writeValueAsString(toTree(collection));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Could not encode collection: " + e.getOriginalMessage(), e);
        }
    }

    public void write(EntityCollection collection, Writer writer) {
        try {
            objectMapper.writeValue(writer, toTree(collection));
        } catch (IOException e) {
            throw new SerializationException("Could not write collection: " + e.getMessage(), e);
        }
    }

    /**
     * Nested {@code Map}/{@code List} representation of the document.
     */
    public Map<String, Object> toMap(EntityCollection collection) {
        return objectMapper.convertValue(toTree(collection), MAP_TYPE);
    }

    private ObjectNode encodeMetadata(Metadata metadata) {
        ObjectNode node = nodes.objectNode();
        metadata.asMap().forEach((key, value) -> node.set(key, encodeValue(value)));
        return node;
    }

    private JsonNode encodeValue(MetadataValue value) {
        if (value instanceof MetadataValue.StringValue s) {
            return nodes.textNode(s.value());
        }
        if (value instanceof MetadataValue.IntegerValue i) {
            return nodes.numberNode(i.value());
        }
        if (value instanceof MetadataValue.DecimalValue d) {
            return nodes.numberNode(d.value());
        }
        if (value instanceof MetadataValue.BooleanValue b) {
            return nodes.booleanNode(b.value());
        }
        if (value instanceof MetadataValue.ListValue list) {
            ArrayNode array = nodes.arrayNode();
            list.asList().forEach(item -> array.add(encodeValue(item)));
            return array;
        }
        if (value instanceof MetadataValue.MapValue map) {
            ObjectNode object = nodes.objectNode();
            map.entries().forEach((key, item) -> object.set(key, encodeValue(item)));
            return object;
        }
        return nodes.nullNode();
    }

    // ---- decoding ----

    public EntityCollection fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SerializationException("Document must be a JSON object");
        }

        List<Entity> entities = new ArrayList<>();
        JsonNode entityNodes = optionalArray(root, ENTITIES);
        for (int i = 0; i < entityNodes.size(); i++) {
            entities.add(decodeEntity(entityNodes.get(i), ENTITIES + "[" + i + "]"));
        }

        List<Relationship> relationships = new ArrayList<>();
        JsonNode relationshipNodes = optionalArray(root, RELATIONSHIPS);
        for (int i = 0; i < relationshipNodes.size(); i++) {
            relationships.add(decodeRelationship(relationshipNodes.get(i), RELATIONSHIPS + "[" + i + "]"));
        }

        JsonNode sourceNode = root.get(SOURCE_ID);
        if (sourceNode != null && !sourceNode.isNull() && !sourceNode.isTextual()) {
            throw new SerializationException("Field '" + SOURCE_ID + "' must be a string or null");
        }
        String sourceId = sourceNode != null && sourceNode.isTextual() ? sourceNode.asText() : null;

        EntityCollection collection = new EntityCollection(sourceId);
        for (int i = 0; i < entities.size(); i++) {
            try {
                collection.addEntity(entities.get(i));
            } catch (IllegalArgumentException e) {
                throw new SerializationException(ENTITIES + "[" + i + "]: " + e.getMessage(), e);
            }
        }
        relationships.forEach(collection::addRelationship);

        log.debug("collection.decoded sourceId={} entities={} relationships={}",
                sourceId, collection.entityCount(), collection.relationshipCount());
        return collection;
    }

    public EntityCollection fromJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public EntityCollection read(Reader reader) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            throw new SerializationException("Could not read collection: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    public EntityCollection fromMap(Map<String, ?> document) {
        if (document == null) {
            throw new SerializationException("Document must not be null");
        }
        JsonNode root;
        try {
            root = objectMapper.valueToTree(document);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Document is not representable as JSON: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    private Entity decodeEntity(JsonNode node, String path) {
        requireObject(node, path);
        try {
            return Entity.builder()
                    .id(requireText(node, ID, path))
                    .name(requireText(node, NAME, path))
                    .type(requireText(node, TYPE, path))
                    .sourceText(requireText(node, SOURCE_TEXT, path))
                    .startPosition(requireInt(node, START_POSITION, path))
                    .endPosition(requireInt(node, END_POSITION, path))
                    .confidence(requireNumber(node, CONFIDENCE, path))
                    .metadata(decodeMetadata(node.get(METADATA), path))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SerializationException(path + ": " + e.getMessage(), e);
        }
    }

    private Relationship decodeRelationship(JsonNode node, String path) {
        requireObject(node, path);
        return Relationship.builder()
                .id(requireText(node, ID, path))
                .sourceEntity(requireText(node, SOURCE_ENTITY, path))
                .targetEntity(requireText(node, TARGET_ENTITY, path))
                .type(requireText(node, TYPE, path))
                .confidence(requireNumber(node, CONFIDENCE, path))
                .metadata(decodeMetadata(node.get(METADATA), path))
                .build();
    }

    private Metadata decodeMetadata(JsonNode node, String path) {
        Metadata metadata = new Metadata();
        if (node == null || node.isNull()) {
            return metadata;
        }
        if (!node.isObject()) {
            throw fieldError(path, METADATA, "must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            metadata.put(field.getKey(), decodeValue(field.getValue()));
        }
        return metadata;
    }

    private MetadataValue decodeValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MetadataValue.NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new MetadataValue.StringValue(node.asText());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new MetadataValue.IntegerValue(node.longValue());
        }
        if (node.isNumber()) {
            return new MetadataValue.DecimalValue(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new MetadataValue.BooleanValue(node.booleanValue());
        }
        if (node.isArray()) {
            List<MetadataValue> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(decodeValue(item)));
            return new MetadataValue.ListValue(items);
        }
        if (node.isObject()) {
            Map<String, MetadataValue> entries = new LinkedHashMap<>();
            node.fields().forEachRemaining(field -> entries.put(field.getKey(), decodeValue(field.getValue())));
            return new MetadataValue.MapValue(entries);
        }
        // binary and POJO nodes only appear in trees built in memory
        return new MetadataValue.StringValue(node.asText());
    }

    private JsonNode optionalArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return nodes.arrayNode();
        }
        if (!node.isArray()) {
            throw new SerializationException("Field '" + field + "' must be an array");
        }
        return node;
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new SerializationException(path + " must be an object");
        }
    }

    private static String requireText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw fieldError(path, field, "is required");
        }
        if (!value.isTextual()) {
            throw fieldError(path, field, "must be a string");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw fieldError(path, field, "is required");
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw fieldError(path, field, "must be an integer");
        }
        return value.intValue();
    }

    private static double requireNumber(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw fieldError(path, field, "is required");
        }
        if (!value.isNumber()) {
            throw fieldError(path, field, "must be a number");
        }
        return value.doubleValue();
    }

    private static SerializationException fieldError(String path, String field, String problem) {
        return new SerializationException(path + ": field '" + field + "' " + problem);
    }
}
