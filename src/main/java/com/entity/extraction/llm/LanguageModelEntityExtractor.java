package com.entity.extraction.llm;

import com.entity.extraction.confidence.ConfidenceCalculator;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.EntityFactory;
import com.entity.extraction.core.model.Metadata;
import com.entity.extraction.core.model.Relationship;
import com.entity.extraction.extraction.EntityExtractor;
import com.entity.extraction.extraction.ExtractionException;
import com.entity.extraction.extraction.ExtractionParameters;
import com.entity.extraction.extraction.TextContext;
import com.entity.extraction.observation.ObservationRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Model-based extractor backed by an {@link LLMProvider}.
 *
 * <p>The provider reports mentions with a label and a confidence. Each mention whose label
 * is mapped and whose confidence reaches the configured minimum is located in the text
 * (repeated mentions of the same string map to successive occurrences) and becomes an
 * entity with one observation. Mentions that cannot be found in the text are dropped, so
 * every entity has a real position.</p>
 *
 * <p>Relations become relationships whose type is derived from the verb:
 * use/utilize/employ -&gt; uses, work/collaborate -&gt; worksOn, have/own/possess -&gt; has,
 * depend/rely -&gt; dependsOn, create/make/develop/build -&gt; creates, anything else
 * relatesTo. Their confidence is the weakest endpoint scaled by the relation strength.</p>
 *
 * <p>An unavailable provider makes {@link #extractEntities} throw {@link ExtractionException}.</p>
 */
public class LanguageModelEntityExtractor implements EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(LanguageModelEntityExtractor.class);

    static final String MODEL_LABEL_KEY = "model_label";
    static final String VERB_KEY = "verb";
    static final String DEFAULT_RELATIONSHIP_TYPE = "relatesTo";

    private static final Map<String, String> VERB_TYPES = Map.ofEntries(
            Map.entry("use", "uses"),
            Map.entry("utilize", "uses"),
            Map.entry("employ", "uses"),
            Map.entry("work", "worksOn"),
            Map.entry("collaborate", "worksOn"),
            Map.entry("have", "has"),
            Map.entry("own", "has"),
            Map.entry("possess", "has"),
            Map.entry("depend", "dependsOn"),
            Map.entry("rely", "dependsOn"),
            Map.entry("create", "creates"),
            Map.entry("make", "creates"),
            Map.entry("develop", "creates"),
            Map.entry("build", "creates")
    );

    private final LLMProvider provider;
    private final LanguageModelExtractorConfig config;
    private final EntityFactory entityFactory;
    private final ObservationRecorder observationRecorder;

    public LanguageModelEntityExtractor(LLMProvider provider) {
        this(provider, LanguageModelExtractorConfig.defaults());
    }

    public LanguageModelEntityExtractor(LLMProvider provider, LanguageModelExtractorConfig config) {
        this(provider, config, EntityFactory.defaultFactory(), ObservationRecorder.defaultRecorder());
    }

    public LanguageModelEntityExtractor(LLMProvider provider, LanguageModelExtractorConfig config,
                                        EntityFactory entityFactory, ObservationRecorder observationRecorder) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.entityFactory = Objects.requireNonNull(entityFactory, "entityFactory is required");
        this.observationRecorder = Objects.requireNonNull(observationRecorder, "observationRecorder is required");
    }

    @Override
    public EntityCollection extractEntities(String text, ExtractionParameters parameters) {
        Objects.requireNonNull(text, "text is required");
        ExtractionParameters params = parameters != null ? parameters : ExtractionParameters.empty();
        String sourceId = params.getSourceId();

        if (!provider.isAvailable()) {
            throw new ExtractionException("LLM provider " + provider.getProviderName() + " is not available");
        }

        LLMExtractionRequest request = LLMExtractionRequest.builder()
                .text(text)
                .labels(List.copyOf(config.getLabelMapping().keySet()))
                .build();
        LLMExtractionResponse response = provider.extract(request);

        EntityCollection collection = new EntityCollection(sourceId);
        Map<String, Integer> searchFrom = new HashMap<>();

        for (LLMExtractionResponse.Mention mention : response.mentions()) {
            String type = config.getLabelMapping().get(mention.label().toUpperCase(Locale.ROOT));
            if (type == null) {
                log.debug("Skipping mention '{}' with unmapped label {}", mention.text(), mention.label());
                continue;
            }
            if (mention.confidence() < config.getMinConfidence()) {
                log.debug("Skipping mention '{}' below minimum confidence: {}", mention.text(), mention.confidence());
                continue;
            }

            int start = text.indexOf(mention.text(), searchFrom.getOrDefault(mention.text(), 0));
            if (start < 0) {
                log.debug("Skipping mention '{}' not found in text", mention.text());
                continue;
            }
            int end = start + mention.text().length();
            searchFrom.put(mention.text(), end);

            Metadata metadata = new Metadata().put(MODEL_LABEL_KEY, mention.label());
            Entity entity = entityFactory.createEntity(mention.text(), type, mention.text(),
                    start, end, mention.confidence(), metadata);
            observationRecorder.recordEntityObservation(entity, sourceId,
                    TextContext.before(text, start, config.getContextWindow()),
                    TextContext.after(text, end, config.getContextWindow()),
                    getName());
            collection.addEntity(entity);
        }

        for (LLMExtractionResponse.Relation relation : response.relations()) {
            Entity source = findByName(collection, relation.source());
            Entity target = findByName(collection, relation.target());
            if (source == null || target == null) {
                log.debug("Skipping relation '{}' -> '{}' without both entities", relation.source(), relation.target());
                continue;
            }

            double confidence = ConfidenceCalculator.calculateRelationshipConfidence(
                    source.getConfidence(), target.getConfidence(), config.getRelationStrength());
            Relationship relationship = entityFactory.createRelationship(source.getId(), target.getId(),
                    relationshipType(relation.verb()), confidence,
                    new Metadata().put(VERB_KEY, relation.verb()));
            observationRecorder.recordRelationshipObservation(relationship, sourceId,
                    relation.source() + " " + relation.verb() + " " + relation.target(), getName());
            collection.addRelationship(relationship);
        }

        log.debug("extraction.completed extractor={} sourceId={} entities={} relationships={}",
                getName(), sourceId, collection.entityCount(), collection.relationshipCount());
        return collection;
    }

    @Override
    public String getName() {
        return "LanguageModelEntityExtractor(" + provider.getProviderName() + ")";
    }

    /**
     * Maps a verb to a relationship type, accepting simple inflections (works, used, relies, building).
     */
    static String relationshipType(String verb) {
        String lemma = verb == null ? "" : verb.trim().toLowerCase(Locale.ROOT);
        if (VERB_TYPES.containsKey(lemma)) {
            return VERB_TYPES.get(lemma);
        }
        if (lemma.endsWith("ies") || lemma.endsWith("ied")) {
            String stem = lemma.substring(0, lemma.length() - 3) + "y";
            if (VERB_TYPES.containsKey(stem)) {
                return VERB_TYPES.get(stem);
            }
        }
        for (String suffix : List.of("ing", "ed", "es", "s", "d")) {
            if (lemma.endsWith(suffix)) {
                String stem = lemma.substring(0, lemma.length() - suffix.length());
                if (VERB_TYPES.containsKey(stem)) {
                    return VERB_TYPES.get(stem);
                }
                if (VERB_TYPES.containsKey(stem + "e")) {
                    return VERB_TYPES.get(stem + "e");
                }
            }
        }
        // irregular past forms of the mapped verbs
        return switch (lemma) {
            case "had" -> "has";
            case "made" -> "creates";
            case "built" -> "creates";
            default -> DEFAULT_RELATIONSHIP_TYPE;
        };
    }

    private static Entity findByName(EntityCollection collection, String name) {
        for (Entity entity : collection.getEntities()) {
            if (entity.getName().equals(name)) {
                return entity;
            }
        }
        return null;
    }

    public LLMProvider getProvider() {
        return provider;
    }
}
