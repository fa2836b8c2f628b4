package com.entity.extraction.llm;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.Relationship;
import com.entity.extraction.extraction.ExtractionException;
import com.entity.extraction.extraction.ExtractionParameters;
import com.entity.extraction.observation.Observation;
import com.entity.extraction.observation.ObservationRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LanguageModelEntityExtractorTest {

    private static final String TEXT = "Omar works at Acme. Alice uses Java. Omar likes Acme.";

    @Mock
    private LLMProvider provider;

    private LanguageModelEntityExtractor extractor;

    @BeforeEach
    void setUp() {
        lenient().when(provider.getProviderName()).thenReturn("Mock");
        extractor = new LanguageModelEntityExtractor(provider);
    }

    @Nested
    @DisplayName("Mention mapping")
    class MentionMapping {

        @BeforeEach
        void stubProvider() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.extract(any())).thenReturn(new LLMExtractionResponse(
                    List.of(
                            new LLMExtractionResponse.Mention("Omar", "PERSON", 0.9),
                            new LLMExtractionResponse.Mention("Acme", "ORG", 0.85),
                            new LLMExtractionResponse.Mention("Alice", "PERSON", 0.4),
                            new LLMExtractionResponse.Mention("Java", "language", 0.8),
                            new LLMExtractionResponse.Mention("Bob", "PERSON", 0.95),
                            new LLMExtractionResponse.Mention("Monday", "WEEKDAY", 0.9),
                            new LLMExtractionResponse.Mention("Omar", "PERSON", 0.7)),
                    List.of(
                            new LLMExtractionResponse.Relation("Omar", "Acme", "works"),
                            new LLMExtractionResponse.Relation("Alice", "Java", "uses"))));
        }

        @Test
        @DisplayName("Maps labels to types and drops low-confidence, unmapped and absent mentions")
        void mapsAndFilters() {
            EntityCollection result = extractor.extractEntities(TEXT, ExtractionParameters.forSource("doc-1"));

            List<String> names = result.getEntities().stream().map(Entity::getName).toList();
            assertEquals(List.of("Omar", "Acme", "Java", "Omar"), names);
            assertEquals("Person", result.getEntities().get(0).getType());
            assertEquals("Organization", result.getEntities().get(1).getType());
            assertEquals("Technology", result.getEntities().get(2).getType());
            assertEquals("doc-1", result.getSourceId());
        }

        @Test
        @DisplayName("Repeated mentions map to successive occurrences")
        void successiveOccurrences() {
            EntityCollection result = extractor.extractEntities(TEXT);

            assertEquals(0, result.getEntities().get(0).getStartPosition());
            assertEquals(37, result.getEntities().get(3).getStartPosition());
            assertEquals(41, result.getEntities().get(3).getEndPosition());
        }

        @Test
        @DisplayName("Entities keep the model label and one observation")
        void labelAndObservation() {
            EntityCollection result = extractor.extractEntities(TEXT);

            Entity acme = result.getEntities().get(1);
            assertEquals("ORG", acme.getMetadata().getString("model_label"));
            assertEquals(0.85, acme.getConfidence());

            List<Observation> observations = ObservationRecorder.getObservations(acme);
            assertEquals(1, observations.size());
            assertEquals("Omar works at ", observations.get(0).contextBefore());
            assertEquals("LanguageModelEntityExtractor(Mock)", observations.get(0).extractor());
        }

        @Test
        @DisplayName("Relations become typed relationships between resolved entities")
        void relations() {
            EntityCollection result = extractor.extractEntities(TEXT);

            assertEquals(1, result.relationshipCount());
            Relationship worksOn = result.getRelationships().get(0);
            assertEquals("worksOn", worksOn.getType());
            assertEquals(result.getEntities().get(0).getId(), worksOn.getSourceEntity());
            assertEquals(result.getEntities().get(1).getId(), worksOn.getTargetEntity());
            assertEquals(0.595, worksOn.getConfidence(), 1e-9);
            assertEquals("works", worksOn.getMetadata().getString("verb"));
            assertEquals("Omar works Acme", ObservationRecorder.getObservations(worksOn).get(0).context());
        }
    }

    @Test
    @DisplayName("Unavailable provider raises ExtractionException")
    void unavailableProvider() {
        when(provider.isAvailable()).thenReturn(false);

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extractEntities(TEXT));
        assertTrue(e.getMessage().contains("Mock"));
        verify(provider, never()).extract(any());
    }

    @Test
    @DisplayName("Provider failures propagate")
    void providerFailurePropagates() {
        when(provider.isAvailable()).thenReturn(true);
        when(provider.extract(any())).thenThrow(new ExtractionException("model crashed"));

        assertThrows(ExtractionException.class, () -> extractor.extractEntities(TEXT));
    }

    @Test
    @DisplayName("The request carries the text and the configured labels")
    void requestContents() {
        when(provider.isAvailable()).thenReturn(true);
        when(provider.extract(any())).thenReturn(LLMExtractionResponse.empty());
        LanguageModelEntityExtractor custom = new LanguageModelEntityExtractor(provider,
                LanguageModelExtractorConfig.builder().labelMapping(Map.of("DRUG", "Medication")).build());

        EntityCollection result = custom.extractEntities("Aspirin helps.");

        ArgumentCaptor<LLMExtractionRequest> captor = ArgumentCaptor.forClass(LLMExtractionRequest.class);
        verify(provider).extract(captor.capture());
        assertEquals("Aspirin helps.", captor.getValue().text());
        assertEquals(List.of("DRUG"), captor.getValue().labels());
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("NoOp provider is reported unavailable")
    void noOpProvider() {
        LanguageModelEntityExtractor noOp = new LanguageModelEntityExtractor(new NoOpLLMProvider());

        assertEquals("LanguageModelEntityExtractor(NoOp)", noOp.getName());
        assertThrows(ExtractionException.class, () -> noOp.extractEntities(TEXT));
    }

    @Test
    @DisplayName("Verbs map to relationship types, including simple inflections")
    void verbMapping() {
        assertEquals("uses", LanguageModelEntityExtractor.relationshipType("use"));
        assertEquals("uses", LanguageModelEntityExtractor.relationshipType("Utilizes"));
        assertEquals("worksOn", LanguageModelEntityExtractor.relationshipType("works"));
        assertEquals("worksOn", LanguageModelEntityExtractor.relationshipType("collaborating"));
        assertEquals("has", LanguageModelEntityExtractor.relationshipType("owned"));
        assertEquals("has", LanguageModelEntityExtractor.relationshipType("had"));
        assertEquals("dependsOn", LanguageModelEntityExtractor.relationshipType("relies"));
        assertEquals("creates", LanguageModelEntityExtractor.relationshipType("built"));
        assertEquals("creates", LanguageModelEntityExtractor.relationshipType("developed"));
        assertEquals("relatesTo", LanguageModelEntityExtractor.relationshipType("likes"));
        assertEquals("relatesTo", LanguageModelEntityExtractor.relationshipType(""));
    }

    @Test
    @DisplayName("Invalid configuration is rejected")
    void invalidConfig() {
        assertThrows(IllegalArgumentException.class, () ->
                LanguageModelExtractorConfig.builder().minConfidence(1.5).build());
        assertThrows(IllegalArgumentException.class, () ->
                LanguageModelExtractorConfig.builder().labelMapping(Map.of()).build());
        assertEquals("Location", LanguageModelExtractorConfig.defaults().getLabelMapping().get("GPE"));
    }
}
