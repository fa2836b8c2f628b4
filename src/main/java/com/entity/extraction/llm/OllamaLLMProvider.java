package com.entity.extraction.llm;

import com.entity.extraction.extraction.ExtractionException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM provider implementation using Ollama.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * Install: https://ollama.ai
 * Pull model: ollama pull llama3.2
 *
 * <p>The model is asked to answer with a single JSON document:</p>
 * <pre>
 * {"entities": [{"name": "Omar", "label": "PERSON", "confidence": 0.9}],
 *  "relationships": [{"source": "Omar", "target": "LifeSync", "verb": "works"}]}
 * </pre>
 *
 * Usage:
 * <pre>
 * OllamaLLMProvider provider = OllamaLLMProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 *
 * EntityExtractor extractor = new LanguageModelEntityExtractor(provider);
 * </pre>
 */
public class OllamaLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaLLMProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaLLMProvider(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public LLMExtractionResponse extract(LLMExtractionRequest request) {
        log.info("Extracting entities via Ollama: model={} textLength={}", model, request.text().length());

        String response;
        try {
            response = callOllama(buildPrompt(request));
        } catch (IOException e) {
            throw new ExtractionException("Error calling Ollama at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while calling Ollama", e);
        }
        return parseResponse(response);
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Builds the prompt for mention and relation extraction.
     */
    String buildPrompt(LLMExtractionRequest request) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("You are a named entity recognition system. Find the named entities in the text below ");
        prompt.append("and the relations stated between them.\n\n");

        if (!request.labels().isEmpty()) {
            prompt.append("Use only these entity labels: ").append(String.join(", ", request.labels())).append("\n\n");
        }

        prompt.append("Instructions:\n");
        prompt.append("1. Copy every entity name exactly as it is written in the text.\n");
        prompt.append("2. Give each entity a confidence score from 0.0 to 1.0.\n");
        prompt.append("3. A relation links a subject entity to an object entity through the main verb of a sentence.\n");
        prompt.append("4. Give the verb in its base form (e.g. \"use\", \"work\", \"build\").\n\n");

        prompt.append("Respond with a single JSON object in this exact format:\n");
        prompt.append("{\"entities\": [{\"name\": \"...\", \"label\": \"...\", \"confidence\": 0.0}], ");
        prompt.append("\"relationships\": [{\"source\": \"...\", \"target\": \"...\", \"verb\": \"...\"}]}\n\n");

        prompt.append("Text:\n").append(request.text()).append("\n");

        return prompt.toString();
    }

    /**
     * Calls the Ollama API.
     */
    private String callOllama(String prompt) throws IOException, InterruptedException {
        OllamaRequest ollamaRequest = new OllamaRequest(model, prompt, false, "json");
        String requestBody = objectMapper.writeValueAsString(ollamaRequest);

        log.debug("Calling Ollama with model: {}", model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new ExtractionException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        String text = ollamaResponse.response() != null ? ollamaResponse.response() : "";
        log.debug("Ollama response received, length: {}", text.length());

        return text;
    }

    /**
     * Parses the model's answer. The first JSON object in the answer is read; unknown
     * fields are ignored, and entries without a name/label or source/target are skipped.
     *
     * @throws ExtractionException if the answer contains no readable JSON object
     */
    LLMExtractionResponse parseResponse(String response) {
        log.debug("Parsing LLM response:\n{}", response);

        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExtractionException("LLM response contains no JSON object");
        }

        ExtractionDocument document;
        try {
            document = objectMapper.readValue(response.substring(start, end + 1), ExtractionDocument.class);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Could not parse LLM response: " + e.getOriginalMessage(), e);
        }

        List<LLMExtractionResponse.Mention> mentions = new ArrayList<>();
        if (document.entities() != null) {
            for (EntityDto dto : document.entities()) {
                if (dto == null || isBlank(dto.name()) || isBlank(dto.label())) {
                    continue;
                }
                double confidence = dto.confidence() != null ? dto.confidence() : 0.5;
                // Some models answer in percent
                if (confidence > 1.0 && confidence <= 100.0) {
                    confidence = confidence / 100.0;
                }
                mentions.add(new LLMExtractionResponse.Mention(dto.name().trim(), dto.label().trim(),
                        Math.min(1.0, Math.max(0.0, confidence))));
            }
        }

        List<LLMExtractionResponse.Relation> relations = new ArrayList<>();
        if (document.relationships() != null) {
            for (RelationshipDto dto : document.relationships()) {
                if (dto == null || isBlank(dto.source()) || isBlank(dto.target())) {
                    continue;
                }
                relations.add(new LLMExtractionResponse.Relation(dto.source().trim(), dto.target().trim(),
                        dto.verb() != null ? dto.verb().trim() : ""));
            }
        }

        log.info("LLM result: mentions={}, relations={}", mentions.size(), relations.size());
        return new LLMExtractionResponse(mentions, relations);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama provider with llama3.2.
     */
    public static OllamaLLMProvider createDefault() {
        return builder().build();
    }

    /**
     * Creates an Ollama provider with a custom model.
     */
    public static OllamaLLMProvider withModel(String model) {
        return builder().model(model).build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaLLMProvider build() {
            return new OllamaLLMProvider(this);
        }
    }

    // Request/Response DTOs for Ollama API
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}

    // DTOs for the JSON document the model is asked to produce
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ExtractionDocument(
            List<EntityDto> entities,
            List<RelationshipDto> relationships
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EntityDto(
            String name,
            String label,
            Double confidence
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RelationshipDto(
            String source,
            String target,
            String verb
    ) {}
}
