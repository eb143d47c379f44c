package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.analysis.AnalysisClient;
import com.enterprise.orchestrator.core.exception.AnalysisException;
import com.enterprise.orchestrator.core.exception.RateLimitedException;
import com.enterprise.orchestrator.core.model.AnalysisPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * {@link AnalysisClient} backed by the Gemini {@code generateContent} REST endpoint.
 * HTTP 429 surfaces as {@link RateLimitedException} so the caller's backoff can take over.
 */
@Slf4j
@Service
public class GeminiAnalysisClient implements AnalysisClient {

    private static final String PROMPT_TEMPLATE = """
            Analyze the following text from a single page of a document and provide a structured JSON response.
            The JSON should include:
            1. "summary": A brief summary of the page content.
            2. "entities": A list of key entities (people, organizations, locations, etc.) mentioned on this page.
            3. "keyPoints": A list of main points discussed on this page.
            4. "sentiment": The overall sentiment of the text.

            Text:
            %s

            Return ONLY the JSON object.
            """;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public GeminiAnalysisClient(RestClient.Builder restClientBuilder,
                                ObjectMapper objectMapper,
                                @Value("${gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                                @Value("${gemini.api-key:}") String apiKey,
                                @Value("${gemini.model:gemini-2.0-flash-lite}") String model) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("gemini.api-key is not set, page analysis calls will be rejected");
        }
    }

    @Override
    public AnalysisPayload analyze(String pageText) {
        log.debug("Analysing page with Gemini: model={}, chars={}", model, pageText.length());

        Map<String, Object> request = Map.of(
                "contents", List.of(Map.of(
                        "parts", List.of(Map.of("text", PROMPT_TEMPLATE.formatted(pageText))))));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1beta/models/{model}:generateContent?key={key}", model, apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new RateLimitedException("Gemini rate limit: 429 Too Many Requests", e);
            }
            throw new AnalysisException("Gemini request failed: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new AnalysisException("Gemini request failed: " + e.getMessage(), e);
        }

        return parsePayload(extractText(response));
    }

    private String extractText(JsonNode response) {
        JsonNode text = response == null ? null : response.path("candidates").path(0)
                .path("content").path("parts").path(0).path("text");
        if (text == null || !text.isTextual()) {
            throw new AnalysisException("Gemini response contained no text candidate");
        }
        return text.asText();
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    /**
     * Parses the model output, tolerating markdown fences or prose around the JSON object.
     */
    AnalysisPayload parsePayload(String modelText) {
        int start = modelText.indexOf('{');
        int end = modelText.lastIndexOf('}');
        String json = start >= 0 && end > start ? modelText.substring(start, end + 1) : modelText;
        try {
            return objectMapper.readValue(json, AnalysisPayload.class);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Gemini response was not valid JSON", e);
        }
    }
}
