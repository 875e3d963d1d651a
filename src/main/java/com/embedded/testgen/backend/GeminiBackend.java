package com.embedded.testgen.backend;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.exception.GenerationInterruptedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Google Gemini {@code generateContent} over REST. The API key travels in the
 * {@code x-goog-api-key} header, never in the URL.
 */
public class GeminiBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(GeminiBackend.class);

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    public static final String API_VERSION = "v1beta";
    private static final int MAX_LOGGED_CHARS = 500;

    private final String model;
    private final String apiKey;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiBackend(String model, String apiKey, String baseUrl, Duration requestTimeout,
            HttpClient httpClient, ObjectMapper objectMapper) {
        this.model = model;
        this.apiKey = apiKey;
        this.endpoint = URI.create(String.format("%s/%s/models/%s:generateContent",
                stripTrailingSlash(baseUrl), API_VERSION, model));
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * One backend per model name, in the given order, sharing a single HTTP client.
     */
    public static List<GenerationBackend> forModels(List<String> models, String apiKey, String baseUrl,
            Duration requestTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        ObjectMapper mapper = new ObjectMapper();
        return models.stream()
                .map(m -> (GenerationBackend) new GeminiBackend(m, apiKey, baseUrl, requestTimeout, client, mapper))
                .toList();
    }

    @Override
    public String getName() {
        return model;
    }

    @Override
    public String generate(String prompt) throws BackendCallException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendCallException(model + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationInterruptedException("Interrupted while waiting for " + model, e);
        }

        if (response.statusCode() != 200) {
            log.debug("{} returned HTTP {}: {}", model, response.statusCode(), truncate(response.body()));
            throw new BackendCallException(model + " returned HTTP " + response.statusCode() + ": "
                    + truncate(response.body()), response.statusCode(), null);
        }
        return extractText(response.body());
    }

    String requestBody(String prompt) throws BackendCallException {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendCallException("Could not encode request for " + model, e);
        }
    }

    String extractText(String json) throws BackendCallException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BackendCallException(model + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text.isMissingNode() || text.asText().isBlank()) {
            String finishReason = root.path("candidates").path(0).path("finishReason").asText("none");
            throw new BackendCallException(model + " returned no text (finishReason=" + finishReason + ")");
        }
        return text.asText();
    }

    private static String truncate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_LOGGED_CHARS ? s : s.substring(0, MAX_LOGGED_CHARS) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
