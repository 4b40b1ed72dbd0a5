package com.market.intel.pipeline.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.market.intel.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client for a local OpenAI-compatible chat endpoint (Ollama, llama.cpp server, ...).
 */
@Component
public class GenerativeSummarizer {
    private final PipelineProperties.Generative properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GenerativeSummarizer(
        PipelineProperties properties,
        @Qualifier("generativeHttpClient") HttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getAnalysis().getGenerative();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String generate(String text, String language, int sentenceCount) throws IOException, InterruptedException {
        if (!isEnabled()) {
            throw new IllegalStateException("Generative summarizer has no base URL configured");
        }
        String input = text.length() > properties.getMaxInputChars()
            ? text.substring(0, properties.getMaxInputChars())
            : text;

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        body.put("temperature", 0);
        body.put("stream", false);
        ArrayNode messages = body.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", "Summarize the following company web page in at most " + sentenceCount
                + " sentences, written in the language with ISO code '" + language + "'. Reply with the summary only.");
        messages.addObject()
            .put("role", "user")
            .put("content", input);

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(chatCompletionsUrl()))
            .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            request.header("Authorization", "Bearer " + properties.getApiKey().trim());
        }

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Summarizer endpoint returned HTTP " + response.statusCode());
        }
        JsonNode content = objectMapper.readTree(response.body())
            .path("choices")
            .path(0)
            .path("message")
            .path("content");
        return content.isTextual() ? content.asText().trim() : "";
    }

    private String chatCompletionsUrl() {
        String base = properties.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/chat/completions";
    }
}
