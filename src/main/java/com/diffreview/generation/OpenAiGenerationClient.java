package com.diffreview.generation;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final List<String> LEGACY_MODEL_MARKERS = List.of(
            "gpt-3.5-turbo-instruct", "text-davinci", "text-curie", "text-babbage", "text-ada");
    private static final double STRUCTURED_TEMPERATURE = 0.3;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public OpenAiGenerationClient(OkHttpClient httpClient, String endpoint, String apiKey, String model, int maxTokens) {
        this.httpClient = httpClient;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public String complete(String systemPrompt, String userContent, boolean structured) throws IOException {
        if (userContent == null || userContent.isEmpty()) {
            throw new IllegalArgumentException("Patch content for generation must not be empty");
        }
        String payload = mapper.writeValueAsString(requestBody(systemPrompt, userContent, structured));
        Request request = new Request.Builder()
                .url(endpoint + "/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload, JSON))
                .build();

        log.info("generation.request model={} structured={} tokenParam={} maxTokens={} contentChars={}",
                model, structured, tokenParameter(), maxTokens, userContent.length());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Generation backend error " + response.code() + ": " + text);
            }
            JsonNode root = mapper.readTree(text);
            JsonNode usage = root.path("usage");
            if (!usage.isMissingNode()) {
                log.info("generation.usage promptTokens={} completionTokens={} totalTokens={}",
                        usage.path("prompt_tokens").asInt(0),
                        usage.path("completion_tokens").asInt(0),
                        usage.path("total_tokens").asInt(0));
            }
            return root.path("choices").path(0).path("message").path("content").asText("");
        }
    }

    ObjectNode requestBody(String systemPrompt, String userContent, boolean structured) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put(tokenParameter(), maxTokens);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userContent);
        if (structured) {
            body.putObject("response_format").put("type", "json_object");
            body.put("temperature", STRUCTURED_TEMPERATURE);
        }
        return body;
    }

    String tokenParameter() {
        String normalized = model.toLowerCase(Locale.ROOT);
        boolean legacy = LEGACY_MODEL_MARKERS.stream().anyMatch(normalized::contains);
        return legacy ? "max_tokens" : "max_completion_tokens";
    }
}
