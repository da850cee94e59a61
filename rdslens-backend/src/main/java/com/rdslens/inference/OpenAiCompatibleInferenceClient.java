package com.rdslens.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link InferenceClient} for any OpenAI-compatible chat-completions endpoint.
 *
 * Uses plain HTTP through {@link HttpClient}; no vendor SDK. Requests JSON-object output with a low
 * temperature and rejects answers that are not valid JSON.
 */
@Component
public class OpenAiCompatibleInferenceClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleInferenceClient.class);

    private static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final int DEFAULT_TIMEOUT_MS = 30000;
    private static final int MAX_TOKENS = 500;
    private static final double TEMPERATURE = 0.1;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    public OpenAiCompatibleInferenceClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether inference is enabled. Never logs the API key.
     */
    @PostConstruct
    public void logConfigStatus() {
        GatewayConfig config = GatewayConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Inference name matching is ENABLED (base_url={}, model={})", config.baseUrl(), config.model());
            return;
        }
        log.warn("Inference name matching is DISABLED (base_url={}, api_key_configured=false)", config.baseUrl());
    }

    @Override
    public boolean isEnabled() {
        return GatewayConfig.fromEnvironment(environment).isEnabled();
    }

    @Override
    public InferenceResult completeJson(String systemPrompt, String userPrompt) {
        GatewayConfig config = GatewayConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            return InferenceResult.disabled();
        }

        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", config.model());
            payload.put("messages", List.of(
                    Map.of("role", "system", "content", systemPrompt),
                    Map.of("role", "user", "content", userPrompt)
            ));
            payload.put("max_tokens", MAX_TOKENS);
            payload.put("temperature", TEMPERATURE);
            payload.put("response_format", Map.of("type", "json_object"));

            String json = objectMapper.writeValueAsString(payload);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + config.apiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() >= 400) {
                log.warn("Inference request failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                return InferenceResult.error("Inference gateway error: HTTP " + response.statusCode());
            }

            String content = extractContent(response.body());
            if (content.isBlank()) {
                log.error("Inference gateway returned no usable JSON content");
                return InferenceResult.error("Inference gateway returned invalid JSON output");
            }
            return InferenceResult.success(content);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return InferenceResult.error("Inference call interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("Error calling inference gateway: {}", e.getMessage());
            return InferenceResult.error("Inference call failed: " + e.getMessage());
        }
    }

    /**
     * Pull the message content out of a chat-completions body and return it only if it parses as JSON.
     *
     * @param body raw response body
     * @return the JSON content, or an empty string
     */
    String extractContent(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            String content = contentNode.isTextual() ? contentNode.asText().trim() : "";
            if (content.startsWith("```")) {
                content = content.replaceFirst("^```[a-zA-Z0-9_-]*\\n", "");
                content = content.replaceFirst("\\n```$", "").trim();
            }
            if (content.isEmpty()) {
                return "";
            }
            objectMapper.readTree(content);
            return content;
        } catch (IOException e) {
            log.error("Error parsing JSON response: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Gateway configuration resolved from Spring properties, falling back to environment variables.
     */
    record GatewayConfig(String baseUrl, String apiKey, String model, int timeoutMs) {

        static GatewayConfig fromEnvironment(Environment environment) {
            String baseUrl = getTrimmed(environment, "rdslens.ai.base-url", "OPENAI_BASE_URL");
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }

            String apiKey = getTrimmed(environment, "rdslens.ai.api-key", "OPENAI_API_KEY");

            String model = getTrimmed(environment, "rdslens.ai.model", "OPENAI_MODEL");
            if (model == null || model.isBlank()) {
                model = DEFAULT_MODEL;
            }

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeoutRaw = getTrimmed(environment, "rdslens.ai.timeout-ms", "OPENAI_TIMEOUT_MS");
            if (timeoutRaw != null && !timeoutRaw.isBlank()) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid rdslens.ai.timeout-ms value: {}", timeoutRaw);
                }
            }

            return new GatewayConfig(baseUrl, apiKey, model, timeoutMs);
        }

        boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        private static String getTrimmed(Environment environment, String propKey, String envKey) {
            String v = null;
            if (environment != null) {
                v = environment.getProperty(propKey);
                if (v == null || v.isBlank()) {
                    v = environment.getProperty(envKey);
                }
            }
            return v != null ? v.trim() : null;
        }
    }
}
