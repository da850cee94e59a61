package com.rdslens.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.inference.InferenceClient;
import com.rdslens.inference.InferenceResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolver that asks the inference service to pick the instance.
 *
 * The model answers {@code {"rds_instance": <identifier or null>}}. A failed call, a body that is
 * not JSON, a null or missing field, or an identifier that is not one of the candidates all count as
 * no match.
 */
@Slf4j
public class InferenceNameResolver extends AbstractCachingNameResolver {

    static final String RESULT_FIELD = "rds_instance";

    private static final String SYSTEM_PROMPT =
            "You are a helpful assistant that finds the best matching RDS instance name. Always respond with valid JSON.";

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;

    public InferenceNameResolver(
            InstanceDirectory directory,
            NameResolutionCache cache,
            InferenceClient inferenceClient,
            ObjectMapper objectMapper
    ) {
        super(directory, cache);
        this.inferenceClient = inferenceClient;
        this.objectMapper = objectMapper;
    }

    @Override
    protected Optional<String> match(String rawName, List<String> candidates) {
        InferenceResult result = inferenceClient.completeJson(SYSTEM_PROMPT, buildPrompt(rawName, candidates));
        if (!result.isSuccess()) {
            log.error("No response from inference service: {}", result.isEnabled() ? result.getError() : "disabled");
            return Optional.empty();
        }

        String identifier;
        try {
            JsonNode node = objectMapper.readTree(result.getContent()).path(RESULT_FIELD);
            identifier = node.isTextual() ? node.asText().trim() : null;
        } catch (IOException e) {
            log.error("Error parsing JSON response: {}", e.getMessage());
            return Optional.empty();
        }

        if (identifier == null || identifier.isEmpty()) {
            return Optional.empty();
        }
        if (!candidates.contains(identifier)) {
            log.warn("Inference service returned unknown rds instance '{}' for '{}'", identifier, rawName);
            return Optional.empty();
        }
        return Optional.of(identifier);
    }

    @Override
    public String strategy() {
        return "inference";
    }

    String buildPrompt(String rawName, List<String> candidates) {
        StringBuilder sb = new StringBuilder();
        sb.append("Given the database name: ").append(rawName)
                .append(", please find the most likely RDS instance name from the following list: ");
        try {
            sb.append(objectMapper.writeValueAsString(candidates));
        } catch (IOException e) {
            sb.append(candidates);
        }
        sb.append("\nFormat your response as a JSON object with:\n")
                .append("{\n")
                .append("    \"").append(RESULT_FIELD).append("\": \"best matching rds instance name or null\"\n")
                .append("}\n");
        return sb.toString();
    }
}
