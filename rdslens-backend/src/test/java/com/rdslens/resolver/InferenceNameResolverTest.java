package com.rdslens.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.inference.InferenceClient;
import com.rdslens.inference.InferenceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InferenceNameResolverTest {

    private InstanceDirectory directory;
    private InferenceClient inferenceClient;
    private NameResolutionCache cache;
    private InferenceNameResolver resolver;

    @BeforeEach
    void setUp() {
        directory = mock(InstanceDirectory.class);
        when(directory.listIdentifiers()).thenReturn(List.of("orders-prod", "billing-prod"));
        inferenceClient = mock(InferenceClient.class);
        cache = new NameResolutionCache(100);
        resolver = new InferenceNameResolver(directory, cache, inferenceClient, new ObjectMapper());
    }

    @Test
    void acceptsCandidateChosenByModel() {
        when(inferenceClient.completeJson(anyString(), anyString()))
                .thenReturn(InferenceResult.success("{\"rds_instance\": \"orders-prod\"}"));

        assertThat(resolver.resolve("the orders database")).contains("orders-prod");
        assertThat(cache.get("the orders database")).contains("orders-prod");
    }

    @Test
    void cacheHitMakesNoRemoteCalls() {
        cache.put("orders", "orders-prod");

        assertThat(resolver.resolve("orders")).contains("orders-prod");

        verify(inferenceClient, never()).completeJson(anyString(), anyString());
        verify(directory, never()).listIdentifiers();
    }

    @Test
    void nullAnswerIsNoMatchAndNotCached() {
        when(inferenceClient.completeJson(anyString(), anyString()))
                .thenReturn(InferenceResult.success("{\"rds_instance\": null}"));

        assertThat(resolver.resolve("unknown")).isEmpty();
        assertThat(resolver.resolve("unknown")).isEmpty();

        verify(inferenceClient, times(2)).completeJson(anyString(), anyString());
        assertThat(cache.size()).isZero();
    }

    @Test
    void identifierOutsideCandidatesIsRejected() {
        when(inferenceClient.completeJson(anyString(), anyString()))
                .thenReturn(InferenceResult.success("{\"rds_instance\": \"made-up-db\"}"));

        assertThat(resolver.resolve("orders")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void unparseableOrFailedAnswerIsNoMatch() {
        when(inferenceClient.completeJson(anyString(), anyString()))
                .thenReturn(InferenceResult.success("not json"))
                .thenReturn(InferenceResult.error("HTTP 500"))
                .thenReturn(InferenceResult.disabled());

        assertThat(resolver.resolve("orders")).isEmpty();
        assertThat(resolver.resolve("orders")).isEmpty();
        assertThat(resolver.resolve("orders")).isEmpty();
    }

    @Test
    void promptListsCandidatesAndResultField() {
        String prompt = resolver.buildPrompt("orders", List.of("orders-prod", "billing-prod"));

        assertThat(prompt)
                .contains("Given the database name: orders")
                .contains("[\"orders-prod\",\"billing-prod\"]")
                .contains("\"rds_instance\"");
        assertThat(resolver.strategy()).isEqualTo("inference");
    }
}
