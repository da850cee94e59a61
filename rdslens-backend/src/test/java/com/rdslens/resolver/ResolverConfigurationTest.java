package com.rdslens.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.inference.InferenceClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResolverConfigurationTest {

    private final ResolverConfiguration configuration = new ResolverConfiguration();
    private final InstanceDirectory directory = mock(InstanceDirectory.class);
    private final InferenceClient inferenceClient = mock(InferenceClient.class);
    private final NameResolutionCache cache = new NameResolutionCache(10);

    @Test
    void autoPicksInferenceOnlyWhenConfigured() {
        when(inferenceClient.isEnabled()).thenReturn(true);
        assertThat(build("auto").strategy()).isEqualTo("inference");

        when(inferenceClient.isEnabled()).thenReturn(false);
        assertThat(build("auto").strategy()).isEqualTo("fuzzy");
    }

    @Test
    void explicitStrategiesAreHonored() {
        when(inferenceClient.isEnabled()).thenReturn(false);
        assertThat(build("inference").strategy()).isEqualTo("inference");
        assertThat(build(" Fuzzy ").strategy()).isEqualTo("fuzzy");
    }

    @Test
    void unknownStrategyFailsStartup() {
        assertThatThrownBy(() -> build("magic"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("magic");
    }

    private NameResolver build(String strategy) {
        return configuration.nameResolver(strategy, directory, cache, inferenceClient, new ObjectMapper());
    }
}
