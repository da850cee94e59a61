package com.rdslens.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.inference.InferenceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the name resolution strategy.
 *
 * {@code rdslens.resolver.strategy} is {@code inference}, {@code fuzzy} or {@code auto}; {@code auto}
 * picks inference when the inference client is configured and fuzzy matching otherwise. The chosen
 * strategy is used alone: a failed inference match does not fall through to fuzzy matching.
 */
@Configuration
public class ResolverConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ResolverConfiguration.class);

    @Bean
    NameResolutionCache nameResolutionCache(@Value("${rdslens.resolver.cache-max-entries:10000}") int maxEntries) {
        return new NameResolutionCache(maxEntries);
    }

    @Bean
    NameResolver nameResolver(
            @Value("${rdslens.resolver.strategy:auto}") String strategy,
            InstanceDirectory directory,
            NameResolutionCache cache,
            InferenceClient inferenceClient,
            ObjectMapper objectMapper
    ) {
        NameResolver resolver;
        switch (strategy.trim().toLowerCase(Locale.ROOT)) {
            case "inference":
                resolver = new InferenceNameResolver(directory, cache, inferenceClient, objectMapper);
                break;
            case "fuzzy":
                resolver = new FuzzyNameResolver(directory, cache);
                break;
            case "auto":
                resolver = inferenceClient.isEnabled()
                        ? new InferenceNameResolver(directory, cache, inferenceClient, objectMapper)
                        : new FuzzyNameResolver(directory, cache);
                break;
            default:
                throw new IllegalStateException("Unknown rdslens.resolver.strategy: " + strategy);
        }
        log.info("Name resolution strategy: {} (configured={})", resolver.strategy(), strategy);
        return resolver;
    }
}
