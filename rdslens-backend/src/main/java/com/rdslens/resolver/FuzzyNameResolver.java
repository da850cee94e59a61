package com.rdslens.resolver;

import com.rdslens.directory.InstanceDirectory;

import java.util.List;
import java.util.Optional;

/**
 * Resolver using {@link NameMatcher#bestMatch}. Needs no inference service.
 */
public class FuzzyNameResolver extends AbstractCachingNameResolver {

    public FuzzyNameResolver(InstanceDirectory directory, NameResolutionCache cache) {
        super(directory, cache);
    }

    @Override
    protected Optional<String> match(String rawName, List<String> candidates) {
        return NameMatcher.bestMatch(rawName, candidates);
    }

    @Override
    public String strategy() {
        return "fuzzy";
    }
}
