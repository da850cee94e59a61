package com.rdslens.resolver;

import com.rdslens.directory.InstanceDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Base for resolvers that memoize successful matches per raw input.
 *
 * A cache hit returns without touching the instance directory or any remote service. On a miss the
 * candidate identifiers come from {@link InstanceDirectory} and the subclass picks one. Misses are
 * not cached, so an unresolvable name is recomputed on every call.
 */
public abstract class AbstractCachingNameResolver implements NameResolver {
    private static final Logger log = LoggerFactory.getLogger(AbstractCachingNameResolver.class);

    private final InstanceDirectory directory;
    private final NameResolutionCache cache;

    protected AbstractCachingNameResolver(InstanceDirectory directory, NameResolutionCache cache) {
        this.directory = directory;
        this.cache = cache;
    }

    @Override
    public Optional<String> resolve(String rawName) {
        if (rawName == null) {
            return Optional.empty();
        }

        Optional<String> cached = cache.get(rawName);
        if (cached.isPresent()) {
            log.info("Using cached rds instance result for {}", rawName);
            return cached;
        }

        List<String> candidates = directory.listIdentifiers();
        Optional<String> match = match(rawName, candidates);
        if (match.isPresent()) {
            cache.put(rawName, match.get());
            log.info("Resolved '{}' to {} (strategy={})", rawName, match.get(), strategy());
        } else {
            log.info("No rds instance matches '{}' (strategy={}, candidates={})", rawName, strategy(), candidates.size());
        }
        return match;
    }

    /**
     * Choose a candidate for the raw name.
     *
     * @param rawName raw input
     * @param candidates known identifiers
     * @return chosen identifier, or empty
     */
    protected abstract Optional<String> match(String rawName, List<String> candidates);
}
