package com.rdslens.resolver;

import java.util.Optional;

/**
 * Maps a user supplied, possibly imprecise database name to one canonical instance identifier.
 */
public interface NameResolver {

    /**
     * Resolve a raw name.
     *
     * @param rawName name as typed by the caller; used verbatim, case and whitespace matter
     * @return canonical identifier, or empty when nothing matches
     * @throws com.rdslens.cloud.UpstreamServiceException when the instance list cannot be fetched
     */
    Optional<String> resolve(String rawName);

    /**
     * Short strategy name used in logs.
     */
    String strategy();
}
