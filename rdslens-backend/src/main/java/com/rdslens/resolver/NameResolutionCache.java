package com.rdslens.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Memo of raw input name to resolved identifier.
 *
 * Keys are the exact raw strings. Only successful resolutions are stored. When {@code maxEntries} is
 * positive the least recently used entry is evicted beyond that size; otherwise the map is unbounded.
 * Concurrent writers for the same key store the same mapping, so last write wins.
 */
public class NameResolutionCache {

    private final Map<String, String> entries;

    public NameResolutionCache(int maxEntries) {
        this.entries = Collections.synchronizedMap(new LinkedHashMap<String, String>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return maxEntries > 0 && size() > maxEntries;
            }
        });
    }

    public Optional<String> get(String rawName) {
        return Optional.ofNullable(entries.get(rawName));
    }

    public void put(String rawName, String identifier) {
        entries.put(rawName, identifier);
    }

    int size() {
        return entries.size();
    }
}
