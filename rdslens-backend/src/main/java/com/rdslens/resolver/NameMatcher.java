package com.rdslens.resolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic string matching between a target name and candidate identifiers.
 */
public final class NameMatcher {

    private NameMatcher() {
    }

    /**
     * Pick the best candidate for a target.
     *
     * A case-insensitive exact match wins. Otherwise every candidate that contains the target, or is
     * contained in it, ignoring case, is a partial match and the shortest one wins; among equally
     * short ones the earliest in {@code candidates} wins.
     *
     * @param target name to match
     * @param candidates candidate identifiers
     * @return best match, or empty when the target or the candidate list is empty or nothing matches
     */
    public static Optional<String> bestMatch(String target, List<String> candidates) {
        if (target == null || target.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String lowered = target.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            if (candidate != null && candidate.toLowerCase(Locale.ROOT).equals(lowered)) {
                return Optional.of(candidate);
            }
        }

        List<String> partialMatches = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            String c = candidate.toLowerCase(Locale.ROOT);
            if (c.contains(lowered) || lowered.contains(c)) {
                partialMatches.add(candidate);
            }
        }

        // List.sort is stable
        partialMatches.sort(Comparator.comparingInt(String::length));
        return partialMatches.stream().findFirst();
    }
}
