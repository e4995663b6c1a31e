package com.xammer.spectre.service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recognises tags that mark a bucket as on its way out, e.g. {@code status=deprecated} or a bare {@code legacy} key.
 */
public final class DeprecatedTagMatcher {

    static final Set<String> MARKERS = Set.of("deprecated", "old", "unused", "delete", "obsolete", "legacy", "retired");

    private DeprecatedTagMatcher() {
    }

    /** First matching tag in key order, so repeated runs report the same one. */
    public static Optional<Map.Entry<String, String>> firstMatch(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> tag : new TreeMap<>(tags).entrySet()) {
            if (isMarker(tag.getKey()) || isMarker(tag.getValue())) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    public static boolean hasDeprecatedTag(Map<String, String> tags) {
        return firstMatch(tags).isPresent();
    }

    private static boolean isMarker(String text) {
        return text != null && MARKERS.contains(text.toLowerCase(Locale.ROOT));
    }
}
