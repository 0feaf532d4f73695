package com.meteoalert.engine.export;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a local key (a city name or an alert label) against a reference vocabulary.
 * The first matching entry wins.
 */
@FunctionalInterface
public interface ReferenceMatcher {
    Optional<VocabularyEntry> match(String key, List<VocabularyEntry> entries);

    /**
     * Entry name equals the key, ignoring case.
     */
    static ReferenceMatcher exactIgnoreCase() {
        return (key, entries) -> {
            String wanted = normalize(key);
            return entries.stream()
                    .filter(entry -> entry.name() != null && normalize(entry.name()).equals(wanted))
                    .findFirst();
        };
    }

    /**
     * Entry name contains the key, ignoring case.
     */
    static ReferenceMatcher containsIgnoreCase() {
        return (key, entries) -> {
            String wanted = normalize(key);
            return entries.stream()
                    .filter(entry -> entry.name() != null && normalize(entry.name()).contains(wanted))
                    .findFirst();
        };
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
