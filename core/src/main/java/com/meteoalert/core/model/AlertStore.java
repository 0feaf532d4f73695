package com.meteoalert.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All alerts of one run, keyed by city display name and then by kind. Cities keep the order in
 * which they were first added. Instances are immutable; use {@link #builder()} to assemble one.
 */
public final class AlertStore {
    private static final AlertStore EMPTY = new AlertStore(Map.of());

    private final Map<String, Map<AlertKind, AlertRecord>> byCity;

    private AlertStore(Map<String, Map<AlertKind, AlertRecord>> byCity) {
        this.byCity = byCity;
    }

    public static AlertStore empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> cities() {
        return byCity.keySet();
    }

    public Map<AlertKind, AlertRecord> alertsFor(String city) {
        return byCity.getOrDefault(city, Map.of());
    }

    public Optional<AlertRecord> alert(String city, AlertKind kind) {
        return Optional.ofNullable(alertsFor(city).get(kind));
    }

    public boolean isEmpty() {
        return byCity.isEmpty();
    }

    public int cityCount() {
        return byCity.size();
    }

    public int alertCount() {
        return byCity.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof AlertStore store && byCity.equals(store.byCity);
    }

    @Override
    public int hashCode() {
        return byCity.hashCode();
    }

    @Override
    public String toString() {
        return "AlertStore" + byCity;
    }

    public static final class Builder {
        private final Map<String, EnumMap<AlertKind, AlertRecord>> byCity = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Puts the record under its own kind for the city, replacing an earlier record of that kind.
         */
        public Builder put(String city, AlertRecord record) {
            Objects.requireNonNull(city, "city is required");
            Objects.requireNonNull(record, "record is required");
            byCity.computeIfAbsent(city, ignored -> new EnumMap<>(AlertKind.class)).put(record.kind(), record);
            return this;
        }

        public AlertStore build() {
            if (byCity.isEmpty()) {
                return EMPTY;
            }
            Map<String, Map<AlertKind, AlertRecord>> frozen = new LinkedHashMap<>();
            byCity.forEach((city, alerts) -> frozen.put(city, Collections.unmodifiableMap(new EnumMap<>(alerts))));
            return new AlertStore(Collections.unmodifiableMap(frozen));
        }
    }
}
