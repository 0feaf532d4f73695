package com.meteoalert.engine.api;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One family's alerts, city display name to the single record of {@link #kind()}. Cities without a
 * qualifying sample are absent.
 */
public record ScanResult(AlertKind kind, Map<String, AlertRecord> byCity) {
    public ScanResult {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(byCity, "byCity is required");
        byCity.forEach((city, record) -> {
            if (record.kind() != kind) {
                throw new IllegalArgumentException("Record for " + city + " is " + record.kind() + ", expected " + kind);
            }
        });
        byCity = Collections.unmodifiableMap(new LinkedHashMap<>(byCity));
    }

    public static ScanResult empty(AlertKind kind) {
        return new ScanResult(kind, Map.of());
    }

    public boolean isEmpty() {
        return byCity.isEmpty();
    }
}
