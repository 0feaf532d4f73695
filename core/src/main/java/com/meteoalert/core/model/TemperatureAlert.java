package com.meteoalert.core.model;

import java.util.Objects;

/**
 * Hottest or coldest reading of a polygon. Temperature families carry no threshold, so both
 * threshold and difference are reported as zero.
 */
public record TemperatureAlert(
        AlertKind kind,
        double valueCelsius,
        double valueKelvin,
        int secondsUtc,
        String polygonId
) implements AlertRecord {
    public TemperatureAlert {
        Objects.requireNonNull(kind, "kind is required");
        if (kind != AlertKind.HIGH_TEMPERATURE && kind != AlertKind.LOW_TEMPERATURE) {
            throw new IllegalArgumentException("Not a temperature kind: " + kind);
        }
    }

    @Override
    public double value() {
        return valueCelsius;
    }

    @Override
    public double threshold() {
        return 0.0;
    }

    @Override
    public double difference() {
        return 0.0;
    }
}
