package com.meteoalert.core.model;

public record RainAlert(
        double value,
        double threshold,
        int secondsUtc,
        String polygonId
) implements AlertRecord {
    @Override
    public AlertKind kind() {
        return AlertKind.HEAVY_RAIN;
    }
}
