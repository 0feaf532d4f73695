package com.meteoalert.core.model;

/**
 * Strongest wind above threshold. Value and threshold are km/h; {@code magnitudeSquared} keeps
 * the raw {@code Umax² + Vmax²} the value was derived from.
 */
public record WindAlert(
        double value,
        double threshold,
        int secondsUtc,
        String polygonId,
        double magnitudeSquared
) implements AlertRecord {
    @Override
    public AlertKind kind() {
        return AlertKind.HIGH_WIND;
    }
}
