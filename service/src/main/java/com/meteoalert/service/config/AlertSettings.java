package com.meteoalert.service.config;

import com.meteoalert.engine.config.AlertThresholds;

/**
 * Contents of {@code alerts.json}. Every field is optional and falls back to the built-in default.
 */
public record AlertSettings(
        Double humidityMinThreshold,
        Double windMaxThreshold,
        Double rainMaxThreshold,
        Boolean rainEnabled
) {
    public static AlertSettings defaults() {
        return new AlertSettings(null, null, null, null);
    }

    public AlertThresholds toThresholds() {
        return new AlertThresholds(
                humidityMinThreshold == null ? AlertThresholds.DEFAULT_HUMIDITY_MIN : humidityMinThreshold,
                windMaxThreshold == null ? AlertThresholds.DEFAULT_WIND_MAX_SQUARED : windMaxThreshold,
                rainMaxThreshold == null ? AlertThresholds.DEFAULT_RAIN_MAX : rainMaxThreshold,
                rainEnabled != null && rainEnabled
        );
    }
}
