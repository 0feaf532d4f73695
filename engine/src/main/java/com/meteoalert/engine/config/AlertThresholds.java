package com.meteoalert.engine.config;

/**
 * Thresholds for the threshold-based families.
 *
 * @param humidityMinPercent relative humidity below which a low-humidity alert is raised
 * @param windMaxSquared     {@code Umax² + Vmax²} (m²/s²) above which a wind alert is raised
 * @param rainMaxMmPerHour   precipitation above which a heavy-rain alert is raised
 * @param rainEnabled        whether the heavy-rain family runs at all
 */
public record AlertThresholds(
        double humidityMinPercent,
        double windMaxSquared,
        double rainMaxMmPerHour,
        boolean rainEnabled
) {
    public static final double DEFAULT_HUMIDITY_MIN = 60.0;
    public static final double DEFAULT_WIND_MAX_SQUARED = 11.08;
    public static final double DEFAULT_RAIN_MAX = 15.0;

    public AlertThresholds {
        requireFinite("humidityMinPercent", humidityMinPercent);
        requireFinite("windMaxSquared", windMaxSquared);
        requireFinite("rainMaxMmPerHour", rainMaxMmPerHour);
        if (windMaxSquared < 0) {
            throw new IllegalArgumentException("windMaxSquared must be >= 0 but was " + windMaxSquared);
        }
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(DEFAULT_HUMIDITY_MIN, DEFAULT_WIND_MAX_SQUARED, DEFAULT_RAIN_MAX, false);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite but was " + value);
        }
    }
}
