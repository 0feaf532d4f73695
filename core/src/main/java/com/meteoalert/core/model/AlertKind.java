package com.meteoalert.core.model;

/**
 * Closed set of alert families. Declaration order is the order used when rendering summaries.
 *
 * <p>The label is what the delivery system names its events after; exports join on it.</p>
 */
public enum AlertKind {
    HIGH_TEMPERATURE("temperatura alta", "°C", "High temperature"),
    LOW_TEMPERATURE("temperatura baixa", "°C", "Low temperature"),
    LOW_HUMIDITY("umidade baixa", "%", "Low humidity"),
    HIGH_WIND("vento", "km/h", "High wind"),
    HEAVY_RAIN("chuva", "mm", "Heavy rain");

    private final String label;
    private final String unit;
    private final String title;

    AlertKind(String label, String unit, String title) {
        this.label = label;
        this.unit = unit;
        this.title = title;
    }

    public String label() {
        return label;
    }

    public String unit() {
        return unit;
    }

    public String title() {
        return title;
    }
}
