package com.meteoalert.core.model;

public record HumidityAlert(
        double value,
        double threshold,
        int secondsUtc,
        String polygonId,
        double averageTemperatureCelsius,
        double dewPointCelsius
) implements AlertRecord {
    @Override
    public AlertKind kind() {
        return AlertKind.LOW_HUMIDITY;
    }
}
