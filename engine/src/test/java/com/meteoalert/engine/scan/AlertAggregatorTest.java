package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertStore;
import com.meteoalert.core.model.HumidityAlert;
import com.meteoalert.core.model.TemperatureAlert;
import com.meteoalert.core.model.WindAlert;
import com.meteoalert.engine.api.ScanResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertAggregatorTest {
    @Test
    void unionsFamiliesAtCityLevel() {
        ScanResult high = new ScanResult(AlertKind.HIGH_TEMPERATURE, Map.of(
                "Goiânia", new TemperatureAlert(AlertKind.HIGH_TEMPERATURE, 35.0, 308.15, 0, "P1")));
        ScanResult humidity = new ScanResult(AlertKind.LOW_HUMIDITY, Map.of(
                "Goiânia", new HumidityAlert(40.0, 60.0, 0, "P1", 30.0, 15.0),
                "Anápolis", new HumidityAlert(50.0, 60.0, 0, "P2", 28.0, 16.0)));
        ScanResult wind = ScanResult.empty(AlertKind.HIGH_WIND);

        AlertStore store = new AlertAggregator().merge(List.of(high, humidity, wind));

        assertEquals(2, store.cityCount());
        assertEquals(2, store.alertsFor("Goiânia").size());
        assertEquals(1, store.alertsFor("Anápolis").size());
        assertTrue(store.alert("Anápolis", AlertKind.HIGH_TEMPERATURE).isEmpty());
    }

    @Test
    void nothingToMergeGivesEmptyStore() {
        assertTrue(new AlertAggregator().merge(List.of()).isEmpty());
        assertTrue(new AlertAggregator().merge(List.of(ScanResult.empty(AlertKind.LOW_HUMIDITY))).isEmpty());
    }

    @Test
    void scanResultRejectsRecordsOfAnotherKind() {
        assertThrows(IllegalArgumentException.class, () -> new ScanResult(AlertKind.LOW_HUMIDITY,
                Map.of("Goiânia", new WindAlert(20.0, 12.0, 0, "P1", 30.0))));
    }
}
