package com.meteoalert.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertStoreTest {
    @Test
    void keepsOneRecordPerCityAndKindInInsertionOrder() {
        AlertStore store = AlertStore.builder()
                .put("Goiânia", new TemperatureAlert(AlertKind.HIGH_TEMPERATURE, 36.0, 309.15, 3600, "P1"))
                .put("Anápolis", new WindAlert(20.0, 11.98, 7200, "P2", 30.86))
                .put("Goiânia", new TemperatureAlert(AlertKind.HIGH_TEMPERATURE, 37.0, 310.15, 7200, "P1"))
                .put("Goiânia", new HumidityAlert(40.0, 60.0, 0, "P1", 30.0, 15.0))
                .build();

        assertEquals(List.of("Goiânia", "Anápolis"), List.copyOf(store.cities()));
        assertEquals(2, store.alertsFor("Goiânia").size());
        assertEquals(37.0, store.alert("Goiânia", AlertKind.HIGH_TEMPERATURE).orElseThrow().value());
        assertEquals(3, store.alertCount());
        assertTrue(store.alertsFor("Nowhere").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> store.alertsFor("Goiânia").clear());
    }

    @Test
    void emptyBuilderYieldsSharedEmptyStore() {
        assertSame(AlertStore.empty(), AlertStore.builder().build());
        assertTrue(AlertStore.empty().isEmpty());
    }

    @Test
    void recordsExposeDifferenceAndUnitPerKind() {
        HumidityAlert humidity = new HumidityAlert(55.0, 60.0, 0, "P1", 30.0, 20.0);
        TemperatureAlert cold = new TemperatureAlert(AlertKind.LOW_TEMPERATURE, 4.0, 277.15, 0, "P1");
        RainAlert rain = new RainAlert(20.0, 15.0, 0, "P1");

        assertEquals(-5.0, humidity.difference(), 1e-9);
        assertEquals("%", humidity.unit());
        assertEquals(0.0, cold.threshold());
        assertEquals(0.0, cold.difference());
        assertEquals("°C", cold.unit());
        assertEquals(5.0, rain.difference(), 1e-9);
        assertThrows(IllegalArgumentException.class,
                () -> new TemperatureAlert(AlertKind.HIGH_WIND, 1.0, 274.15, 0, "P1"));
    }
}
