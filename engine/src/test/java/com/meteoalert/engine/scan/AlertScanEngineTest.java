package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertStore;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.PolygonTimeSeries;
import com.meteoalert.engine.api.ScanContext;
import com.meteoalert.engine.config.AlertThresholds;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.meteoalert.engine.support.SeriesFixtures.humidityValues;
import static com.meteoalert.engine.support.SeriesFixtures.registry;
import static com.meteoalert.engine.support.SeriesFixtures.wind;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertScanEngineTest {
    @Test
    void mergesAllFamiliesPerCity() {
        AlertStore store = AlertScanEngine.withThresholds(AlertThresholds.defaults()).run(context());

        assertEquals(List.of("Goiânia", "Anápolis"), List.copyOf(store.cities()));
        assertEquals(
                List.of(AlertKind.HIGH_TEMPERATURE, AlertKind.LOW_TEMPERATURE, AlertKind.LOW_HUMIDITY, AlertKind.HIGH_WIND),
                List.copyOf(store.alertsFor("Goiânia").keySet())
        );
        assertEquals(List.of(AlertKind.HIGH_TEMPERATURE, AlertKind.LOW_TEMPERATURE),
                List.copyOf(store.alertsFor("Anápolis").keySet()));
    }

    @Test
    void rainIsOnlyScannedWhenEnabled() {
        AlertScanEngine disabled = AlertScanEngine.withThresholds(AlertThresholds.defaults());
        AlertScanEngine enabled = AlertScanEngine.withThresholds(new AlertThresholds(60.0, 11.08, 15.0, true));

        assertTrue(disabled.run(context()).alert("Goiânia", AlertKind.HEAVY_RAIN).isEmpty());
        assertEquals(30.0, enabled.run(context()).alert("Goiânia", AlertKind.HEAVY_RAIN).orElseThrow().value());
        assertEquals(5, enabled.kinds().size());
    }

    @Test
    void repeatedRunsOverSameInputYieldEqualIndependentStores() {
        AlertScanEngine engine = AlertScanEngine.withThresholds(AlertThresholds.defaults());

        AlertStore first = engine.run(context());
        AlertStore second = engine.run(context());

        assertEquals(first, second);
        assertNotSame(first, second);
        assertEquals(first.alertCount(), second.alertCount());
    }

    @Test
    void emptyOrAbsentMeteogramYieldsEmptyStore() {
        AlertScanEngine engine = AlertScanEngine.withThresholds(AlertThresholds.defaults());

        assertTrue(engine.run(new ScanContext(registry("P1", "Goiânia"), PolygonTimeSeries.empty())).isEmpty());
        assertTrue(engine.run(new ScanContext(registry("P1", "Goiânia"), null)).isEmpty());
        assertTrue(engine.run(new ScanContext(registry(), context().series())).isEmpty());
    }

    @Test
    void duplicateFamiliesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AlertScanEngine(List.of(new HighTemperatureScanner(), new HighTemperatureScanner())));
    }

    @Test
    void invalidThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AlertThresholds(60.0, -1.0, 15.0, false));
        assertThrows(IllegalArgumentException.class, () -> new AlertThresholds(Double.NaN, 11.08, 15.0, false));
    }

    private static ScanContext context() {
        Map<String, Double> hot = new HashMap<>(humidityValues(34.0, 30.0));
        hot.put(MeasurementCode.TMAX, 309.0);
        hot.put(MeasurementCode.TMIN, 295.0);
        hot.putAll(wind(4.0, 3.0));
        hot.put(MeasurementCode.PRECMAX, 30.0);

        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("P1", 61_200, hot)
                .add("P1", 32_400, Map.of(MeasurementCode.TMAX, 298.0, MeasurementCode.TMIN, 290.0))
                .add("P2", 0, Map.of(MeasurementCode.TMAX, 301.0, MeasurementCode.TMIN, 288.0))
                .add("P2", 3600, humidityValues(22.0, 85.0))
                .add("P3", 0, Map.of(MeasurementCode.TMAX, 301.0))
                .build();
        return new ScanContext(registry("P1", "Goiânia", "P2", "Anápolis", "P3", ""), series);
    }
}
