package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.PolygonTimeSeries;
import com.meteoalert.core.model.TemperatureAlert;
import com.meteoalert.engine.api.ScanContext;
import com.meteoalert.engine.api.ScanResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.meteoalert.engine.support.SeriesFixtures.registry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemperatureScannersTest {
    @Test
    void highTemperaturePicksHottestSample() {
        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("P1", 0, Map.of(MeasurementCode.TMAX, 300.0))
                .add("P1", 3600, Map.of(MeasurementCode.TMAX, 310.0))
                .build();

        ScanResult result = new HighTemperatureScanner().scan(new ScanContext(registry("P1", "Goiânia"), series));

        assertEquals(AlertKind.HIGH_TEMPERATURE, result.kind());
        TemperatureAlert alert = (TemperatureAlert) result.byCity().get("Goiânia");
        assertEquals(36.85, alert.value(), 1e-9);
        assertEquals(310.0, alert.valueKelvin());
        assertEquals(3600, alert.secondsUtc());
        assertEquals("P1", alert.polygonId());
        assertEquals(0.0, alert.threshold());
        assertEquals(0.0, alert.difference());
    }

    @Test
    void lowTemperaturePicksColdestSampleAndIgnoresTmax() {
        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("P1", 0, Map.of(MeasurementCode.TMIN, 285.0, MeasurementCode.TMAX, 200.0))
                .add("P1", 3600, Map.of(MeasurementCode.TMIN, 280.0))
                .add("P1", 7200, Map.of(MeasurementCode.TMAX, 250.0))
                .build();

        ScanResult result = new LowTemperatureScanner().scan(new ScanContext(registry("P1", "Goiânia"), series));

        TemperatureAlert alert = (TemperatureAlert) result.byCity().get("Goiânia");
        assertEquals(AlertKind.LOW_TEMPERATURE, alert.kind());
        assertEquals(280.0 - 273.15, alert.value(), 1e-9);
        assertEquals(3600, alert.secondsUtc());
    }

    @Test
    void tiesGoToEarliestSampleRegardlessOfInsertionOrder() {
        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("P1", 7200, Map.of(MeasurementCode.TMAX, 305.0, MeasurementCode.TMIN, 290.0))
                .add("P1", 1800, Map.of(MeasurementCode.TMAX, 305.0, MeasurementCode.TMIN, 290.0))
                .add("P1", 3600, Map.of(MeasurementCode.TMAX, 301.0, MeasurementCode.TMIN, 295.0))
                .build();
        ScanContext ctx = new ScanContext(registry("P1", "Goiânia"), series);

        assertEquals(1800, new HighTemperatureScanner().scan(ctx).byCity().get("Goiânia").secondsUtc());
        assertEquals(1800, new LowTemperatureScanner().scan(ctx).byCity().get("Goiânia").secondsUtc());
    }

    @Test
    void polygonsWithoutNameOrDataOrFieldsProduceNoAlert() {
        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("NAMELESS", 0, Map.of(MeasurementCode.TMAX, 300.0))
                .add("NO_TMAX", 0, Map.of(MeasurementCode.TMIN, 280.0))
                .add("OK", 0, Map.of(MeasurementCode.TMAX, 300.0))
                .build();
        ScanContext ctx = new ScanContext(
                registry("NAMELESS", " ", "NO_TMAX", "Anápolis", "NO_DATA", "Catalão", "OK", "Goiânia"),
                series
        );

        ScanResult result = new HighTemperatureScanner().scan(ctx);

        assertEquals(1, result.byCity().size());
        assertTrue(result.byCity().containsKey("Goiânia"));
        assertFalse(result.byCity().containsKey("Anápolis"));
        assertFalse(result.byCity().containsKey("Catalão"));
    }

    @Test
    void laterPolygonWinsWhenTwoShareADisplayName() {
        PolygonTimeSeries series = PolygonTimeSeries.builder()
                .add("P1", 0, Map.of(MeasurementCode.TMAX, 310.0))
                .add("P2", 0, Map.of(MeasurementCode.TMAX, 300.0))
                .build();

        ScanResult result = new HighTemperatureScanner().scan(new ScanContext(registry("P1", "Goiânia", "P2", "Goiânia"), series));

        assertEquals("P2", result.byCity().get("Goiânia").polygonId());
    }
}
