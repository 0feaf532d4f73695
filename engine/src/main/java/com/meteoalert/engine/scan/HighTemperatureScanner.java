package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.Sample;
import com.meteoalert.core.model.TemperatureAlert;
import com.meteoalert.core.util.UnitConversions;

import java.util.OptionalDouble;

/**
 * Hottest {@code Tmax} of each polygon. Always emitted when any sample carries {@code Tmax}.
 */
public final class HighTemperatureScanner extends ExtremumScanner {
    @Override
    public AlertKind kind() {
        return AlertKind.HIGH_TEMPERATURE;
    }

    @Override
    protected OptionalDouble measure(Sample sample) {
        OptionalDouble kelvin = sample.value(MeasurementCode.TMAX);
        return kelvin.isPresent()
                ? OptionalDouble.of(UnitConversions.kelvinToCelsius(kelvin.getAsDouble()))
                : OptionalDouble.empty();
    }

    @Override
    protected boolean improves(double candidate, double currentBest) {
        return candidate > currentBest;
    }

    @Override
    protected AlertRecord toRecord(String polygonId, Candidate best) {
        return new TemperatureAlert(
                kind(),
                best.value(),
                best.sample().require(MeasurementCode.TMAX),
                best.secondsUtc(),
                polygonId
        );
    }
}
