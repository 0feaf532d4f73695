package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.Sample;
import com.meteoalert.core.model.TemperatureAlert;
import com.meteoalert.core.util.UnitConversions;

import java.util.OptionalDouble;

/**
 * Coldest {@code Tmin} of each polygon. Always emitted when any sample carries {@code Tmin}.
 */
public final class LowTemperatureScanner extends ExtremumScanner {
    @Override
    public AlertKind kind() {
        return AlertKind.LOW_TEMPERATURE;
    }

    @Override
    protected OptionalDouble measure(Sample sample) {
        OptionalDouble kelvin = sample.value(MeasurementCode.TMIN);
        return kelvin.isPresent()
                ? OptionalDouble.of(UnitConversions.kelvinToCelsius(kelvin.getAsDouble()))
                : OptionalDouble.empty();
    }

    @Override
    protected boolean improves(double candidate, double currentBest) {
        return candidate < currentBest;
    }

    @Override
    protected AlertRecord toRecord(String polygonId, Candidate best) {
        return new TemperatureAlert(
                kind(),
                best.value(),
                best.sample().require(MeasurementCode.TMIN),
                best.secondsUtc(),
                polygonId
        );
    }
}
