package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.HumidityAlert;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.Sample;
import com.meteoalert.core.util.UnitConversions;

import java.util.OptionalDouble;

/**
 * Driest sample of each polygon, with relative humidity derived from {@code Tave} and {@code TDave}.
 * Emitted only when that minimum is strictly below the threshold.
 */
public final class LowHumidityScanner extends ExtremumScanner {
    private final double minThreshold;

    public LowHumidityScanner(double minThreshold) {
        this.minThreshold = minThreshold;
    }

    @Override
    public AlertKind kind() {
        return AlertKind.LOW_HUMIDITY;
    }

    @Override
    protected OptionalDouble measure(Sample sample) {
        if (!sample.has(MeasurementCode.TAVE, MeasurementCode.TDAVE)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(UnitConversions.relativeHumidity(
                averageCelsius(sample),
                dewPointCelsius(sample)
        ));
    }

    @Override
    protected boolean improves(double candidate, double currentBest) {
        return candidate < currentBest;
    }

    @Override
    protected boolean shouldEmit(double extremum) {
        return extremum < minThreshold;
    }

    @Override
    protected AlertRecord toRecord(String polygonId, Candidate best) {
        return new HumidityAlert(
                best.value(),
                minThreshold,
                best.secondsUtc(),
                polygonId,
                averageCelsius(best.sample()),
                dewPointCelsius(best.sample())
        );
    }

    private static double averageCelsius(Sample sample) {
        return UnitConversions.kelvinToCelsius(sample.require(MeasurementCode.TAVE));
    }

    private static double dewPointCelsius(Sample sample) {
        return UnitConversions.kelvinToCelsius(sample.require(MeasurementCode.TDAVE));
    }
}
