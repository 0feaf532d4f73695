package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.Sample;
import com.meteoalert.core.model.WindAlert;
import com.meteoalert.core.util.UnitConversions;

import java.util.OptionalDouble;

/**
 * Strongest wind of each polygon, compared as {@code Umax² + Vmax²} against a squared threshold and
 * reported in km/h.
 */
public final class HighWindScanner extends ExtremumScanner {
    private final double maxThresholdSquared;
    private final double thresholdKmh;

    public HighWindScanner(double maxThresholdSquared) {
        this.maxThresholdSquared = maxThresholdSquared;
        this.thresholdKmh = UnitConversions.windMagnitudeToKmh(maxThresholdSquared)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Wind threshold must be non-negative but was " + maxThresholdSquared));
    }

    @Override
    public AlertKind kind() {
        return AlertKind.HIGH_WIND;
    }

    @Override
    protected OptionalDouble measure(Sample sample) {
        OptionalDouble u = sample.value(MeasurementCode.UMAX);
        OptionalDouble v = sample.value(MeasurementCode.VMAX);
        if (u.isEmpty() || v.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(u.getAsDouble() * u.getAsDouble() + v.getAsDouble() * v.getAsDouble());
    }

    @Override
    protected boolean qualifies(double value) {
        return value > maxThresholdSquared;
    }

    @Override
    protected boolean improves(double candidate, double currentBest) {
        return candidate > currentBest;
    }

    @Override
    protected AlertRecord toRecord(String polygonId, Candidate best) {
        // qualifies() guarantees a non-negative magnitude
        double kmh = UnitConversions.windMagnitudeToKmh(best.value()).orElseThrow();
        return new WindAlert(kmh, thresholdKmh, best.secondsUtc(), polygonId, best.value());
    }
}
