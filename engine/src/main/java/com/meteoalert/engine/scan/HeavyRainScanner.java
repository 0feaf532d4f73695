package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.MeasurementCode;
import com.meteoalert.core.model.RainAlert;
import com.meteoalert.core.model.Sample;

import java.util.OptionalDouble;

/**
 * Heaviest {@code PRECmax} above the threshold. Not registered unless rain alerts are enabled.
 */
public final class HeavyRainScanner extends ExtremumScanner {
    private final double maxThreshold;

    public HeavyRainScanner(double maxThreshold) {
        this.maxThreshold = maxThreshold;
    }

    @Override
    public AlertKind kind() {
        return AlertKind.HEAVY_RAIN;
    }

    @Override
    protected OptionalDouble measure(Sample sample) {
        return sample.value(MeasurementCode.PRECMAX);
    }

    @Override
    protected boolean qualifies(double value) {
        return value > maxThreshold;
    }

    @Override
    protected boolean improves(double candidate, double currentBest) {
        return candidate > currentBest;
    }

    @Override
    protected AlertRecord toRecord(String polygonId, Candidate best) {
        return new RainAlert(best.value(), maxThreshold, best.secondsUtc(), polygonId);
    }
}
