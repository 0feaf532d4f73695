package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.Sample;
import com.meteoalert.engine.api.AlertScanner;
import com.meteoalert.engine.api.ScanContext;
import com.meteoalert.engine.api.ScanResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Shared scan loop: every registered polygon with a display name and samples is reduced to its single
 * extremal sample, which becomes that city's alert if the family's emission rule accepts it.
 *
 * <p>Samples arrive in ascending time order and {@link #improves(double, double)} must be strict, so
 * the earliest sample wins a tie.</p>
 */
public abstract class ExtremumScanner implements AlertScanner {

    @Override
    public ScanResult scan(ScanContext ctx) {
        Map<String, AlertRecord> byCity = new LinkedHashMap<>();
        for (String polygonId : ctx.registry().polygonIds()) {
            Optional<String> city = ctx.registry().displayNameOf(polygonId);
            if (city.isEmpty()) {
                continue;
            }
            Optional<List<Sample>> samples = ctx.series().samplesFor(polygonId);
            if (samples.isEmpty()) {
                continue;
            }
            Candidate best = reduce(samples.get());
            if (best == null || !shouldEmit(best.value())) {
                continue;
            }
            byCity.put(city.get(), toRecord(polygonId, best));
        }
        return new ScanResult(kind(), byCity);
    }

    private Candidate reduce(List<Sample> samples) {
        Candidate best = null;
        for (Sample sample : samples) {
            OptionalDouble measured = measure(sample);
            if (measured.isEmpty()) {
                continue;
            }
            double value = measured.getAsDouble();
            if (!qualifies(value)) {
                continue;
            }
            if (best == null || improves(value, best.value())) {
                best = new Candidate(value, sample);
            }
        }
        return best;
    }

    /**
     * The value this family compares, or empty when the sample lacks a required field.
     */
    protected abstract OptionalDouble measure(Sample sample);

    /**
     * Pre-filter applied before a sample may compete for the extremum.
     */
    protected boolean qualifies(double value) {
        return true;
    }

    protected abstract boolean improves(double candidate, double currentBest);

    protected boolean shouldEmit(double extremum) {
        return true;
    }

    protected abstract AlertRecord toRecord(String polygonId, Candidate best);

    protected record Candidate(double value, Sample sample) {
        public int secondsUtc() {
            return sample.secondsSinceMidnightUtc();
        }
    }
}
