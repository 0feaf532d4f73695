package com.meteoalert.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed meteogram: polygon id to its samples keyed by seconds since midnight UTC.
 *
 * <p>Samples are always handed out in ascending time order so that reductions with
 * first-wins tie-breaking are reproducible regardless of how the source was ordered.</p>
 */
public final class PolygonTimeSeries {
    private static final PolygonTimeSeries EMPTY = new PolygonTimeSeries(Map.of());

    private final Map<String, List<Sample>> samplesByPolygon;

    private PolygonTimeSeries(Map<String, List<Sample>> samplesByPolygon) {
        this.samplesByPolygon = samplesByPolygon;
    }

    public static PolygonTimeSeries empty() {
        return EMPTY;
    }

    public static PolygonTimeSeries of(Map<String, Map<Integer, Sample>> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<Sample>> sorted = new LinkedHashMap<>();
        raw.forEach((polygonId, byTime) -> {
            if (polygonId == null || byTime == null) {
                return;
            }
            List<Sample> samples = byTime.values().stream()
                    .sorted(Comparator.comparingInt(Sample::secondsSinceMidnightUtc))
                    .toList();
            sorted.put(polygonId, samples);
        });
        return new PolygonTimeSeries(Collections.unmodifiableMap(sorted));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<List<Sample>> samplesFor(String polygonId) {
        List<Sample> samples = samplesByPolygon.get(polygonId);
        if (samples == null || samples.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(samples);
    }

    public Set<String> polygonIds() {
        return samplesByPolygon.keySet();
    }

    public boolean isEmpty() {
        return samplesByPolygon.isEmpty();
    }

    public int polygonCount() {
        return samplesByPolygon.size();
    }

    public static final class Builder {
        private final Map<String, Map<Integer, Sample>> raw = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a sample; a second sample at the same offset for the same polygon replaces the first.
         */
        public Builder add(String polygonId, Sample sample) {
            raw.computeIfAbsent(polygonId, ignored -> new LinkedHashMap<>())
                    .put(sample.secondsSinceMidnightUtc(), sample);
            return this;
        }

        public Builder add(String polygonId, int secondsSinceMidnightUtc, Map<String, Double> values) {
            return add(polygonId, new Sample(secondsSinceMidnightUtc, values));
        }

        public PolygonTimeSeries build() {
            return PolygonTimeSeries.of(raw);
        }
    }
}
