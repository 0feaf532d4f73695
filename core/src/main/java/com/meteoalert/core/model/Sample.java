package com.meteoalert.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One time-stamped observation for a polygon. Measurements are sparse: a code that was not
 * reported is absent from {@code values}, never zero.
 */
public record Sample(int secondsSinceMidnightUtc, Map<String, Double> values) {
    public Sample {
        Objects.requireNonNull(values, "values is required");
        values = Map.copyOf(values);
    }

    public OptionalDouble value(String code) {
        Double value = values.get(code);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(String... codes) {
        for (String code : codes) {
            if (!values.containsKey(code)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Shortcut for callers that already checked {@link #has(String...)}.
     */
    public double require(String code) {
        Double value = values.get(code);
        if (value == null) {
            throw new IllegalArgumentException("Sample at " + secondsSinceMidnightUtc + "s has no " + code);
        }
        return value;
    }
}
