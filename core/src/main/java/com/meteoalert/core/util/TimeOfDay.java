package com.meteoalert.core.util;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Local clock time and calendar date decoded from a UTC second offset.
 */
public record TimeOfDay(int hour, int minute, LocalDate date, String formatted) {
    public TimeOfDay {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in [0, 23] but was " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be in [0, 59] but was " + minute);
        }
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(formatted, "formatted is required");
    }

    public LocalTime localTime() {
        return LocalTime.of(hour, minute);
    }
}
