package com.meteoalert.core.util;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Numeric conversions used by the alert scanners. None of these methods throw for finite input.
 */
public final class UnitConversions {
    public static final double KELVIN_OFFSET = 273.15;
    public static final int SECONDS_PER_DAY = 86_400;
    /** Local zone is UTC-3. */
    public static final int LOCAL_OFFSET_SECONDS = 10_800;

    private static final double MAGNUS_A = 17.27;
    private static final double MAGNUS_B = 237.7;
    private static final double MAGNUS_E0 = 6.112;
    private static final double MS_TO_KMH = 3.6;

    private UnitConversions() {
    }

    public static double kelvinToCelsius(double kelvin) {
        return kelvin - KELVIN_OFFSET;
    }

    /**
     * Relative humidity in percent from air temperature and dew point (both Celsius), using the
     * Magnus-Tetens saturation vapour pressure approximation. Clamped into [0, 100].
     */
    public static double relativeHumidity(double temperatureCelsius, double dewPointCelsius) {
        double ratio = saturationVapourPressure(dewPointCelsius) / saturationVapourPressure(temperatureCelsius);
        double rh = ratio * 100.0;
        if (Double.isNaN(rh)) {
            // both pressures degenerate (0/0 or inf/inf) only when t and td sit on the same side
            // of the -237.7 pole, i.e. the air is effectively saturated
            return 100.0;
        }
        return Math.max(0.0, Math.min(100.0, rh));
    }

    static double saturationVapourPressure(double celsius) {
        return MAGNUS_E0 * Math.exp((MAGNUS_A * celsius) / (celsius + MAGNUS_B));
    }

    /**
     * Converts a squared wind speed ({@code U² + V²}, m²/s²) to km/h. Empty for negative or NaN input.
     */
    public static OptionalDouble windMagnitudeToKmh(double speedSquared) {
        if (Double.isNaN(speedSquared) || speedSquared < 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(speedSquared) * MS_TO_KMH);
    }

    /**
     * Shifts a UTC second offset into local time. The reference date moves by as many days as the
     * shifted value lies outside [0, 86400), so any offset decodes to a valid clock time.
     */
    public static TimeOfDay decodeTimeOfDay(int secondsUtc, LocalDate referenceDate) {
        long local = (long) secondsUtc - LOCAL_OFFSET_SECONDS;
        long dayShift = Math.floorDiv(local, SECONDS_PER_DAY);
        int secondOfDay = (int) Math.floorMod(local, (long) SECONDS_PER_DAY);
        int hour = secondOfDay / 3600;
        int minute = (secondOfDay % 3600) / 60;
        return new TimeOfDay(hour, minute, referenceDate.plusDays(dayShift),
                String.format("%02d:%02d", hour, minute));
    }
}
