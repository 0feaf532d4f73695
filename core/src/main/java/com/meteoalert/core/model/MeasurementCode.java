package com.meteoalert.core.model;

/**
 * Measurement codes carried by meteogram samples. Temperatures are Kelvin, wind components m/s,
 * precipitation mm/h.
 */
public final class MeasurementCode {
    public static final String TMAX = "Tmax";
    public static final String TMIN = "Tmin";
    public static final String TAVE = "Tave";
    public static final String TDAVE = "TDave";
    public static final String UMAX = "Umax";
    public static final String VMAX = "Vmax";
    public static final String PRECMAX = "PRECmax";

    private MeasurementCode() {
    }
}
