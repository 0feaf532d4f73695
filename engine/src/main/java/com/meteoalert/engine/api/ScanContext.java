package com.meteoalert.engine.api;

import com.meteoalert.core.model.PolygonTimeSeries;

import java.util.Objects;

public record ScanContext(PolygonRegistry registry, PolygonTimeSeries series) {
    public ScanContext {
        Objects.requireNonNull(registry, "registry is required");
        series = series == null ? PolygonTimeSeries.empty() : series;
    }
}
