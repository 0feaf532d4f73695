package com.meteoalert.service.config;

public record PolygonEntry(String polygonId, String displayName) {
}
