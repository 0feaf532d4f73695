package com.meteoalert.engine.api;

import java.util.List;
import java.util.Optional;

/**
 * Known polygons and their display (city) names. {@link #polygonIds()} order is the scan order.
 */
public interface PolygonRegistry {
    List<String> polygonIds();

    Optional<String> displayNameOf(String polygonId);
}
