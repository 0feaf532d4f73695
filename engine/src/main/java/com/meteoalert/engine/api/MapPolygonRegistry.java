package com.meteoalert.engine.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry backed by an ordered polygon id to display name map. Blank names count as unresolved.
 */
public final class MapPolygonRegistry implements PolygonRegistry {
    private final Map<String, String> displayNames;

    public MapPolygonRegistry(Map<String, String> displayNames) {
        this.displayNames = new LinkedHashMap<>(displayNames);
    }

    @Override
    public List<String> polygonIds() {
        return List.copyOf(displayNames.keySet());
    }

    @Override
    public Optional<String> displayNameOf(String polygonId) {
        String name = displayNames.get(polygonId);
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(name.trim());
    }
}
