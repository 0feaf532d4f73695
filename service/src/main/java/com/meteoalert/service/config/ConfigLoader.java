package com.meteoalert.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meteoalert.core.util.JsonUtils;
import com.meteoalert.engine.api.MapPolygonRegistry;
import com.meteoalert.engine.api.PolygonRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    /**
     * Reads {@code polygons.json}; file order becomes scan order.
     */
    public static PolygonRegistry loadPolygons(Path configDir) {
        Path path = configDir.resolve("polygons.json");
        List<PolygonEntry> entries = read(path, new TypeReference<>() {
        });
        Map<String, String> names = new LinkedHashMap<>();
        for (PolygonEntry entry : entries) {
            if (entry.polygonId() == null || entry.polygonId().isBlank()) {
                throw new IllegalStateException("Polygon entry without polygonId in " + path);
            }
            names.put(entry.polygonId().trim(), entry.displayName());
        }
        return new MapPolygonRegistry(names);
    }

    /**
     * Reads {@code alerts.json}, or returns defaults when the file does not exist.
     */
    public static AlertSettings loadAlertSettings(Path configDir) {
        Path path = configDir.resolve("alerts.json");
        if (!Files.exists(path)) {
            return AlertSettings.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
