package com.meteoalert.service.meteogram;

import com.fasterxml.jackson.databind.JsonNode;
import com.meteoalert.core.model.PolygonTimeSeries;
import com.meteoalert.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads a meteogram that has already been parsed into JSON:
 * {@code {"polygons": {"<id>": [{"seconds": 0, "values": {"Tmax": 301.2}}]}}}.
 * Non-numeric values are dropped so the affected sample is treated as a gap.
 */
public final class JsonMeteogramSource implements MeteogramSource {
    private static final Logger LOGGER = Logger.getLogger(JsonMeteogramSource.class.getName());
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path file;

    public JsonMeteogramSource(Path file) {
        this.file = Objects.requireNonNull(file, "file is required");
    }

    public static Path pathFor(Path directory, LocalDate runDate) {
        return directory.resolve("HST" + FILE_DATE.format(runDate) + "00-MeteogramASC.json");
    }

    public Path file() {
        return file;
    }

    @Override
    public String describe() {
        return file.toString();
    }

    @Override
    public PolygonTimeSeries load() {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Meteogram file not found: " + file);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading meteogram from " + file, e);
        }
        JsonNode polygons = root == null ? null : root.path("polygons");
        if (polygons == null || !polygons.isObject()) {
            throw new IllegalStateException("Meteogram " + file + " has no 'polygons' object");
        }

        PolygonTimeSeries.Builder builder = PolygonTimeSeries.builder();
        int skipped = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = polygons.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> polygon = fields.next();
            for (JsonNode sample : polygon.getValue()) {
                JsonNode seconds = sample.path("seconds");
                if (!seconds.canConvertToInt()) {
                    skipped++;
                    continue;
                }
                builder.add(polygon.getKey(), seconds.asInt(), numericValues(sample.path("values")));
            }
        }
        PolygonTimeSeries series = builder.build();
        LOGGER.info("Loaded meteogram " + file.getFileName() + ": polygons=" + series.polygonCount()
                + (skipped > 0 ? " skippedSamples=" + skipped : ""));
        return series;
    }

    private static Map<String, Double> numericValues(JsonNode values) {
        Map<String, Double> result = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = values.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isNumber()) {
                result.put(entry.getKey(), entry.getValue().asDouble());
            }
        }
        return result;
    }
}
