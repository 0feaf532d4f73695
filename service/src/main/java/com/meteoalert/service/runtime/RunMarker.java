package com.meteoalert.service.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Completion file written next to a meteogram once it has been handled, successfully or not.
 * Its presence prevents the same meteogram from being processed twice.
 */
public final class RunMarker {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path meteogramFile;
    private final Path markerFile;
    private final Clock clock;

    public RunMarker(Path meteogramFile, Clock clock) {
        this.meteogramFile = Objects.requireNonNull(meteogramFile, "meteogramFile is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.markerFile = markerPathFor(meteogramFile);
    }

    static Path markerPathFor(Path meteogramFile) {
        String name = meteogramFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return meteogramFile.resolveSibling(base + ".processed");
    }

    public Path markerFile() {
        return markerFile;
    }

    public boolean exists() {
        return Files.exists(markerFile);
    }

    public void write(Optional<String> error) {
        writeLines(error.map(message -> "Error: " + message));
    }

    /**
     * Marks a run that completed without anything to deliver.
     */
    public void writeNote(String note) {
        writeLines(Optional.of("Note: " + note));
    }

    private void writeLines(Optional<String> extraLine) {
        List<String> lines = new ArrayList<>();
        lines.add("Processed at: " + STAMP.format(LocalDateTime.now(clock)));
        lines.add("Source file: " + meteogramFile.getFileName());
        extraLine.ifPresent(lines::add);
        try {
            Path parent = markerFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(markerFile, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing run marker " + markerFile, e);
        }
    }
}
