package com.meteoalert.engine.export;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.AlertStore;
import com.meteoalert.core.util.TimeOfDay;
import com.meteoalert.core.util.UnitConversions;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns an {@link AlertStore} into the delivery system's alert list. Cities and alert kinds that cannot
 * be resolved against the supplied vocabularies are logged and skipped; the rest is still exported.
 */
public final class AlertExporter {
    private static final Logger LOGGER = Logger.getLogger(AlertExporter.class.getName());

    private final ReferenceMatcher cityMatcher;
    private final ReferenceMatcher eventMatcher;

    public AlertExporter() {
        this(ReferenceMatcher.exactIgnoreCase(), ReferenceMatcher.containsIgnoreCase());
    }

    public AlertExporter(ReferenceMatcher cityMatcher, ReferenceMatcher eventMatcher) {
        this.cityMatcher = Objects.requireNonNull(cityMatcher, "cityMatcher is required");
        this.eventMatcher = Objects.requireNonNull(eventMatcher, "eventMatcher is required");
    }

    /**
     * @param generationDate today; also the reference day alert offsets are decoded against
     */
    public List<AlertExportRecord> export(
            AlertStore store,
            List<VocabularyEntry> events,
            List<VocabularyEntry> cities,
            LocalDate generationDate
    ) {
        List<AlertExportRecord> records = new ArrayList<>();
        for (String cityName : store.cities()) {
            Optional<VocabularyEntry> city = cityMatcher.match(cityName, cities);
            if (city.isEmpty()) {
                LOGGER.warning("City not found in vocabulary: " + cityName);
                continue;
            }
            for (Map.Entry<AlertKind, AlertRecord> entry : store.alertsFor(cityName).entrySet()) {
                AlertKind kind = entry.getKey();
                Optional<VocabularyEntry> event = eventMatcher.match(kind.label(), events);
                if (event.isEmpty()) {
                    LOGGER.warning("Event not found for alert '" + kind.label() + "' in " + cityName);
                    continue;
                }
                records.add(toRecord(event.get(), city.get(), entry.getValue(), generationDate));
            }
        }
        return records;
    }

    private AlertExportRecord toRecord(
            VocabularyEntry event,
            VocabularyEntry city,
            AlertRecord alert,
            LocalDate generationDate
    ) {
        TimeOfDay time = UnitConversions.decodeTimeOfDay(alert.secondsUtc(), generationDate);
        return new AlertExportRecord(
                event.id(),
                city.id(),
                alert.value(),
                alert.threshold(),
                alert.difference(),
                generationDate,
                time.date(),
                alert.unit(),
                time.localTime(),
                alert.secondsUtc()
        );
    }
}
