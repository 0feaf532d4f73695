package com.meteoalert.service.runtime;

import com.meteoalert.core.model.AlertStore;
import com.meteoalert.core.model.PolygonTimeSeries;
import com.meteoalert.engine.api.PolygonRegistry;
import com.meteoalert.engine.api.ScanContext;
import com.meteoalert.engine.export.AlertExportRecord;
import com.meteoalert.engine.export.AlertExporter;
import com.meteoalert.engine.export.VocabularyEntry;
import com.meteoalert.engine.report.AlertSummaryFormatter;
import com.meteoalert.engine.scan.AlertScanEngine;
import com.meteoalert.service.gateway.DeliveryGateway;
import com.meteoalert.service.meteogram.MeteogramSource;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One pass over a meteogram: derive alerts, deliver them and leave a run marker behind.
 */
public final class AlertRun {
    private static final Logger LOGGER = Logger.getLogger(AlertRun.class.getName());

    private final AlertScanEngine engine;
    private final PolygonRegistry registry;
    private final MeteogramSource source;
    private final DeliveryGateway gateway;
    private final AlertExporter exporter;
    private final AlertSummaryFormatter formatter;
    private final Clock clock;

    public AlertRun(
            AlertScanEngine engine,
            PolygonRegistry registry,
            MeteogramSource source,
            DeliveryGateway gateway,
            Clock clock
    ) {
        this(engine, registry, source, gateway, new AlertExporter(), new AlertSummaryFormatter(), clock);
    }

    public AlertRun(
            AlertScanEngine engine,
            PolygonRegistry registry,
            MeteogramSource source,
            DeliveryGateway gateway,
            AlertExporter exporter,
            AlertSummaryFormatter formatter,
            Clock clock
    ) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.exporter = Objects.requireNonNull(exporter, "exporter is required");
        this.formatter = Objects.requireNonNull(formatter, "formatter is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public RunOutcome execute(RunMarker marker) {
        if (marker.exists()) {
            LOGGER.info("Skipping " + source.describe() + ": already processed (" + marker.markerFile() + ")");
            return RunOutcome.alreadyProcessed(marker.markerFile().toString());
        }

        RunOutcome outcome;
        Optional<String> error = Optional.empty();
        try {
            outcome = deliver();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert run failed for " + source.describe(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            error = Optional.of(message);
            outcome = RunOutcome.failed(message);
        }
        if (outcome.status() == RunOutcome.Status.NO_ALERTS) {
            marker.writeNote(outcome.message());
        } else {
            marker.write(error);
        }
        return outcome;
    }

    private RunOutcome deliver() {
        LocalDate today = LocalDate.now(clock);
        PolygonTimeSeries series = source.load();
        AlertStore store = engine.run(new ScanContext(registry, series));
        LOGGER.info(formatter.render(store, today));
        if (store.isEmpty()) {
            return RunOutcome.noAlerts();
        }

        gateway.login();
        List<VocabularyEntry> events = gateway.fetchEvents();
        List<VocabularyEntry> cities = gateway.fetchCities();
        List<AlertExportRecord> records = exporter.export(store, events, cities, today);
        if (records.isEmpty()) {
            LOGGER.warning("None of the " + store.alertCount() + " alerts matched the delivery vocabularies");
        } else {
            gateway.importAlerts(records);
        }
        gateway.startDispatch();
        return RunOutcome.delivered(store.alertCount(), records.size());
    }
}
