package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertStore;
import com.meteoalert.engine.api.AlertScanner;
import com.meteoalert.engine.api.ScanContext;
import com.meteoalert.engine.api.ScanResult;
import com.meteoalert.engine.config.AlertThresholds;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs each family scanner in order over the same input and merges the results into one
 * {@link AlertStore}. The engine keeps no state between runs; every {@link #run(ScanContext)} returns
 * a new store.
 */
public final class AlertScanEngine {
    private static final Logger LOGGER = Logger.getLogger(AlertScanEngine.class.getName());

    private final List<AlertScanner> scanners;
    private final AlertAggregator aggregator;

    public AlertScanEngine(List<AlertScanner> scanners) {
        this(scanners, new AlertAggregator());
    }

    public AlertScanEngine(List<AlertScanner> scanners, AlertAggregator aggregator) {
        Set<AlertKind> seen = EnumSet.noneOf(AlertKind.class);
        for (AlertScanner scanner : scanners) {
            if (!seen.add(scanner.kind())) {
                throw new IllegalArgumentException("Duplicate scanner for " + scanner.kind());
            }
        }
        this.scanners = List.copyOf(scanners);
        this.aggregator = aggregator;
    }

    public static AlertScanEngine withThresholds(AlertThresholds thresholds) {
        List<AlertScanner> scanners = new ArrayList<>();
        scanners.add(new HighTemperatureScanner());
        scanners.add(new LowTemperatureScanner());
        scanners.add(new LowHumidityScanner(thresholds.humidityMinPercent()));
        scanners.add(new HighWindScanner(thresholds.windMaxSquared()));
        if (thresholds.rainEnabled()) {
            scanners.add(new HeavyRainScanner(thresholds.rainMaxMmPerHour()));
        }
        return new AlertScanEngine(scanners);
    }

    public List<AlertKind> kinds() {
        return scanners.stream().map(AlertScanner::kind).toList();
    }

    public AlertStore run(ScanContext ctx) {
        if (ctx.series().isEmpty()) {
            LOGGER.info("Meteogram has no polygons; no alerts generated");
            return AlertStore.empty();
        }
        List<ScanResult> results = new ArrayList<>(scanners.size());
        for (AlertScanner scanner : scanners) {
            ScanResult result = scanner.scan(ctx);
            LOGGER.info(() -> "Scan " + result.kind() + " produced " + result.byCity().size() + " alert(s)");
            results.add(result);
        }
        AlertStore store = aggregator.merge(results);
        LOGGER.info(() -> "Alert store holds " + store.alertCount() + " alert(s) for " + store.cityCount() + " cities");
        return store;
    }
}
