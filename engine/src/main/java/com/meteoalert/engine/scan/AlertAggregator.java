package com.meteoalert.engine.scan;

import com.meteoalert.core.model.AlertStore;
import com.meteoalert.engine.api.ScanResult;

import java.util.List;

/**
 * Union-merges per-family results at the city level. Each family writes only its own kind, so merges
 * never conflict. Every call builds a fresh store.
 */
public final class AlertAggregator {
    public AlertStore merge(List<ScanResult> results) {
        AlertStore.Builder builder = AlertStore.builder();
        for (ScanResult result : results) {
            result.byCity().forEach(builder::put);
        }
        return builder.build();
    }
}
