package com.meteoalert.engine.report;

import com.meteoalert.core.model.AlertKind;
import com.meteoalert.core.model.AlertRecord;
import com.meteoalert.core.model.AlertStore;
import com.meteoalert.core.model.HumidityAlert;
import com.meteoalert.core.model.TemperatureAlert;
import com.meteoalert.core.util.TimeOfDay;
import com.meteoalert.core.util.UnitConversions;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of an {@link AlertStore} for logs. Not a wire format.
 */
public final class AlertSummaryFormatter {
    static final String EMPTY_SUMMARY = "No alerts generated";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public String render(AlertStore store, LocalDate referenceDate) {
        if (store.isEmpty()) {
            return EMPTY_SUMMARY;
        }
        StringBuilder out = new StringBuilder("=== ALERT SUMMARY ===\n");
        for (String city : store.cities()) {
            out.append("\nCity: ").append(city).append('\n');
            Map<AlertKind, AlertRecord> alerts = store.alertsFor(city);
            for (AlertKind kind : AlertKind.values()) {
                AlertRecord alert = alerts.get(kind);
                if (alert != null) {
                    appendAlert(out, alert, referenceDate);
                }
            }
        }
        return out.toString();
    }

    private void appendAlert(StringBuilder out, AlertRecord alert, LocalDate referenceDate) {
        String unit = alert.unit();
        out.append("  - ").append(alert.kind().title()).append(": ").append(number(alert.value())).append(unit);
        if (alert instanceof TemperatureAlert temperature) {
            out.append(" (").append(number(temperature.valueKelvin())).append("K)\n");
            line(out, "Threshold", number(alert.threshold()) + unit);
        } else {
            out.append(" (threshold: ").append(number(alert.threshold())).append(unit).append(")\n");
        }
        line(out, "Difference", number(alert.difference()) + unit);
        if (alert instanceof HumidityAlert humidity) {
            line(out, "Average temperature (Tave)", number(humidity.averageTemperatureCelsius()) + "°C");
            line(out, "Dew point (TDave)", number(humidity.dewPointCelsius()) + "°C");
        }
        TimeOfDay time = UnitConversions.decodeTimeOfDay(alert.secondsUtc(), referenceDate);
        line(out, "Seconds", String.valueOf(alert.secondsUtc()));
        line(out, "Date", DATE_FORMAT.format(time.date()));
        line(out, "Time", time.formatted());
    }

    private static void line(StringBuilder out, String label, String value) {
        out.append("    ").append(label).append(": ").append(value).append('\n');
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
