package com.meteoalert.service.runtime;

public record RunOutcome(Status status, int alertCount, int exportedCount, String message) {
    public enum Status {
        ALREADY_PROCESSED,
        NO_ALERTS,
        DELIVERED,
        FAILED
    }

    public static RunOutcome alreadyProcessed(String marker) {
        return new RunOutcome(Status.ALREADY_PROCESSED, 0, 0, "Marker present: " + marker);
    }

    public static RunOutcome noAlerts() {
        return new RunOutcome(Status.NO_ALERTS, 0, 0, "No alerts generated");
    }

    public static RunOutcome delivered(int alertCount, int exportedCount) {
        return new RunOutcome(Status.DELIVERED, alertCount, exportedCount,
                "Delivered " + exportedCount + " of " + alertCount + " alerts");
    }

    public static RunOutcome failed(String message) {
        return new RunOutcome(Status.FAILED, 0, 0, message);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
