package com.meteoalert.core.model;

/**
 * The single extremal reading emitted for one city and one {@link AlertKind}.
 *
 * <p>{@code difference} is {@code value - threshold}; each family record fixes its own kind.</p>
 */
public interface AlertRecord {
    AlertKind kind();

    double value();

    double threshold();

    default double difference() {
        return value() - threshold();
    }

    default String unit() {
        return kind().unit();
    }

    int secondsUtc();

    String polygonId();
}
