package com.energyadvisor.anomaly.weather;

import com.energyadvisor.anomaly.domain.model.WeatherRecord;

/**
 * Outcome of a heating degree day lookup.
 *
 * @param record the weather record, {@code null} when unavailable
 * @param stale true when the record is a last-known value served because a refresh failed
 * @param failureReason why no value could be provided, {@code null} when available
 */
public record HddLookup(WeatherRecord record, boolean stale, String failureReason) {

    public boolean available() {
        return record != null;
    }

    public double hdd() {
        if (record == null) {
            throw new IllegalStateException("HDD unavailable: " + failureReason);
        }
        return record.hdd();
    }

    public static HddLookup fresh(WeatherRecord record) {
        return new HddLookup(record, false, null);
    }

    public static HddLookup stale(WeatherRecord record) {
        return new HddLookup(record, true, null);
    }

    public static HddLookup unavailable(String reason) {
        return new HddLookup(null, false, reason);
    }
}
