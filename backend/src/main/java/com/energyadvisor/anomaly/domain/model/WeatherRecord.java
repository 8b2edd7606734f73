package com.energyadvisor.anomaly.domain.model;

import java.time.Instant;

/**
 * Heating degree days for one postal code and year, as last fetched.
 */
public record WeatherRecord(
        String postalCode,
        int year,
        double hdd,
        Instant fetchedAt
) {}
