package com.energyadvisor.anomaly.weather;

/**
 * Port to an external source of heating degree days.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Compute HDD for the whole calendar year of the given postal code
 * 2. Own any retry or timeout policy; callers do not retry
 * 3. Signal every failure with {@link HddFetchException}, never with a sentinel value
 */
public interface HddFetcher {

    /**
     * @param postalCode postal code of the household
     * @param year calendar year
     * @return heating degree days for that location and year
     */
    double fetchHdd(String postalCode, int year) throws HddFetchException;
}
