package com.energyadvisor.anomaly.domain.model;

/**
 * Why a detector produced no score.
 */
public enum NotApplicableReason {
    /** Not enough history, peers or model inputs to compute a score. */
    INSUFFICIENT_DATA,
    /** Weather data could not be fetched and nothing was cached. */
    UPSTREAM_UNAVAILABLE
}
