package com.energyadvisor.anomaly.domain.model;

/**
 * Overall verdict tier of a combined anomaly score.
 *
 * UNKNOWN is reserved for bills where no detector could produce a score; it is
 * never derived from a number.
 */
public enum Severity {
    NORMAL("Normal"),
    WARNING("Warning"),
    CRITICAL("Critical"),
    UNKNOWN("Insufficient data");

    private final String displayLabel;

    Severity(String displayLabel) {
        this.displayLabel = displayLabel;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    public boolean isAnomalous() {
        return this == WARNING || this == CRITICAL;
    }

    /**
     * Classify a combined score. Lower bounds are inclusive: a score equal to the
     * warning threshold is already a warning.
     */
    public static Severity fromScore(double score, double warningThreshold, double criticalThreshold) {
        if (score >= criticalThreshold) {
            return CRITICAL;
        }
        if (score >= warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }
}
