package com.energyadvisor.anomaly.domain.model;

/**
 * Qualitative label of what a detector observed.
 */
public enum AnomalyType {
    NORMAL("Normal"),

    // historical
    CONSUMPTION_SPIKE("Consumption spike"),
    MODERATE_INCREASE("Moderate increase"),
    MODERATE_DECREASE("Moderate decrease"),
    CONSUMPTION_DROP("Consumption drop"),

    // peer
    PEER_OUTLIER_HIGH("Far above similar households"),
    ABOVE_PEER_AVERAGE("Above similar households"),
    PEER_OUTLIER_LOW("Far below similar households"),

    // weather
    UNEXPLAINED_SPIKE("Increase not explained by weather"),
    UNEXPLAINED_DROP("Decrease not explained by weather"),
    MODERATE_DEVIATION("Moderate deviation from weather prediction");

    private final String displayLabel;

    AnomalyType(String displayLabel) {
        this.displayLabel = displayLabel;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }
}
