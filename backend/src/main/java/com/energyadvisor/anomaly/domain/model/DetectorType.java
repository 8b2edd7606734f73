package com.energyadvisor.anomaly.domain.model;

/**
 * The independent baselines a bill is compared against.
 *
 * Declaration order is the tie-break order when two detectors report the same score.
 */
public enum DetectorType {
    HISTORICAL("historical", "historical comparison", 2),
    PEER("peer", "peer comparison", 3),
    WEATHER("weather", "weather-adjusted prediction", 1);

    private final String key;
    private final String displayName;
    private final int costBaselinePriority;

    DetectorType(String key, String displayName, int costBaselinePriority) {
        this.key = key;
        this.displayName = displayName;
        this.costBaselinePriority = costBaselinePriority;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower value wins when choosing the expected consumption for the extra cost estimate.
     */
    public int getCostBaselinePriority() {
        return costBaselinePriority;
    }
}
