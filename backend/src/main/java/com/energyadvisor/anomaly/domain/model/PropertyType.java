package com.energyadvisor.anomaly.domain.model;

/**
 * Kind of dwelling a bill belongs to. Part of the peer group key.
 */
public enum PropertyType {
    APARTMENT("Apartment"),
    HOUSE("House"),
    OTHER("Other");

    private final String displayName;

    PropertyType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
