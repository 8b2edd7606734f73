package com.energyadvisor.anomaly.domain.model;

import java.util.Locale;

/**
 * Cohort identity: two bills are peers iff their keys are equal.
 *
 * @param householdSizeBucket lower bound of the household-size bucket (the last bucket is open-ended)
 * @param propertyType dwelling type, or {@code null} for a cohort spanning all types
 * @param year billing year
 */
public record PeerGroupKey(int householdSizeBucket, PropertyType propertyType, int year) {

    public boolean spansAllPropertyTypes() {
        return propertyType == null;
    }

    public PeerGroupKey withAllPropertyTypes() {
        return new PeerGroupKey(householdSizeBucket, null, year);
    }

    public String describe() {
        return String.format(Locale.ROOT, "household size bucket %d, %s properties, %d",
                householdSizeBucket,
                propertyType != null ? propertyType.getDisplayName().toLowerCase(Locale.ROOT) : "all",
                year);
    }
}
