package com.energyadvisor.anomaly.domain.model;

import java.util.List;

/**
 * Distribution of annual consumption within one peer cohort.
 *
 * Only built for cohorts that reached the configured minimum sample size; smaller
 * cohorts are reported as unavailable instead.
 */
public record PeerGroupStats(
        PeerGroupKey key,
        int sampleSize,
        double meanKwh,
        double stdDevKwh,          // population standard deviation
        double p25Kwh,
        double p50Kwh,
        double p75Kwh,
        double p90Kwh,
        Double meanCostEuros,
        Double meanCostPerKwh,
        List<Double> sortedConsumptionsKwh
) {

    public PeerGroupStats {
        sortedConsumptionsKwh = List.copyOf(sortedConsumptionsKwh);
    }

    /**
     * Percentage of the cohort consuming less than the given value, counting ties as half.
     */
    public double percentileRank(double consumptionKwh) {
        if (sortedConsumptionsKwh.isEmpty()) {
            return 0;
        }
        int below = 0;
        int equal = 0;
        for (double value : sortedConsumptionsKwh) {
            if (value < consumptionKwh) {
                below++;
            } else if (value == consumptionKwh) {
                equal++;
            }
        }
        return (below + 0.5 * equal) / sortedConsumptionsKwh.size() * 100;
    }
}
