package com.energyadvisor.anomaly.weather;

import java.util.List;

/**
 * Linear model of annual consumption against heating degree days:
 * expected kWh = kwhPerHdd * HDD + baseLoadKwh.
 *
 * @param fitted true when the coefficients come from the household's own history
 * @param samples number of (consumption, HDD) pairs behind a fitted model
 */
public record HeatingDemandModel(double kwhPerHdd, double baseLoadKwh, boolean fitted, int samples) {

    public static HeatingDemandModel populationDefault(double kwhPerHdd, double baseLoadKwh) {
        return new HeatingDemandModel(kwhPerHdd, baseLoadKwh, false, 0);
    }

    /**
     * Ordinary least squares fit of consumption on HDD.
     *
     * @return {@code null} when fewer than two pairs exist, all HDD values are equal,
     *         or consumption falls as heating demand rises
     */
    public static HeatingDemandModel fit(List<Observation> observations) {
        if (observations == null || observations.size() < 2) {
            return null;
        }
        double meanHdd = observations.stream().mapToDouble(Observation::hdd).average().orElse(0);
        double meanKwh = observations.stream().mapToDouble(Observation::consumptionKwh).average().orElse(0);

        double covariance = 0;
        double hddVariance = 0;
        for (Observation o : observations) {
            covariance += (o.hdd() - meanHdd) * (o.consumptionKwh() - meanKwh);
            hddVariance += (o.hdd() - meanHdd) * (o.hdd() - meanHdd);
        }
        if (hddVariance == 0) {
            return null;
        }
        double slope = covariance / hddVariance;
        if (slope < 0) {
            return null;
        }
        return new HeatingDemandModel(slope, meanKwh - slope * meanHdd, true, observations.size());
    }

    public double predict(double hdd) {
        return kwhPerHdd * hdd + baseLoadKwh;
    }

    public record Observation(int year, double consumptionKwh, double hdd) {}
}
