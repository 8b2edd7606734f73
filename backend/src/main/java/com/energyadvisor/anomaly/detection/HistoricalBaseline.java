package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.Bill;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A household's consumption in the years before the bill under evaluation.
 *
 * Derived per request from the caller's history: bills of the same user for earlier
 * years, summed per year and ordered by year. Bills of the same or later years are
 * ignored.
 */
public record HistoricalBaseline(List<YearlyConsumption> priorYears) {

    static final int MAX_BASELINE_YEARS = 3;

    public HistoricalBaseline {
        priorYears = List.copyOf(priorYears);
    }

    public static HistoricalBaseline from(Bill bill, List<Bill> history) {
        if (history == null || history.isEmpty()) {
            return new HistoricalBaseline(List.of());
        }
        Map<Integer, YearAccumulator> byYear = new TreeMap<>();
        for (Bill prior : history) {
            if (!bill.userId().equals(prior.userId()) || prior.year() >= bill.year()) {
                continue;
            }
            byYear.computeIfAbsent(prior.year(), year -> new YearAccumulator()).add(prior);
        }
        List<YearlyConsumption> years = new ArrayList<>();
        byYear.forEach((year, acc) -> years.add(new YearlyConsumption(year, acc.kwh, acc.postalCode)));
        return new HistoricalBaseline(years);
    }

    public boolean isEmpty() {
        return priorYears.isEmpty();
    }

    /**
     * Years that make up the baseline: the last up to three years when at least two
     * exist, otherwise the single most recent one.
     */
    public List<YearlyConsumption> baselineYears() {
        if (priorYears.size() < 2) {
            return priorYears;
        }
        return priorYears.subList(Math.max(0, priorYears.size() - MAX_BASELINE_YEARS), priorYears.size());
    }

    /**
     * Baseline consumption, or {@code null} without prior years.
     */
    public Double baselineKwh() {
        if (priorYears.isEmpty()) {
            return null;
        }
        return baselineYears().stream().mapToDouble(YearlyConsumption::consumptionKwh).average().orElseThrow();
    }

    public record YearlyConsumption(int year, double consumptionKwh, String postalCode) {}

    private static final class YearAccumulator {
        private double kwh;
        private String postalCode;

        void add(Bill bill) {
            kwh += bill.consumptionKwh();
            if (postalCode == null) {
                postalCode = bill.postalCode();
            }
        }
    }
}
