package com.energyadvisor.anomaly.peer;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.PeerGroupKey;
import com.energyadvisor.anomaly.domain.model.PeerGroupStats;
import com.energyadvisor.anomaly.domain.model.PropertyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes consumption statistics for peer cohorts.
 *
 * COHORTS:
 * Bills are grouped by (household size bucket, property type, year). Household sizes
 * are bucketed with the configured ascending lower bounds; the last bucket is
 * open-ended, so with the default bounds 1,2,3,4,5 a household of 7 is in bucket 5.
 *
 * STATISTICS:
 * Population mean and standard deviation over the cohort, excluding the bill being
 * evaluated. Percentiles use linear interpolation between closest ranks.
 * Results depend only on the cohort's values, never on input order.
 */
@Service
@Slf4j
public class PeerStatsService {

    private static final Comparator<PeerGroupKey> COHORT_ORDER = Comparator
            .comparingInt(PeerGroupKey::householdSizeBucket)
            .thenComparing(PeerGroupKey::propertyType, Comparator.nullsLast(Comparator.<PropertyType>naturalOrder()));

    private final List<Integer> bucketBounds;
    private final int minimumSampleSize;
    private final boolean fallbackToAllPropertyTypes;

    public PeerStatsService(AnomalyDetectionProperties properties) {
        this.bucketBounds = properties.peer().householdSizeBuckets();
        this.minimumSampleSize = properties.peer().minimumSampleSize();
        this.fallbackToAllPropertyTypes = properties.peer().fallbackToAllPropertyTypes();
    }

    public int bucketOf(int householdSize) {
        int bucket = bucketBounds.get(0);
        for (int bound : bucketBounds) {
            if (householdSize >= bound) {
                bucket = bound;
            }
        }
        return bucket;
    }

    public PeerGroupKey keyFor(Bill bill) {
        return new PeerGroupKey(bucketOf(bill.householdSize()), bill.propertyType(), bill.year());
    }

    public boolean isPeer(Bill candidate, PeerGroupKey key) {
        if (candidate == null || candidate.year() != key.year()) {
            return false;
        }
        if (bucketOf(candidate.householdSize()) != key.householdSizeBucket()) {
            return false;
        }
        return key.spansAllPropertyTypes() || candidate.propertyType() == key.propertyType();
    }

    /**
     * Statistics for the bill's own cohort, widened to all property types when the
     * exact cohort is too small and widening is enabled.
     */
    public Optional<PeerGroupStats> statsFor(Bill bill, PeerCohortAccessor accessor) {
        PeerGroupKey key = keyFor(bill);
        Optional<PeerGroupStats> stats = computeStats(accessor.candidates(key), key, bill.billId());

        if (stats.isEmpty() && fallbackToAllPropertyTypes) {
            PeerGroupKey widened = key.withAllPropertyTypes();
            log.debug("Peer group {} too small, widening to {}", key, widened);
            stats = computeStats(accessor.candidates(widened), widened, bill.billId());
        }
        return stats;
    }

    /**
     * Compute statistics over the bills in {@code bills} that share {@code key}.
     *
     * @param excludeBillId id of the bill under evaluation, left out of its own cohort
     * @return empty when fewer than the minimum sample size remain
     */
    public Optional<PeerGroupStats> computeStats(Collection<Bill> bills, PeerGroupKey key, String excludeBillId) {
        List<Bill> cohort = bills == null ? List.of() : bills.stream()
                .filter(b -> isPeer(b, key))
                .filter(b -> excludeBillId == null || !excludeBillId.equals(b.billId()))
                .filter(b -> b.consumptionKwh() > 0)
                .toList();

        if (cohort.size() < minimumSampleSize) {
            log.debug("Insufficient peer data for {}: {} bills (need {})", key, cohort.size(), minimumSampleSize);
            return Optional.empty();
        }

        List<Double> sorted = cohort.stream()
                .map(Bill::consumptionKwh)
                .sorted()
                .toList();

        // identical values must report an exact zero spread; a summed average can be off by an ulp
        boolean uniform = sorted.get(0).equals(sorted.get(sorted.size() - 1));
        double mean = uniform
                ? sorted.get(0)
                : sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = uniform ? 0d : sorted.stream()
                .mapToDouble(value -> Math.pow(value - mean, 2))
                .average()
                .orElse(0);

        List<BigDecimal> costs = cohort.stream()
                .map(Bill::totalCostEuros)
                .filter(Objects::nonNull)
                .toList();
        Double meanCost = null;
        Double meanCostPerKwh = null;
        if (costs.size() == cohort.size()) {
            double totalCost = costs.stream().mapToDouble(BigDecimal::doubleValue).sum();
            double totalKwh = sorted.stream().mapToDouble(Double::doubleValue).sum();
            meanCost = totalCost / cohort.size();
            meanCostPerKwh = totalKwh > 0 ? totalCost / totalKwh : null;
        }

        return Optional.of(new PeerGroupStats(
                key,
                cohort.size(),
                mean,
                Math.sqrt(variance),
                percentile(sorted, 25),
                percentile(sorted, 50),
                percentile(sorted, 75),
                percentile(sorted, 90),
                meanCost,
                meanCostPerKwh,
                sorted
        ));
    }

    /**
     * Statistics for every cohort of a year that reaches the minimum sample size.
     *
     * Each household size bucket also gets a cohort spanning all property types.
     * Results are ordered by bucket, then property type, with the all-types cohort last.
     */
    public List<PeerGroupStats> allGroupStats(Collection<Bill> bills, int year) {
        List<Bill> ofYear = bills == null ? List.of() : bills.stream()
                .filter(Objects::nonNull)
                .filter(b -> b.year() == year)
                .toList();

        Set<PeerGroupKey> keys = new TreeSet<>(COHORT_ORDER);
        for (Bill bill : ofYear) {
            PeerGroupKey key = keyFor(bill);
            keys.add(key);
            keys.add(key.withAllPropertyTypes());
        }

        List<PeerGroupStats> result = new ArrayList<>();
        for (PeerGroupKey key : keys) {
            computeStats(ofYear, key, null).ifPresent(result::add);
        }
        log.info("Peer statistics for {}: {} of {} cohorts have enough data", year, result.size(), keys.size());
        return result;
    }

    static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues.get(lower);
        }
        double weight = index - lower;
        return sortedValues.get(lower) * (1 - weight) + sortedValues.get(upper) * weight;
    }
}
