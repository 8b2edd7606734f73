package com.energyadvisor.anomaly.peer;

import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.PeerGroupKey;

import java.util.Collection;

/**
 * Port to whatever holds the bills of other households.
 *
 * Implementations may return a superset of the cohort (e.g. every bill of the year);
 * {@link PeerStatsService} keeps only the bills whose key matches.
 */
@FunctionalInterface
public interface PeerCohortAccessor {

    /**
     * Candidate bills for the given peer group.
     */
    Collection<Bill> candidates(PeerGroupKey key);
}
