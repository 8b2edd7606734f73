package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.peer.PeerCohortAccessor;

import java.util.List;

/**
 * Everything a detector may consult besides the bill itself and the weather cache.
 *
 * @param baseline the household's prior-year consumption derived from its history
 * @param peerCohort source of other households' bills
 */
public record DetectionContext(HistoricalBaseline baseline, PeerCohortAccessor peerCohort) {

    public static DetectionContext of(Bill bill, List<Bill> history, PeerCohortAccessor peerCohort) {
        return new DetectionContext(HistoricalBaseline.from(bill, history), peerCohort);
    }
}
