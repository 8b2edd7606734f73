package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;

/**
 * Scores a bill against one baseline.
 *
 * Each implementation compares the bill with a single kind of expectation and
 * returns a score in [0, 10], or a not-applicable score when it lacks the data to
 * compare. Implementations must not throw for missing data and must not modify
 * the bill or any shared state other than the weather cache.
 */
public interface AnomalyDetector {

    /**
     * Returns the baseline this detector handles.
     */
    DetectorType getType();

    /**
     * Score the bill.
     *
     * @param bill a validated bill
     * @param context the bill's history and peer cohort source
     * @return an applicable or not-applicable score, never {@code null}
     */
    DetectorScore score(Bill bill, DetectionContext context);
}
