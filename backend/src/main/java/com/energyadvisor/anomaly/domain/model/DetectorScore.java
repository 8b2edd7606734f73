package com.energyadvisor.anomaly.domain.model;

import lombok.Builder;

import java.util.Map;

/**
 * Output of a single detector.
 *
 * A score is either applicable, with a value in [0, 10], or not applicable, with a
 * {@code null} value and a reason. The two states never collapse: zero means
 * "compared and found normal", not applicable means "could not compare".
 */
@Builder
public record DetectorScore(
        DetectorType detector,
        Double score,
        NotApplicableReason notApplicableReason,
        String explanation,
        Map<String, Double> confidenceInputs,   // raw numbers behind the score, for auditing
        Double deviationPercent,
        Double expectedKwh,                     // baseline the bill was compared against
        AnomalyType anomalyType,
        boolean staleInputs
) {

    public DetectorScore {
        if (score == null && notApplicableReason == null) {
            throw new IllegalArgumentException("a score without value must carry a not-applicable reason");
        }
        if (score != null && (score < 0 || score > 10)) {
            throw new IllegalArgumentException("score must be within [0, 10]: " + score);
        }
        confidenceInputs = confidenceInputs != null ? Map.copyOf(confidenceInputs) : Map.of();
        anomalyType = anomalyType != null ? anomalyType : AnomalyType.NORMAL;
    }

    public boolean isApplicable() {
        return score != null;
    }

    public static DetectorScore notApplicable(DetectorType detector, NotApplicableReason reason, String explanation) {
        return DetectorScore.builder()
                .detector(detector)
                .notApplicableReason(reason)
                .explanation(explanation)
                .build();
    }
}
