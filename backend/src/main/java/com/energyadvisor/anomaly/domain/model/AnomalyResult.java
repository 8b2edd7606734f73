package com.energyadvisor.anomaly.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verdict for one bill.
 *
 * {@code combinedScore} is {@code null} exactly when {@code severity} is UNKNOWN.
 * {@code estimatedExtraCostEuros} is {@code null} when no detector produced a baseline.
 */
public record AnomalyResult(
        String billId,
        String userId,
        int year,
        Map<DetectorType, DetectorScore> detectorScores,
        Double combinedScore,
        Severity severity,
        boolean hasAnomaly,
        AnomalyType primaryAnomalyType,
        String explanation,
        List<String> recommendations,
        BigDecimal estimatedExtraCostEuros,
        Instant detectedAt
) {

    public AnomalyResult {
        Map<DetectorType, DetectorScore> copy = new EnumMap<>(DetectorType.class);
        copy.putAll(detectorScores);
        detectorScores = Collections.unmodifiableMap(copy);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * The detector's score if it was applicable.
     */
    public Optional<DetectorScore> applicableScore(DetectorType detector) {
        return Optional.ofNullable(detectorScores.get(detector)).filter(DetectorScore::isApplicable);
    }

    public boolean isUnknown() {
        return severity == Severity.UNKNOWN;
    }
}
