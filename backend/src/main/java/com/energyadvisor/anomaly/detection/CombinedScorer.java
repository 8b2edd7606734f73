package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.domain.model.AnomalyResult;
import com.energyadvisor.anomaly.domain.model.AnomalyType;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;
import com.energyadvisor.anomaly.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges the detector scores of one bill into a verdict.
 *
 * WEIGHTING:
 * Each detector has a fixed weight (default historical 0.4, peer 0.3, weather 0.3).
 * Weights of not-applicable detectors are redistributed proportionally over the
 * applicable ones, so the combined score is sum(w * s) / sum(w) over applicable
 * detectors, rounded half-up to one decimal.
 *
 * When no detector is applicable the verdict is UNKNOWN with no combined score and
 * no cost estimate.
 *
 * EXTRA COST:
 * (consumption - expected) * tariff, floored at zero. The expectation comes from the
 * first applicable detector in order weather, historical, peer.
 */
@Component
@Slf4j
public class CombinedScorer {

    private final Map<DetectorType, Double> weights;
    private final double warningThreshold;
    private final double criticalThreshold;
    private final RecommendationCatalog recommendations;
    private final Clock clock;

    public CombinedScorer(AnomalyDetectionProperties properties, RecommendationCatalog recommendations, Clock clock) {
        this.weights = properties.weights().asMap();
        this.warningThreshold = properties.severity().warningThreshold();
        this.criticalThreshold = properties.severity().criticalThreshold();
        this.recommendations = recommendations;
        this.clock = clock;
    }

    public AnomalyResult combine(Bill bill, Map<DetectorType, DetectorScore> scores) {
        Double combinedScore = weightedScore(scores);

        if (combinedScore == null) {
            log.info("Bill {}: no detector applicable, severity unknown", bill.billId());
            return new AnomalyResult(
                    bill.billId(),
                    bill.userId(),
                    bill.year(),
                    scores,
                    null,
                    Severity.UNKNOWN,
                    false,
                    AnomalyType.NORMAL,
                    unknownExplanation(scores),
                    recommendations.forSeverity(Severity.UNKNOWN),
                    null,
                    clock.instant()
            );
        }

        Severity severity = Severity.fromScore(combinedScore, warningThreshold, criticalThreshold);
        DetectorScore dominant = dominantScore(scores);
        AnomalyType primaryType = dominant.score() >= warningThreshold ? dominant.anomalyType() : AnomalyType.NORMAL;
        BigDecimal extraCost = estimateExtraCost(bill, scores);

        log.info("Bill {}: combined score {} ({}), dominant detector {}",
                bill.billId(), combinedScore, severity, dominant.detector().getKey());

        return new AnomalyResult(
                bill.billId(),
                bill.userId(),
                bill.year(),
                scores,
                combinedScore,
                severity,
                severity.isAnomalous(),
                primaryType,
                explain(severity, primaryType, dominant),
                recommendations.forSeverity(severity),
                extraCost,
                clock.instant()
        );
    }

    /**
     * Weighted mean over applicable detectors with positive weight, or {@code null}
     * when there is none.
     */
    Double weightedScore(Map<DetectorType, DetectorScore> scores) {
        double weightSum = 0;
        double weighted = 0;
        for (DetectorScore score : scores.values()) {
            if (score == null || !score.isApplicable()) {
                continue;
            }
            double weight = weights.getOrDefault(score.detector(), 0.0);
            weightSum += weight;
            weighted += weight * score.score();
        }
        if (weightSum <= 0) {
            return null;
        }
        double raw = Math.min(10, Math.max(0, weighted / weightSum));
        return BigDecimal.valueOf(raw).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Highest applicable score; ties go to historical, then peer, then weather.
     */
    DetectorScore dominantScore(Map<DetectorType, DetectorScore> scores) {
        DetectorScore dominant = null;
        for (DetectorType type : DetectorType.values()) {
            DetectorScore score = scores.get(type);
            if (score == null || !score.isApplicable()) {
                continue;
            }
            if (dominant == null || score.score() > dominant.score()) {
                dominant = score;
            }
        }
        if (dominant == null) {
            throw new IllegalStateException("no applicable detector score");
        }
        return dominant;
    }

    BigDecimal estimateExtraCost(Bill bill, Map<DetectorType, DetectorScore> scores) {
        return Arrays.stream(DetectorType.values())
                .sorted(Comparator.comparingInt(DetectorType::getCostBaselinePriority))
                .map(scores::get)
                .filter(score -> score != null && score.isApplicable() && score.expectedKwh() != null)
                .findFirst()
                .map(score -> {
                    double excessKwh = Math.max(0, bill.consumptionKwh() - score.expectedKwh());
                    return BigDecimal.valueOf(excessKwh)
                            .multiply(bill.tariffRate())
                            .setScale(2, RoundingMode.HALF_UP);
                })
                .orElse(null);
    }

    private String explain(Severity severity, AnomalyType primaryType, DetectorScore dominant) {
        String deviation = dominant.deviationPercent() != null
                ? String.format(Locale.ROOT, " (%+.1f%%)", dominant.deviationPercent())
                : "";
        String headline = severity.isAnomalous()
                ? severity.getDisplayLabel() + " anomaly"
                : "No anomaly detected";
        if (primaryType != AnomalyType.NORMAL) {
            headline += " (" + primaryType.getDisplayLabel().toLowerCase(Locale.ROOT) + ")";
        }
        return String.format(Locale.ROOT, "%s: strongest signal from %s%s. %s",
                headline, dominant.detector().getDisplayName(), deviation, dominant.explanation());
    }

    private String unknownExplanation(Map<DetectorType, DetectorScore> scores) {
        String detail = scores.values().stream()
                .filter(score -> score != null && score.explanation() != null)
                .map(DetectorScore::explanation)
                .collect(Collectors.joining("; "));
        return detail.isEmpty()
                ? "Not enough data to assess this bill."
                : "Not enough data to assess this bill: " + detail + ".";
    }
}
