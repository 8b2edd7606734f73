package com.energyadvisor.anomaly.detection.detectors;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.detection.AnomalyDetector;
import com.energyadvisor.anomaly.detection.DetectionContext;
import com.energyadvisor.anomaly.detection.ScoreBands;
import com.energyadvisor.anomaly.domain.model.AnomalyType;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;
import com.energyadvisor.anomaly.domain.model.NotApplicableReason;
import com.energyadvisor.anomaly.domain.model.PeerGroupStats;
import com.energyadvisor.anomaly.peer.PeerStatsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Compares a bill with similar households of the same year.
 *
 * Score is based on the z-score against the peer cohort; only consumption above the
 * peer mean raises it.
 */
@Component
@Slf4j
public class PeerDetector implements AnomalyDetector {

    private final PeerStatsService peerStatsService;
    private final int minimumSampleSize;

    public PeerDetector(PeerStatsService peerStatsService, AnomalyDetectionProperties properties) {
        this.peerStatsService = peerStatsService;
        this.minimumSampleSize = properties.peer().minimumSampleSize();
    }

    @Override
    public DetectorType getType() {
        return DetectorType.PEER;
    }

    @Override
    public DetectorScore score(Bill bill, DetectionContext context) {
        if (context.peerCohort() == null) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.INSUFFICIENT_DATA,
                    "No peer data available for comparison");
        }

        Optional<PeerGroupStats> statsOpt = peerStatsService.statsFor(bill, context.peerCohort());
        if (statsOpt.isEmpty()) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.INSUFFICIENT_DATA,
                    "Fewer than " + minimumSampleSize + " similar households available for comparison");
        }

        PeerGroupStats stats = statsOpt.get();
        if (stats.stdDevKwh() == 0) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.INSUFFICIENT_DATA,
                    "Similar households show no variation in consumption");
        }

        double consumption = bill.consumptionKwh();
        double zScore = (consumption - stats.meanKwh()) / stats.stdDevKwh();
        double percentDifference = (consumption - stats.meanKwh()) / stats.meanKwh() * 100;
        double percentileRank = stats.percentileRank(consumption);
        double score = ScoreBands.zScoreScore(zScore);

        log.debug("Peer score for bill {}: {} (z={}, cohort {} of {})",
                bill.billId(), score, String.format("%.2f", zScore), stats.sampleSize(), stats.key());

        return DetectorScore.builder()
                .detector(getType())
                .score(score)
                .explanation(explain(consumption, stats, zScore, percentDifference, percentileRank))
                .confidenceInputs(Map.of(
                        "consumptionKwh", consumption,
                        "peerMeanKwh", stats.meanKwh(),
                        "peerStdDevKwh", stats.stdDevKwh(),
                        "peerSampleSize", (double) stats.sampleSize(),
                        "zScore", zScore,
                        "percentileRank", percentileRank))
                .deviationPercent(percentDifference)
                .expectedKwh(stats.meanKwh())
                .anomalyType(classify(zScore))
                .build();
    }

    private AnomalyType classify(double zScore) {
        if (zScore > 2) {
            return AnomalyType.PEER_OUTLIER_HIGH;
        } else if (zScore > 1) {
            return AnomalyType.ABOVE_PEER_AVERAGE;
        } else if (zScore < -2) {
            return AnomalyType.PEER_OUTLIER_LOW;
        }
        return AnomalyType.NORMAL;
    }

    private String explain(double consumption, PeerGroupStats stats, double zScore,
                           double percentDifference, double percentileRank) {
        String direction = percentDifference >= 0 ? "higher" : "lower";
        return String.format(Locale.ROOT,
                "Your consumption of %,.0f kWh is %.1f%% %s than the average %,.0f kWh of %d similar households "
                        + "(%s; z-score %.2f, percentile rank %.0f).",
                consumption, Math.abs(percentDifference), direction, stats.meanKwh(), stats.sampleSize(),
                stats.key().describe(), zScore, percentileRank);
    }
}
