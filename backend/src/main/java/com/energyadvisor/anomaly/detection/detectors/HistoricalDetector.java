package com.energyadvisor.anomaly.detection.detectors;

import com.energyadvisor.anomaly.detection.AnomalyDetector;
import com.energyadvisor.anomaly.detection.DetectionContext;
import com.energyadvisor.anomaly.detection.HistoricalBaseline;
import com.energyadvisor.anomaly.detection.ScoreBands;
import com.energyadvisor.anomaly.domain.model.AnomalyType;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;
import com.energyadvisor.anomaly.domain.model.NotApplicableReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares a bill with the household's own previous years.
 *
 * The baseline is the most recent prior year, or the average of the last up to
 * three years when at least two exist. Only increases raise the score.
 */
@Component
@Slf4j
public class HistoricalDetector implements AnomalyDetector {

    @Override
    public DetectorType getType() {
        return DetectorType.HISTORICAL;
    }

    @Override
    public DetectorScore score(Bill bill, DetectionContext context) {
        HistoricalBaseline baseline = context.baseline();
        if (baseline == null || baseline.isEmpty()) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.INSUFFICIENT_DATA,
                    "No previous year data available for comparison");
        }

        double baselineKwh = baseline.baselineKwh();
        double changePercent = (bill.consumptionKwh() - baselineKwh) / baselineKwh * 100;
        double score = ScoreBands.percentIncreaseScore(changePercent);
        List<HistoricalBaseline.YearlyConsumption> years = baseline.baselineYears();

        log.debug("Historical score for bill {}: {} ({}% vs {} kWh)",
                bill.billId(), score, String.format("%.1f", changePercent), baselineKwh);

        return DetectorScore.builder()
                .detector(getType())
                .score(score)
                .explanation(explain(bill.consumptionKwh(), baselineKwh, changePercent, years))
                .confidenceInputs(Map.of(
                        "currentKwh", bill.consumptionKwh(),
                        "baselineKwh", baselineKwh,
                        "changePercent", changePercent,
                        "baselineYears", (double) years.size()))
                .deviationPercent(changePercent)
                .expectedKwh(baselineKwh)
                .anomalyType(classify(changePercent))
                .build();
    }

    private AnomalyType classify(double changePercent) {
        if (changePercent > 30) {
            return AnomalyType.CONSUMPTION_SPIKE;
        } else if (changePercent > 15) {
            return AnomalyType.MODERATE_INCREASE;
        } else if (changePercent < -30) {
            return AnomalyType.CONSUMPTION_DROP;
        } else if (changePercent < -15) {
            return AnomalyType.MODERATE_DECREASE;
        }
        return AnomalyType.NORMAL;
    }

    private String explain(double current, double baselineKwh, double changePercent,
                           List<HistoricalBaseline.YearlyConsumption> years) {
        String reference = years.size() == 1
                ? String.valueOf(years.get(0).year())
                : String.format(Locale.ROOT, "the %d-%d average", years.get(0).year(), years.get(years.size() - 1).year());
        String direction = changePercent >= 0 ? "increased" : "decreased";
        String change = changePercent >= 0 ? "increase" : "decrease";
        return String.format(Locale.ROOT,
                "Your consumption %s from %,.0f kWh to %,.0f kWh, a %.1f%% %s compared to %s.",
                direction, baselineKwh, current, Math.abs(changePercent), change, reference);
    }
}
