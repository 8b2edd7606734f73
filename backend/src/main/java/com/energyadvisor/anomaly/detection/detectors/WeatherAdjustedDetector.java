package com.energyadvisor.anomaly.detection.detectors;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.detection.AnomalyDetector;
import com.energyadvisor.anomaly.detection.DetectionContext;
import com.energyadvisor.anomaly.detection.HistoricalBaseline;
import com.energyadvisor.anomaly.detection.ScoreBands;
import com.energyadvisor.anomaly.domain.model.AnomalyType;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;
import com.energyadvisor.anomaly.domain.model.NotApplicableReason;
import com.energyadvisor.anomaly.weather.HddLookup;
import com.energyadvisor.anomaly.weather.HeatingDemandModel;
import com.energyadvisor.anomaly.weather.WeatherNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares a bill with the consumption expected for the year's heating demand.
 *
 * PREDICTION:
 * expected kWh = kwhPerHdd * HDD + baseLoadKwh. The coefficients are fitted on the
 * household's prior years when at least two of them have weather data and the fit is
 * usable; otherwise the configured population default applies.
 *
 * Missing weather data for the bill's own year makes the detector not applicable.
 */
@Component
@Slf4j
public class WeatherAdjustedDetector implements AnomalyDetector {

    private final WeatherNormalizer weatherNormalizer;
    private final HeatingDemandModel populationDefault;

    public WeatherAdjustedDetector(WeatherNormalizer weatherNormalizer, AnomalyDetectionProperties properties) {
        this.weatherNormalizer = weatherNormalizer;
        this.populationDefault = HeatingDemandModel.populationDefault(
                properties.weather().defaultKwhPerHdd(),
                properties.weather().defaultBaseLoadKwh());
    }

    @Override
    public DetectorType getType() {
        return DetectorType.WEATHER;
    }

    @Override
    public DetectorScore score(Bill bill, DetectionContext context) {
        HddLookup current = weatherNormalizer.getHdd(bill.postalCode(), bill.year());
        if (!current.available()) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.UPSTREAM_UNAVAILABLE,
                    "Weather data not available for " + bill.postalCode() + " in " + bill.year());
        }

        boolean staleInputs = current.stale();
        List<HeatingDemandModel.Observation> observations = new ArrayList<>();
        if (context.baseline() != null) {
            for (HistoricalBaseline.YearlyConsumption prior : context.baseline().priorYears()) {
                String postalCode = prior.postalCode() != null ? prior.postalCode() : bill.postalCode();
                HddLookup lookup = weatherNormalizer.getHdd(postalCode, prior.year());
                if (lookup.available()) {
                    observations.add(new HeatingDemandModel.Observation(
                            prior.year(), prior.consumptionKwh(), lookup.hdd()));
                    staleInputs |= lookup.stale();
                }
            }
        }

        HeatingDemandModel fitted = HeatingDemandModel.fit(observations);
        HeatingDemandModel model = fitted != null ? fitted : populationDefault;

        double hdd = current.hdd();
        double expected = model.predict(hdd);
        if (expected <= 0) {
            return DetectorScore.notApplicable(getType(), NotApplicableReason.INSUFFICIENT_DATA,
                    "Weather model does not yield a positive expected consumption");
        }

        double actual = bill.consumptionKwh();
        double deviationPercent = (actual - expected) / expected * 100;
        double score = ScoreBands.percentIncreaseScore(deviationPercent);

        log.debug("Weather score for bill {}: {} (expected {} kWh at {} HDD, {} model)",
                bill.billId(), score, String.format("%.0f", expected), hdd,
                model.fitted() ? "fitted" : "default");

        Map<String, Double> inputs = new HashMap<>();
        inputs.put("hdd", hdd);
        inputs.put("expectedKwh", expected);
        inputs.put("actualKwh", actual);
        inputs.put("deviationPercent", deviationPercent);
        inputs.put("kwhPerHdd", model.kwhPerHdd());
        inputs.put("baseLoadKwh", model.baseLoadKwh());
        inputs.put("fittedSamples", (double) model.samples());

        return DetectorScore.builder()
                .detector(getType())
                .score(score)
                .explanation(explain(actual, expected, deviationPercent, hdd, model, staleInputs))
                .confidenceInputs(inputs)
                .deviationPercent(deviationPercent)
                .expectedKwh(expected)
                .anomalyType(classify(deviationPercent))
                .staleInputs(staleInputs)
                .build();
    }

    private AnomalyType classify(double deviationPercent) {
        if (deviationPercent > 25) {
            return AnomalyType.UNEXPLAINED_SPIKE;
        } else if (deviationPercent < -25) {
            return AnomalyType.UNEXPLAINED_DROP;
        } else if (Math.abs(deviationPercent) >= 15) {
            return AnomalyType.MODERATE_DEVIATION;
        }
        return AnomalyType.NORMAL;
    }

    private String explain(double actual, double expected, double deviationPercent, double hdd,
                           HeatingDemandModel model, boolean staleInputs) {
        String direction = deviationPercent >= 0 ? "higher" : "lower";
        String basis = model.fitted()
                ? "your consumption pattern of " + model.samples() + " previous years"
                : "typical household consumption";
        String text = String.format(Locale.ROOT,
                "After adjusting for weather (%,.0f heating degree days), your consumption of %,.0f kWh is "
                        + "%.1f%% %s than the expected %,.0f kWh based on %s.",
                hdd, actual, Math.abs(deviationPercent), direction, expected, basis);
        return staleInputs ? text + " Weather data may be outdated." : text;
    }
}
