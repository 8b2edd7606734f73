package com.energyadvisor.anomaly.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Piecewise-linear mappings from raw deviations onto the 0-10 anomaly scale.
 *
 * Within a band the score is interpolated linearly between the band's end points;
 * beyond the last band it saturates. Negative deviations score 0.
 */
public final class ScoreBands {

    private ScoreBands() {
    }

    /**
     * Percentage increase over an expectation:
     * up to 5% -> 0, 5-15% -> 0..3, 15-30% -> 3..6, 30-50% -> 6..8, 50% and more -> 10.
     */
    public static double percentIncreaseScore(double percentIncrease) {
        double score;
        if (percentIncrease <= 5) {
            score = 0;
        } else if (percentIncrease <= 15) {
            score = interpolate(percentIncrease, 5, 15, 0, 3);
        } else if (percentIncrease <= 30) {
            score = interpolate(percentIncrease, 15, 30, 3, 6);
        } else if (percentIncrease < 50) {
            score = interpolate(percentIncrease, 30, 50, 6, 8);
        } else {
            score = 10;
        }
        return round(score);
    }

    /**
     * Standard deviations above the peer mean:
     * up to 1 -> 0, 1-2 -> 0..5, 2-3 -> 5..8, above 3 -> 10.
     */
    public static double zScoreScore(double zScore) {
        double score;
        if (zScore <= 1) {
            score = 0;
        } else if (zScore <= 2) {
            score = interpolate(zScore, 1, 2, 0, 5);
        } else if (zScore <= 3) {
            score = interpolate(zScore, 2, 3, 5, 8);
        } else {
            score = 10;
        }
        return round(score);
    }

    private static double interpolate(double value, double fromLow, double fromHigh, double toLow, double toHigh) {
        return toLow + (value - fromLow) / (fromHigh - fromLow) * (toHigh - toLow);
    }

    private static double round(double score) {
        double clamped = Math.max(0, Math.min(10, score));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
