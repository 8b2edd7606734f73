package com.energyadvisor.anomaly.config;

import com.energyadvisor.anomaly.domain.model.DetectorType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable constants of the anomaly detection engine.
 *
 * Every section is optional; missing values fall back to the documented defaults,
 * so {@link #defaults()} and an empty {@code anomaly:} block are equivalent.
 */
@ConfigurationProperties(prefix = "anomaly")
public record AnomalyDetectionProperties(
        Weights weights,
        SeverityThresholds severity,
        Peer peer,
        Weather weather,
        Batch batch
) {

    public AnomalyDetectionProperties {
        weights = weights != null ? weights : new Weights(null, null, null);
        severity = severity != null ? severity : new SeverityThresholds(null, null);
        peer = peer != null ? peer : new Peer(null, null, null);
        weather = weather != null ? weather : new Weather(null, null, null, null, null, null, null, null, null);
        batch = batch != null ? batch : new Batch(null);
    }

    public static AnomalyDetectionProperties defaults() {
        return new AnomalyDetectionProperties(null, null, null, null, null);
    }

    public record Weights(Double historical, Double peer, Double weather) {
        public Weights {
            historical = historical != null ? historical : 0.4;
            peer = peer != null ? peer : 0.3;
            weather = weather != null ? weather : 0.3;
            if (historical < 0 || peer < 0 || weather < 0) {
                throw new IllegalArgumentException("detector weights must not be negative");
            }
            if (historical + peer + weather <= 0) {
                throw new IllegalArgumentException("at least one detector weight must be positive");
            }
        }

        public Map<DetectorType, Double> asMap() {
            Map<DetectorType, Double> map = new EnumMap<>(DetectorType.class);
            map.put(DetectorType.HISTORICAL, historical);
            map.put(DetectorType.PEER, peer);
            map.put(DetectorType.WEATHER, weather);
            return map;
        }
    }

    public record SeverityThresholds(Double warningThreshold, Double criticalThreshold) {
        public SeverityThresholds {
            warningThreshold = warningThreshold != null ? warningThreshold : 4.0;
            criticalThreshold = criticalThreshold != null ? criticalThreshold : 7.0;
            if (warningThreshold <= 0 || criticalThreshold > 10 || warningThreshold >= criticalThreshold) {
                throw new IllegalArgumentException(
                        "severity thresholds must satisfy 0 < warning < critical <= 10");
            }
        }
    }

    public record Peer(Integer minimumSampleSize, List<Integer> householdSizeBuckets,
                       Boolean fallbackToAllPropertyTypes) {
        public Peer {
            minimumSampleSize = minimumSampleSize != null ? minimumSampleSize : 5;
            if (minimumSampleSize < 2) {
                throw new IllegalArgumentException("minimumSampleSize must be at least 2");
            }
            householdSizeBuckets = householdSizeBuckets == null || householdSizeBuckets.isEmpty()
                    ? List.of(1, 2, 3, 4, 5)
                    : List.copyOf(householdSizeBuckets);
            if (householdSizeBuckets.get(0) != 1) {
                throw new IllegalArgumentException("householdSizeBuckets must start at 1");
            }
            for (int i = 1; i < householdSizeBuckets.size(); i++) {
                if (householdSizeBuckets.get(i) <= householdSizeBuckets.get(i - 1)) {
                    throw new IllegalArgumentException("householdSizeBuckets must be strictly ascending");
                }
            }
            fallbackToAllPropertyTypes = fallbackToAllPropertyTypes != null && fallbackToAllPropertyTypes;
        }
    }

    public record Weather(
            Duration stalenessWindow,
            Double baseTemperatureCelsius,
            String apiBaseUrl,
            Duration connectTimeout,
            Duration readTimeout,
            Double defaultKwhPerHdd,
            Double defaultBaseLoadKwh,
            Warmup warmup,
            Long maximumCacheSize
    ) {
        public Weather {
            stalenessWindow = stalenessWindow != null ? stalenessWindow : Duration.ofDays(30);
            baseTemperatureCelsius = baseTemperatureCelsius != null ? baseTemperatureCelsius : 18.0;
            apiBaseUrl = apiBaseUrl != null && !apiBaseUrl.isBlank()
                    ? apiBaseUrl
                    : "https://archive-api.open-meteo.com/v1/archive";
            connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
            readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(10);
            defaultKwhPerHdd = defaultKwhPerHdd != null ? defaultKwhPerHdd : 0.5;
            defaultBaseLoadKwh = defaultBaseLoadKwh != null ? defaultBaseLoadKwh : 2000.0;
            warmup = warmup != null ? warmup : new Warmup(null, null, null);
            maximumCacheSize = maximumCacheSize != null ? maximumCacheSize : 10_000L;
            if (maximumCacheSize <= 0) {
                throw new IllegalArgumentException("maximumCacheSize must be positive");
            }
            if (stalenessWindow.isNegative() || stalenessWindow.isZero()) {
                throw new IllegalArgumentException("stalenessWindow must be positive");
            }
            if (defaultKwhPerHdd < 0 || defaultBaseLoadKwh < 0) {
                throw new IllegalArgumentException("default consumption model must not be negative");
            }
        }
    }

    public record Warmup(Boolean enabled, List<String> postalCodes, List<Integer> years) {
        public Warmup {
            enabled = enabled != null && enabled;
            postalCodes = postalCodes != null ? List.copyOf(postalCodes) : List.of();
            years = years != null ? List.copyOf(years) : List.of();
        }
    }

    public record Batch(Integer parallelism) {
        public Batch {
            parallelism = parallelism != null ? parallelism : 4;
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
        }
    }
}
