package com.energyadvisor.anomaly.scheduler;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.weather.WeatherNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Scheduled job to keep the weather cache warm for frequently evaluated regions.
 *
 * Runs nightly and prefetches heating degree days for the configured postal codes.
 * Without configured years the last three completed years are fetched.
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.weather.warmup", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class WeatherCacheWarmupJob {

    private static final int DEFAULT_YEARS = 3;

    private final WeatherNormalizer weatherNormalizer;
    private final AnomalyDetectionProperties properties;
    private final Clock clock;

    /**
     * Run warmup daily at 3 AM unless configured otherwise.
     */
    @Scheduled(cron = "${anomaly.weather.warmup.cron:0 0 3 * * *}")
    public void warmCache() {
        AnomalyDetectionProperties.Warmup warmup = properties.weather().warmup();
        if (warmup.postalCodes().isEmpty()) {
            log.info("Weather warmup skipped: no postal codes configured");
            return;
        }
        List<Integer> years = yearsToFetch();
        log.info("Starting weather warmup for {} postal codes and years {}", warmup.postalCodes().size(), years);

        int available = weatherNormalizer.prefetch(warmup.postalCodes(), years);
        int requested = warmup.postalCodes().size() * years.size();
        if (available < requested) {
            log.warn("Weather warmup incomplete: {} of {} lookups unavailable", requested - available, requested);
        }
    }

    List<Integer> yearsToFetch() {
        List<Integer> configured = properties.weather().warmup().years();
        if (!configured.isEmpty()) {
            return configured;
        }
        int lastCompleted = LocalDate.now(clock).getYear() - 1;
        return IntStream.rangeClosed(lastCompleted - DEFAULT_YEARS + 1, lastCompleted).boxed().toList();
    }
}
