package com.energyadvisor.anomaly.weather;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.energyadvisor.anomaly.domain.model.WeatherRecord;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

/**
 * Heating degree day lookups backed by a process-wide Caffeine cache.
 *
 * CACHING STRATEGY:
 * - Records are reused while younger than the staleness window, measured from their fetch time
 * - A miss or an expired record triggers one fetch per (postal code, year); concurrent
 *   callers for the same key share the in-flight load instead of issuing their own
 * - Different keys are fetched independently
 * - When a fetch fails, the last-known record is served flagged as stale; without one
 *   the lookup is reported unavailable
 *
 * Lookups never throw for a failing weather source. Detectors treat an unavailable
 * lookup as missing evidence.
 *
 * WEATHER ADJUSTMENT:
 * The adjustment factor between two years is the ratio of their heating degree days,
 * so 1.08 means the first year needed 8% more heating. Consumption is normalized by
 * dividing by the factor and projected by multiplying with it.
 */
@Service
@Slf4j
public class WeatherNormalizer {

    private final HddFetcher fetcher;
    private final Clock clock;
    private final Duration stalenessWindow;

    private final AsyncCache<WeatherKey, WeatherRecord> cache;
    private final Cache<WeatherKey, WeatherRecord> lastKnown;

    public WeatherNormalizer(HddFetcher fetcher, Clock clock, AnomalyDetectionProperties properties) {
        this.fetcher = fetcher;
        this.clock = clock;
        this.stalenessWindow = properties.weather().stalenessWindow();
        long maximumSize = properties.weather().maximumCacheSize();

        Instant origin = clock.instant();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new FetchAgeExpiry())
                .ticker(() -> Duration.between(origin, clock.instant()).toNanos())
                .buildAsync();
        this.lastKnown = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * Heating degree days for a postal code and year.
     */
    public HddLookup getHdd(String postalCode, int year) {
        if (postalCode == null || postalCode.isBlank()) {
            return HddLookup.unavailable("postal code missing");
        }
        WeatherKey key = new WeatherKey(postalCode.trim(), year);

        try {
            return HddLookup.fresh(cache.get(key, this::load).join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            WeatherRecord last = lastKnown.getIfPresent(key);
            if (last != null) {
                log.warn("HDD fetch failed for {}/{}, serving stale value from {}",
                        key.postalCode(), year, last.fetchedAt());
                return HddLookup.stale(last);
            }
            log.warn("HDD unavailable for {}/{}: {}", key.postalCode(), year, cause.getMessage());
            return HddLookup.unavailable(cause.getMessage());
        }
    }

    /**
     * Ratio of heating degree days of {@code currentYear} to {@code previousYear},
     * rounded to three decimals.
     *
     * @return empty when either year has no weather data or the previous year had no heating demand
     */
    public Optional<Double> adjustmentFactor(String postalCode, int currentYear, int previousYear) {
        HddLookup current = getHdd(postalCode, currentYear);
        HddLookup previous = getHdd(postalCode, previousYear);
        if (!current.available() || !previous.available() || previous.hdd() <= 0) {
            log.debug("No weather adjustment for {} between {} and {}", postalCode, currentYear, previousYear);
            return Optional.empty();
        }
        return Optional.of(round(current.hdd() / previous.hdd(), 3));
    }

    /**
     * What {@code actualKwh} consumed in {@code actualYear} would have been under the
     * weather of {@code baselineYear}.
     */
    public Optional<Double> normalizedConsumption(double actualKwh, String postalCode,
                                                  int actualYear, int baselineYear) {
        return adjustmentFactor(postalCode, actualYear, baselineYear)
                .filter(factor -> factor > 0)
                .map(factor -> round(actualKwh / factor, 2));
    }

    /**
     * Consumption expected in {@code targetYear} for a household that consumed
     * {@code baselineKwh} in {@code baselineYear}, scaled by the weather difference.
     */
    public Optional<Double> expectedWithWeather(double baselineKwh, String postalCode,
                                                int baselineYear, int targetYear) {
        return adjustmentFactor(postalCode, targetYear, baselineYear)
                .map(factor -> round(baselineKwh * factor, 2));
    }

    /**
     * Warm the cache for every combination of postal code and year.
     *
     * @return number of combinations that ended with a usable value
     */
    public int prefetch(Collection<String> postalCodes, Collection<Integer> years) {
        int available = 0;
        for (String postalCode : postalCodes) {
            for (Integer year : years) {
                if (getHdd(postalCode, year).available()) {
                    available++;
                }
            }
        }
        log.info("Weather prefetch complete: {}/{} lookups available",
                available, postalCodes.size() * years.size());
        return available;
    }

    public Optional<WeatherRecord> cachedRecord(String postalCode, int year) {
        return Optional.ofNullable(lastKnown.getIfPresent(new WeatherKey(postalCode.trim(), year)));
    }

    public void invalidate(String postalCode, int year) {
        WeatherKey key = new WeatherKey(postalCode.trim(), year);
        cache.synchronous().invalidate(key);
        lastKnown.invalidate(key);
        log.debug("Invalidated cached HDD for {}/{}", key.postalCode(), year);
    }

    /**
     * Drop every cached year of one postal code.
     *
     * @return number of records removed
     */
    public int invalidate(String postalCode) {
        String trimmed = postalCode.trim();
        int count = invalidateMatching(key -> key.postalCode().equals(trimmed));
        log.info("Cleared {} weather cache entries for postal code {}", count, trimmed);
        return count;
    }

    /**
     * Drop every cached postal code of one year.
     *
     * @return number of records removed
     */
    public int invalidateYear(int year) {
        int count = invalidateMatching(key -> key.year() == year);
        log.info("Cleared {} weather cache entries for {}", count, year);
        return count;
    }

    public int invalidateAll() {
        int count = lastKnown.asMap().size();
        cache.synchronous().invalidateAll();
        lastKnown.invalidateAll();
        log.info("Cleared {} weather cache entries", count);
        return count;
    }

    private int invalidateMatching(Predicate<WeatherKey> matches) {
        List<WeatherKey> keys = lastKnown.asMap().keySet().stream()
                .filter(matches)
                .toList();
        cache.asMap().keySet().removeIf(matches);
        lastKnown.invalidateAll(keys);
        return keys.size();
    }

    private WeatherRecord load(WeatherKey key) {
        log.info("Fetching HDD for {}/{}", key.postalCode(), key.year());
        try {
            double hdd = fetcher.fetchHdd(key.postalCode(), key.year());
            WeatherRecord record = new WeatherRecord(key.postalCode(), key.year(), hdd, clock.instant());
            lastKnown.put(key, record);
            return record;
        } catch (HddFetchException e) {
            throw new CompletionException(e);
        }
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Expires a record once its fetch time is older than the staleness window, however
     * late the cache learns about the completed load.
     */
    private final class FetchAgeExpiry implements Expiry<WeatherKey, WeatherRecord> {

        @Override
        public long expireAfterCreate(WeatherKey key, WeatherRecord record, long currentTime) {
            return remainingNanos(record);
        }

        @Override
        public long expireAfterUpdate(WeatherKey key, WeatherRecord record, long currentTime,
                                      long currentDuration) {
            return remainingNanos(record);
        }

        @Override
        public long expireAfterRead(WeatherKey key, WeatherRecord record, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(WeatherRecord record) {
            Duration remaining = Duration.between(clock.instant(), record.fetchedAt().plus(stalenessWindow));
            return remaining.isNegative() ? 0 : remaining.toNanos();
        }
    }

    private record WeatherKey(String postalCode, int year) {}
}
