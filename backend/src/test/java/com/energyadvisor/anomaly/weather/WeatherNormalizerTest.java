package com.energyadvisor.anomaly.weather;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for WeatherNormalizer.
 *
 * Test strategy:
 * 1. Serve fresh values from the cache and refetch stale ones
 * 2. Degrade to the last-known value when a refresh fails
 * 3. Coalesce concurrent fetches of the same key into one
 * 4. Derive weather adjustment factors from cached heating degree days
 */
@ExtendWith(MockitoExtension.class)
class WeatherNormalizerTest {

    private static final String BERLIN = "10115";
    private static final String MUNICH = "80331";

    @Mock
    private HddFetcher fetcher;

    private MutableClock clock;
    private WeatherNormalizer normalizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        normalizer = new WeatherNormalizer(fetcher, clock, AnomalyDetectionProperties.defaults());
    }

    @Nested
    @DisplayName("Caching Tests")
    class CachingTests {

        @Test
        @DisplayName("Should fetch once and serve the cached value afterwards")
        void shouldServeFromCache() throws Exception {
            // Given
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3100.0);

            // When
            var first = normalizer.getHdd(BERLIN, 2023);
            clock.advance(Duration.ofDays(29));
            var second = normalizer.getHdd(BERLIN, 2023);

            // Then
            assertThat(first.hdd()).isEqualTo(3100.0);
            assertThat(second.hdd()).isEqualTo(3100.0);
            assertThat(second.stale()).isFalse();
            verify(fetcher, times(1)).fetchHdd(BERLIN, 2023);
        }

        @Test
        @DisplayName("Should refetch once the staleness window has passed")
        void shouldRefetchStaleRecord() throws Exception {
            // Given
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3100.0, 3150.0);

            // When
            normalizer.getHdd(BERLIN, 2023);
            clock.advance(Duration.ofDays(31));
            var refreshed = normalizer.getHdd(BERLIN, 2023);

            // Then
            assertThat(refreshed.hdd()).isEqualTo(3150.0);
            assertThat(refreshed.record().fetchedAt()).isEqualTo(clock.instant());
            verify(fetcher, times(2)).fetchHdd(BERLIN, 2023);
        }

        @Test
        @DisplayName("Should fetch different keys independently")
        void shouldFetchKeysIndependently() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3100.0);
            when(fetcher.fetchHdd("80331", 2023)).thenReturn(3600.0);

            assertThat(normalizer.getHdd(BERLIN, 2023).hdd()).isEqualTo(3100.0);
            assertThat(normalizer.getHdd("80331", 2023).hdd()).isEqualTo(3600.0);
        }

        @Test
        @DisplayName("Should refetch after invalidation")
        void shouldRefetchAfterInvalidate() throws Exception {
            // Given
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3100.0);
            normalizer.getHdd(BERLIN, 2023);

            // When
            normalizer.invalidate(BERLIN, 2023);
            normalizer.getHdd(BERLIN, 2023);

            // Then
            verify(fetcher, times(2)).fetchHdd(BERLIN, 2023);
        }

        @Test
        @DisplayName("Should clear every entry and report how many were removed")
        void shouldInvalidateAll() throws Exception {
            when(fetcher.fetchHdd(anyString(), anyInt())).thenReturn(3000.0);
            normalizer.getHdd(BERLIN, 2022);
            normalizer.getHdd(BERLIN, 2023);

            assertThat(normalizer.invalidateAll()).isEqualTo(2);
            assertThat(normalizer.cachedRecord(BERLIN, 2023)).isEmpty();
        }

        @Test
        @DisplayName("Should clear only the entries of one postal code")
        void shouldInvalidatePostalCode() throws Exception {
            // Given
            when(fetcher.fetchHdd(anyString(), anyInt())).thenReturn(3000.0);
            normalizer.prefetch(List.of(BERLIN, MUNICH), List.of(2022, 2023));

            // When
            int cleared = normalizer.invalidate(BERLIN);
            normalizer.getHdd(MUNICH, 2023);

            // Then
            assertThat(cleared).isEqualTo(2);
            assertThat(normalizer.cachedRecord(BERLIN, 2022)).isEmpty();
            assertThat(normalizer.cachedRecord(MUNICH, 2022)).isPresent();
            verify(fetcher, times(1)).fetchHdd(MUNICH, 2023);
        }

        @Test
        @DisplayName("Should clear only the entries of one year")
        void shouldInvalidateYear() throws Exception {
            // Given
            when(fetcher.fetchHdd(anyString(), anyInt())).thenReturn(3000.0);
            normalizer.prefetch(List.of(BERLIN, MUNICH), List.of(2022, 2023));

            // When
            int cleared = normalizer.invalidateYear(2022);
            normalizer.getHdd(BERLIN, 2022);

            // Then
            assertThat(cleared).isEqualTo(2);
            assertThat(normalizer.cachedRecord(MUNICH, 2022)).isEmpty();
            assertThat(normalizer.cachedRecord(MUNICH, 2023)).isPresent();
            verify(fetcher, times(2)).fetchHdd(BERLIN, 2022);
        }
    }

    @Nested
    @DisplayName("Weather Adjustment Tests")
    class AdjustmentTests {

        @Test
        @DisplayName("Should compute the heating demand ratio between two years")
        void shouldComputeAdjustmentFactor() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3300.0);
            when(fetcher.fetchHdd(BERLIN, 2022)).thenReturn(3000.0);

            assertThat(normalizer.adjustmentFactor(BERLIN, 2023, 2022)).contains(1.1);
            assertThat(normalizer.adjustmentFactor(BERLIN, 2022, 2023)).contains(0.909);
        }

        @Test
        @DisplayName("Should normalize consumption of a colder year down to the baseline weather")
        void shouldNormalizeConsumption() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3300.0);
            when(fetcher.fetchHdd(BERLIN, 2022)).thenReturn(3000.0);

            var normalized = normalizer.normalizedConsumption(3300.0, BERLIN, 2023, 2022);

            assertThat(normalized).contains(3000.0);
        }

        @Test
        @DisplayName("Should scale a baseline consumption to the weather of the target year")
        void shouldProjectExpectedConsumption() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3300.0);
            when(fetcher.fetchHdd(BERLIN, 2022)).thenReturn(3000.0);

            var expected = normalizer.expectedWithWeather(3000.0, BERLIN, 2022, 2023);

            assertThat(expected).contains(3300.0);
        }

        @Test
        @DisplayName("Should have no adjustment when a year lacks weather data")
        void shouldBeEmptyWithoutWeather() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3300.0);
            when(fetcher.fetchHdd(BERLIN, 2022)).thenThrow(new HddFetchException("service down"));

            assertThat(normalizer.adjustmentFactor(BERLIN, 2023, 2022)).isEmpty();
            assertThat(normalizer.normalizedConsumption(3300.0, BERLIN, 2023, 2022)).isEmpty();
            assertThat(normalizer.expectedWithWeather(3000.0, BERLIN, 2022, 2023)).isEmpty();
        }

        @Test
        @DisplayName("Should have no adjustment against a year without heating demand")
        void shouldBeEmptyForZeroBaseline() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenReturn(3300.0);
            when(fetcher.fetchHdd(BERLIN, 2022)).thenReturn(0.0);

            assertThat(normalizer.adjustmentFactor(BERLIN, 2023, 2022)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Degraded Mode Tests")
    class DegradedModeTests {

        @Test
        @DisplayName("Should serve the last-known value flagged stale when a refresh fails")
        void shouldServeStaleOnFailure() throws Exception {
            // Given
            when(fetcher.fetchHdd(BERLIN, 2023))
                    .thenReturn(3100.0)
                    .thenThrow(new HddFetchException("timeout"));
            normalizer.getHdd(BERLIN, 2023);
            clock.advance(Duration.ofDays(45));

            // When
            var lookup = normalizer.getHdd(BERLIN, 2023);

            // Then
            assertThat(lookup.available()).isTrue();
            assertThat(lookup.stale()).isTrue();
            assertThat(lookup.hdd()).isEqualTo(3100.0);
        }

        @Test
        @DisplayName("Should report unavailability without throwing when nothing is cached")
        void shouldReportUnavailable() throws Exception {
            // Given
            when(fetcher.fetchHdd(BERLIN, 2023)).thenThrow(new HddFetchException("service down"));

            // When
            var lookup = normalizer.getHdd(BERLIN, 2023);

            // Then
            assertThat(lookup.available()).isFalse();
            assertThat(lookup.failureReason()).isEqualTo("service down");
        }

        @Test
        @DisplayName("Should treat unexpected fetcher errors as unavailability")
        void shouldContainRuntimeFailures() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenThrow(new IllegalStateException("bad payload"));

            var lookup = normalizer.getHdd(BERLIN, 2023);

            assertThat(lookup.available()).isFalse();
        }

        @Test
        @DisplayName("Should propagate fatal errors of the weather source")
        void shouldPropagateErrors() throws Exception {
            when(fetcher.fetchHdd(BERLIN, 2023)).thenThrow(new LinkageError("broken client"));

            assertThatThrownBy(() -> normalizer.getHdd(BERLIN, 2023))
                    .isInstanceOf(LinkageError.class)
                    .hasMessage("broken client");
        }

        @Test
        @DisplayName("Should not call the weather source without a postal code")
        void shouldRejectBlankPostalCode() throws Exception {
            var lookup = normalizer.getHdd(" ", 2023);

            assertThat(lookup.available()).isFalse();
            verify(fetcher, never()).fetchHdd(anyString(), anyInt());
        }

        @Test
        @DisplayName("Should count available lookups when prefetching")
        void shouldPrefetch() throws Exception {
            when(fetcher.fetchHdd(anyString(), anyInt())).thenReturn(3000.0);
            when(fetcher.fetchHdd("99999", 2023)).thenThrow(new HddFetchException("unknown region"));

            int available = normalizer.prefetch(List.of(BERLIN, "99999"), List.of(2022, 2023));

            assertThat(available).isEqualTo(3);
            assertThat(normalizer.cachedRecord(BERLIN, 2022)).isPresent();
        }
    }

    @Nested
    @DisplayName("Coalescing Tests")
    class CoalescingTests {

        private ExecutorService callers;

        @BeforeEach
        void startCallers() {
            callers = Executors.newFixedThreadPool(8);
        }

        @AfterEach
        void stopCallers() {
            callers.shutdownNow();
        }

        @Test
        @DisplayName("Should issue a single fetch for concurrent callers of the same key")
        void shouldCoalesceConcurrentFetches() throws Exception {
            // Given: a slow weather source
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch fetchStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            HddFetcher slowFetcher = (postalCode, year) -> {
                calls.incrementAndGet();
                fetchStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 3200.0;
            };
            var coalescing = new WeatherNormalizer(slowFetcher, clock, AnomalyDetectionProperties.defaults());

            // When
            List<Future<HddLookup>> lookups = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                lookups.add(callers.submit(() -> coalescing.getHdd(BERLIN, 2024)));
            }
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            release.countDown();

            // Then
            for (Future<HddLookup> lookup : lookups) {
                assertThat(lookup.get(5, TimeUnit.SECONDS).hdd()).isEqualTo(3200.0);
            }
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @Timeout(10)
        @DisplayName("Should release every waiting caller when the shared fetch dies with an error")
        void shouldReleaseWaitersOnError() throws Exception {
            // Given: a slow weather source that fails fatally
            CountDownLatch fetchStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            HddFetcher failingFetcher = (postalCode, year) -> {
                fetchStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new LinkageError("broken client");
            };
            var failing = new WeatherNormalizer(failingFetcher, clock, AnomalyDetectionProperties.defaults());

            // When
            List<Future<HddLookup>> lookups = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                lookups.add(callers.submit(() -> failing.getHdd(BERLIN, 2024)));
            }
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            // Then
            for (Future<HddLookup> lookup : lookups) {
                assertThatThrownBy(() -> lookup.get(5, TimeUnit.SECONDS))
                        .isInstanceOf(ExecutionException.class)
                        .hasCauseInstanceOf(LinkageError.class);
            }
        }
    }

    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
