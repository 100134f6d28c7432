package com.bko.stravacache.ratelimit;

import com.bko.stravacache.integrations.strava.UpstreamRateLimit;
import com.bko.stravacache.shared.RateLimitSettings;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitTrackerTest {
    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Test
    void recordsRequestsInBothWindows() {
        RateLimitTracker tracker = new RateLimitTracker(RateLimitSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

        tracker.recordRequest();
        tracker.recordRequest();

        RateLimitState state = tracker.getInfo();
        assertEquals(2, state.shortWindowCount());
        assertEquals(2, state.longWindowCount());
        assertEquals(98, state.shortWindowRemaining());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), state.shortWindowResetAt());
        assertEquals(NOW.plus(Duration.ofDays(1)), state.longWindowResetAt());
    }

    @Test
    void shortWindowRollsOverIndependently() {
        MutableClock clock = new MutableClock(NOW);
        RateLimitTracker tracker = new RateLimitTracker(RateLimitSettings.defaults(), clock);
        for (int i = 0; i < 10; i++) {
            tracker.recordRequest();
        }

        clock.advance(Duration.ofMinutes(16));
        RateLimitState state = tracker.getInfo();

        assertEquals(0, state.shortWindowCount());
        assertEquals(10, state.longWindowCount());
        assertTrue(state.shortWindowResetAt().isAfter(clock.instant()));
    }

    @Test
    void nearLimitAtSafetyMargin() {
        RateLimitState seed = new RateLimitState(89, NOW.plusSeconds(600), 100, NOW.plusSeconds(3600), 100, 1000);
        RateLimitTracker tracker = RateLimitTracker.seeded(seed, RateLimitSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(tracker.isNearLimit().canMakeRequest());
        tracker.recordRequest();

        RateLimitCheck check = tracker.isNearLimit();
        assertFalse(check.canMakeRequest());
        assertTrue(check.reason().startsWith("Short-term rate limit nearly exhausted (90/100"));
    }

    @Test
    void dailyWindowRefusesToo() {
        RateLimitState seed = new RateLimitState(0, NOW.plusSeconds(600), 900, NOW.plusSeconds(3600), 100, 1000);
        RateLimitTracker tracker = RateLimitTracker.seeded(seed, RateLimitSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

        RateLimitCheck check = tracker.isNearLimit();
        assertFalse(check.canMakeRequest());
        assertTrue(check.reason().startsWith("Daily rate limit nearly exhausted"));
    }

    @Test
    void reservationsCountTowardsTheLimit() {
        RateLimitState seed = new RateLimitState(87, NOW.plusSeconds(600), 87, NOW.plusSeconds(3600), 100, 1000);
        RateLimitTracker tracker = RateLimitTracker.seeded(seed, RateLimitSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(tracker.tryReserve(2));
        assertFalse(tracker.tryReserve(2));
        assertTrue(tracker.tryReserve(1));
        assertFalse(tracker.isNearLimit().canMakeRequest());

        tracker.completeReserved(true);
        tracker.completeReserved(true);
        tracker.releaseReserved(1);

        assertEquals(89, tracker.getInfo().shortWindowCount());
        assertTrue(tracker.tryReserve(1));
        assertThrows(IllegalArgumentException.class, () -> tracker.tryReserve(0));
    }

    @Test
    void failedRequestsAreFreeWhenConfigured() {
        RateLimitSettings settings = new RateLimitSettings(100, Duration.ofMinutes(15), 1000, Duration.ofDays(1), 0.9, false);
        RateLimitTracker tracker = new RateLimitTracker(settings, Clock.fixed(NOW, ZoneOffset.UTC));

        tracker.recordFailedRequest();
        assertTrue(tracker.tryReserve(1));
        tracker.completeReserved(false);

        assertEquals(0, tracker.getInfo().shortWindowCount());
    }

    @Test
    void upstreamUsageOnlyMovesCountsUp() {
        RateLimitTracker tracker = new RateLimitTracker(RateLimitSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        for (int i = 0; i < 5; i++) {
            tracker.recordRequest();
        }

        tracker.onUpstreamRateLimit(new UpstreamRateLimit(3, 420, 200, null));

        RateLimitState state = tracker.getInfo();
        assertEquals(5, state.shortWindowCount());
        assertEquals(420, state.longWindowCount());
        assertEquals(200, state.shortWindowLimit());
        assertEquals(1000, state.longWindowLimit());
    }

    @Test
    void rejectsInvalidSafetyRatio() {
        RateLimitSettings settings = new RateLimitSettings(100, Duration.ofMinutes(15), 1000, Duration.ofDays(1), 0, true);
        assertThrows(IllegalArgumentException.class, () -> new RateLimitTracker(settings, Clock.systemUTC()));
    }

    @Test
    void concurrentRecordsAreNotLost() throws Exception {
        RateLimitTracker tracker = new RateLimitTracker(
                new RateLimitSettings(100_000, Duration.ofMinutes(15), 100_000, Duration.ofDays(1), 0.9, true),
                Clock.fixed(NOW, ZoneOffset.UTC));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<java.util.concurrent.Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    tracker.recordRequest();
                }
                return null;
            }));
        }
        start.countDown();
        for (java.util.concurrent.Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(4000, tracker.getInfo().shortWindowCount());
        assertEquals(4000, tracker.getInfo().longWindowCount());
    }

    static final class MutableClock extends Clock {
        private Instant now;

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
