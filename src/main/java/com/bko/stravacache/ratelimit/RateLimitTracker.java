package com.bko.stravacache.ratelimit;

import com.bko.stravacache.integrations.strava.RateLimitListener;
import com.bko.stravacache.integrations.strava.UpstreamRateLimit;
import com.bko.stravacache.shared.AppSettings;
import com.bko.stravacache.shared.RateLimitSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide bookkeeping of upstream request consumption over a short and a long window.
 * <p>
 * Every read and write goes through one monitor, so concurrent workers never lose an increment.
 * Callers that schedule work concurrently reserve quota with {@link #tryReserve(int)} before a call
 * and settle it with {@link #completeReserved(boolean)} afterwards; outstanding reservations count
 * as usage in {@link #isNearLimit()}.
 */
@Component
public class RateLimitTracker implements RateLimitListener {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitTracker.class);

    private final Duration shortWindow;
    private final Duration longWindow;
    private final double safetyRatio;
    private final boolean countFailedRequests;
    private final Clock clock;

    private int shortWindowLimit;
    private int longWindowLimit;
    private int shortWindowCount;
    private int longWindowCount;
    private Instant shortWindowResetAt;
    private Instant longWindowResetAt;
    private int reserved;

    @Autowired
    public RateLimitTracker(AppSettings settings, Clock clock) {
        this(settings.rateLimit(), clock);
    }

    public RateLimitTracker(RateLimitSettings settings, Clock clock) {
        this(settings, clock, null);
    }

    private RateLimitTracker(RateLimitSettings settings, Clock clock, RateLimitState initial) {
        if (settings.safetyRatio() <= 0 || settings.safetyRatio() > 1) {
            throw new IllegalArgumentException("safetyRatio must be in (0, 1], got " + settings.safetyRatio());
        }
        this.shortWindow = settings.shortWindow();
        this.longWindow = settings.longWindow();
        this.safetyRatio = settings.safetyRatio();
        this.countFailedRequests = settings.countFailedRequests();
        this.clock = clock;

        Instant now = clock.instant();
        if (initial == null) {
            this.shortWindowLimit = settings.shortWindowLimit();
            this.longWindowLimit = settings.longWindowLimit();
            this.shortWindowResetAt = now.plus(shortWindow);
            this.longWindowResetAt = now.plus(longWindow);
        } else {
            this.shortWindowLimit = initial.shortWindowLimit();
            this.longWindowLimit = initial.longWindowLimit();
            this.shortWindowCount = initial.shortWindowCount();
            this.longWindowCount = initial.longWindowCount();
            this.shortWindowResetAt = initial.shortWindowResetAt();
            this.longWindowResetAt = initial.longWindowResetAt();
        }
    }

    /**
     * Creates a tracker that starts from an arbitrary window state, e.g. one restored after a restart.
     */
    public static RateLimitTracker seeded(RateLimitState state, RateLimitSettings settings, Clock clock) {
        return new RateLimitTracker(settings, clock, state);
    }

    public synchronized void recordRequest() {
        rollover();
        shortWindowCount++;
        longWindowCount++;
    }

    /**
     * Records a call that failed upstream. Counted unless failed calls are configured as free.
     */
    public synchronized void recordFailedRequest() {
        if (countFailedRequests) {
            recordRequest();
        }
    }

    public synchronized RateLimitState getInfo() {
        rollover();
        return new RateLimitState(shortWindowCount, shortWindowResetAt, longWindowCount, longWindowResetAt,
                shortWindowLimit, longWindowLimit);
    }

    public synchronized RateLimitCheck isNearLimit() {
        rollover();
        int shortUsed = shortWindowCount + reserved;
        int longUsed = longWindowCount + reserved;
        if (shortUsed >= usable(shortWindowLimit)) {
            return RateLimitCheck.refused("Short-term rate limit nearly exhausted (" + shortUsed + "/" + shortWindowLimit
                    + " used, resets at " + shortWindowResetAt + ")");
        }
        if (longUsed >= usable(longWindowLimit)) {
            return RateLimitCheck.refused("Daily rate limit nearly exhausted (" + longUsed + "/" + longWindowLimit
                    + " used, resets at " + longWindowResetAt + ")");
        }
        return RateLimitCheck.allowed();
    }

    /**
     * Reserves {@code calls} upstream calls if they fit below the safety margin of both windows.
     */
    public synchronized boolean tryReserve(int calls) {
        if (calls < 1) {
            throw new IllegalArgumentException("calls must be positive, got " + calls);
        }
        rollover();
        if (shortWindowCount + reserved + calls > usable(shortWindowLimit)
                || longWindowCount + reserved + calls > usable(longWindowLimit)) {
            return false;
        }
        reserved += calls;
        return true;
    }

    /**
     * Settles one reserved call that was issued upstream.
     */
    public synchronized void completeReserved(boolean succeeded) {
        reserved = Math.max(0, reserved - 1);
        if (succeeded) {
            recordRequest();
        } else {
            recordFailedRequest();
        }
    }

    /**
     * Returns reserved calls that were never issued.
     */
    public synchronized void releaseReserved(int calls) {
        reserved = Math.max(0, reserved - calls);
    }

    /**
     * Reconciles with the usage Strava reports. Counts only move up, so local bookkeeping of calls the
     * upstream has not reported yet is kept.
     */
    @Override
    public synchronized void onUpstreamRateLimit(UpstreamRateLimit rateLimit) {
        rollover();
        shortWindowCount = Math.max(shortWindowCount, rateLimit.shortWindowUsage());
        longWindowCount = Math.max(longWindowCount, rateLimit.longWindowUsage());
        if (rateLimit.shortWindowLimit() != null) {
            shortWindowLimit = rateLimit.shortWindowLimit();
        }
        if (rateLimit.longWindowLimit() != null) {
            longWindowLimit = rateLimit.longWindowLimit();
        }
        logger.debug("Upstream usage {}/{} short, {}/{} daily", shortWindowCount, shortWindowLimit,
                longWindowCount, longWindowLimit);
    }

    private int usable(int limit) {
        return (int) Math.floor(limit * safetyRatio);
    }

    private void rollover() {
        Instant now = clock.instant();
        if (!now.isBefore(shortWindowResetAt)) {
            shortWindowCount = 0;
            shortWindowResetAt = advance(shortWindowResetAt, shortWindow, now);
        }
        if (!now.isBefore(longWindowResetAt)) {
            longWindowCount = 0;
            longWindowResetAt = advance(longWindowResetAt, longWindow, now);
        }
    }

    private static Instant advance(Instant resetAt, Duration window, Instant now) {
        long elapsedWindows = Duration.between(resetAt, now).toMillis() / window.toMillis() + 1;
        return resetAt.plus(window.multipliedBy(elapsedWindows));
    }
}
