package com.leasedesk.showing.matching.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket shared by all invocations.
 *
 * The bucket starts full with {@code capacity} tokens and gains one token per
 * {@code refillInterval}, never holding more than {@code capacity}.
 */
@Slf4j
public class TokenBucketRateLimiter {

    /**
     * Blocking wait used between refill checks.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int capacity;
    private final long refillNanos;
    private final Clock clock;
    private final Sleeper sleeper;

    private double tokens;
    private Instant lastRefill;

    public TokenBucketRateLimiter(int capacity, Duration refillInterval, Clock clock) {
        this(capacity, refillInterval, clock, duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000));
    }

    public TokenBucketRateLimiter(int capacity, Duration refillInterval, Clock clock, Sleeper sleeper) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be positive: " + refillInterval);
        }
        this.capacity = capacity;
        this.refillNanos = refillInterval.toNanos();
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /**
     * Takes a token, waiting for one if the bucket is empty.
     *
     * @param deadline give up when no token can be had by this instant
     * @throws RateLimitExceededException the deadline would pass first, or the thread was interrupted
     */
    public void acquire(Instant deadline) {
        while (true) {
            Duration wait;
            synchronized (this) {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    return;
                }
                wait = Duration.ofNanos((long) Math.ceil((1 - tokens) * refillNanos));
            }

            Instant now = clock.instant();
            if (now.plus(wait).isAfter(deadline)) {
                log.warn("Rate limit wait exceeds deadline: wait={}ms, deadline={}", wait.toMillis(), deadline);
                throw new RateLimitExceededException("rate limited: no token before " + deadline);
            }

            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitExceededException("rate limited: wait interrupted", e);
            }
        }
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsed = Duration.between(lastRefill, now).toNanos();
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + (double) elapsed / refillNanos);
            lastRefill = now;
        }
    }
}
