package com.openrangelabs.blacklist.collector.ratelimit;

import com.openrangelabs.blacklist.collector.model.RateLimitStatus;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket with lazy refill and FIFO reservations.
 *
 * <p>A caller that cannot be served immediately reserves the next future token,
 * driving the balance negative. Waiters are therefore granted in arrival order
 * and no grant is ever lost between concurrent callers.
 *
 * <p>The refill rate adapts to the remote side: {@link #slowDown()} halves it, down to a
 * quarter of the configured rate, and every {@value #RECOVERY_STREAK} successes in a row
 * raise it by a fifth until the configured rate is reached again.
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    static final double MIN_RATE_FACTOR = 0.25;
    static final int RECOVERY_STREAK = 10;

    private final int capacity;
    private final double refillPerSecond;
    private final double minRefillPerSecond;
    private final LongSupplier nanoTime;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private double currentRefillPerSecond;
    private int successStreak;
    private long lastRefillNanos;
    private long granted;
    private long timedOut;

    public TokenBucket(int capacity, double refillPerSecond, LongSupplier nanoTime) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("refillPerSecond must be positive");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.minRefillPerSecond = refillPerSecond * MIN_RATE_FACTOR;
        this.currentRefillPerSecond = refillPerSecond;
        this.nanoTime = nanoTime;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    /**
     * Takes a token if one is available right now.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                granted++;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserves a token and returns how long the caller must wait before using it.
     *
     * @param maxWait longest acceptable wait
     * @return the wait, or {@code null} when it would exceed {@code maxWait}; nothing is reserved then
     */
    public Duration reserve(Duration maxWait) {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                granted++;
                return Duration.ZERO;
            }
            long waitNanos = (long) Math.ceil((1.0 - tokens) / currentRefillPerSecond * NANOS_PER_SECOND);
            if (waitNanos > maxWait.toNanos()) {
                timedOut++;
                return null;
            }
            tokens -= 1.0;
            granted++;
            return Duration.ofNanos(waitNanos);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Halves the refill rate after the remote side signalled overload.
     *
     * @return the new rate
     */
    public double slowDown() {
        lock.lock();
        try {
            refill();
            successStreak = 0;
            currentRefillPerSecond = Math.max(minRefillPerSecond, currentRefillPerSecond * 0.5);
            return currentRefillPerSecond;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts a request the remote side accepted, recovering the rate after a streak.
     */
    public void recordSuccess() {
        lock.lock();
        try {
            if (currentRefillPerSecond >= refillPerSecond) {
                return;
            }
            if (++successStreak >= RECOVERY_STREAK) {
                refill();
                successStreak = 0;
                currentRefillPerSecond = Math.min(refillPerSecond, currentRefillPerSecond * 1.2);
            }
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatus status() {
        lock.lock();
        try {
            refill();
            return new RateLimitStatus(capacity, Math.max(tokens, 0.0), currentRefillPerSecond, refillPerSecond,
                    granted, timedOut);
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    public double getCurrentRefillPerSecond() {
        lock.lock();
        try {
            return currentRefillPerSecond;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed / NANOS_PER_SECOND * currentRefillPerSecond);
            lastRefillNanos = now;
        }
    }
}
