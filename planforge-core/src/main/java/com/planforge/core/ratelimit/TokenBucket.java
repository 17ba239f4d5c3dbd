package com.planforge.core.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket for one caller.
 *
 * The bucket starts full at {@code capacity} tokens and refills continuously at {@code capacity} tokens per
 * {@code period}. Each request takes one token. Token counts are kept as fixed-point longs (scaled by
 * {@link #PRECISION}) so fractional refills accumulate without drift.
 */
public class TokenBucket {

    private static final long PRECISION = 1000L;

    private final String bucketId;
    private final double capacity;
    private final double refillPerNano;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();

    private long availableTokens;
    private long lastRefillNanos;

    public TokenBucket(String bucketId, int capacity, Duration period) {
        this(bucketId, capacity, period, System::nanoTime);
    }

    public TokenBucket(String bucketId, int capacity, Duration period, LongSupplier nanoClock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Bucket capacity must be at least 1, got " + capacity);
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Refill period must be positive, got " + period);
        }
        this.bucketId = bucketId;
        this.capacity = capacity;
        this.refillPerNano = capacity / (double) period.toNanos();
        this.nanoClock = nanoClock;
        this.availableTokens = capacity * PRECISION;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (availableTokens >= PRECISION) {
                availableTokens -= PRECISION;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Milliseconds until the next token is available; 0 if one is available now.
     */
    public long getWaitTimeMs() {
        lock.lock();
        try {
            refill();
            if (availableTokens >= PRECISION) {
                return 0;
            }
            double tokensNeeded = (PRECISION - availableTokens) / (double) PRECISION;
            double nanosToWait = tokensNeeded / refillPerNano;
            // +1 so callers never retry a hair too early
            return (long) (nanosToWait / 1_000_000.0) + 1;
        } finally {
            lock.unlock();
        }
    }

    public double getAvailableTokens() {
        lock.lock();
        try {
            refill();
            return availableTokens / (double) PRECISION;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFull() {
        return getAvailableTokens() >= capacity;
    }

    public String getBucketId() {
        return bucketId;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        long toAdd = (long) (elapsed * refillPerNano * PRECISION);
        if (toAdd > 0) {
            availableTokens = Math.min((long) (capacity * PRECISION), availableTokens + toAdd);
            lastRefillNanos = now;
        }
    }

    @Override
    public String toString() {
        return String.format("TokenBucket[%s: %.1f/%.0f tokens]", bucketId, getAvailableTokens(), capacity);
    }
}
