package com.planforge.core.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Per-user limit on generation requests, checked before any attempt is reserved.
 *
 * State is held by the instance. Spring creates one per application context; tests create their own.
 * Once more users than the eviction threshold are tracked, full buckets are swept out at most once a minute.
 */
@Component
@Slf4j
public class GenerationRateLimiter {

    public static final int DEFAULT_REQUESTS_PER_HOUR = 10;
    private static final int EVICTION_THRESHOLD = 10_000;
    private static final long SWEEP_INTERVAL_NANOS = Duration.ofMinutes(1).toNanos();

    private final int requestsPerHour;
    private final LongSupplier nanoClock;
    private final int evictionThreshold;
    private final AtomicLong lastSweepNanos;
    private final Map<UUID, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public GenerationRateLimiter(@Value("${planforge.rate-limit.generation.requests-per-hour:10}") int requestsPerHour) {
        this(requestsPerHour, System::nanoTime);
    }

    public GenerationRateLimiter(int requestsPerHour, LongSupplier nanoClock) {
        this(requestsPerHour, nanoClock, EVICTION_THRESHOLD);
    }

    GenerationRateLimiter(int requestsPerHour, LongSupplier nanoClock, int evictionThreshold) {
        if (requestsPerHour < 1) {
            throw new IllegalArgumentException("requests-per-hour must be at least 1, got " + requestsPerHour);
        }
        this.requestsPerHour = requestsPerHour;
        this.nanoClock = nanoClock;
        this.evictionThreshold = evictionThreshold;
        this.lastSweepNanos = new AtomicLong(nanoClock.getAsLong());
    }

    /**
     * Takes one request from the user's budget.
     *
     * @throws RateLimitExceededException when the budget is exhausted
     */
    public void checkAndConsume(UUID userId) {
        if (buckets.size() > evictionThreshold) {
            sweepIfDue();
        }
        TokenBucket bucket = buckets.computeIfAbsent(userId,
            id -> new TokenBucket("user-" + id, requestsPerHour, Duration.ofHours(1), nanoClock));
        if (bucket.tryAcquire()) {
            return;
        }
        long retryAfterSeconds = Math.max(1, (bucket.getWaitTimeMs() + 999) / 1000);
        log.warn("[RATE_LIMIT] Generation request rejected | userId={} | limitPerHour={} | retryAfterSeconds={}",
            userId, requestsPerHour, retryAfterSeconds);
        throw new RateLimitExceededException(
            "Too many generation requests. Please try again in " + retryAfterSeconds + " seconds.", retryAfterSeconds);
    }

    /**
     * One caller per interval wins the sweep; everyone else skips it.
     */
    private void sweepIfDue() {
        long now = nanoClock.getAsLong();
        long last = lastSweepNanos.get();
        if (now - last < SWEEP_INTERVAL_NANOS || !lastSweepNanos.compareAndSet(last, now)) {
            return;
        }
        int before = buckets.size();
        buckets.values().removeIf(TokenBucket::isFull);
        log.debug("[RATE_LIMIT] Evicted idle buckets | before={} | after={}", before, buckets.size());
    }

    int trackedUsers() {
        return buckets.size();
    }

    public double remaining(UUID userId) {
        TokenBucket bucket = buckets.get(userId);
        return bucket != null ? bucket.getAvailableTokens() : requestsPerHour;
    }

    public int getRequestsPerHour() {
        return requestsPerHour;
    }
}
