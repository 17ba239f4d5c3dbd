package com.planforge.core.orchestrator;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Arms a per-attempt deadline that cancels the attempt's token with {@link CancellationReason#TIMEOUT}.
 *
 * An attempt that shows early progress (first module seen before the extension threshold) gets its deadline
 * pushed back once.
 */
@Component
@Slf4j
public class AdaptiveTimeoutScheduler {

    public static final long DEFAULT_BASE_MS = 30_000;
    public static final long DEFAULT_EXTENSION_MS = 15_000;
    public static final long DEFAULT_EXTENSION_THRESHOLD_MS = 25_000;

    private final long baseMs;
    private final long extensionMs;
    private final long extensionThresholdMs;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public AdaptiveTimeoutScheduler(
            @Value("${planforge.timeout.base-ms:30000}") long baseMs,
            @Value("${planforge.timeout.extension-ms:15000}") long extensionMs,
            @Value("${planforge.timeout.extension-threshold-ms:25000}") long extensionThresholdMs) {
        this.baseMs = baseMs;
        this.extensionMs = extensionMs;
        this.extensionThresholdMs = extensionThresholdMs;
        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "generation-timeout-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("[TIMEOUT] Scheduler ready | baseMs={} | extensionMs={} | extensionThresholdMs={}",
            baseMs, extensionMs, extensionThresholdMs);
    }

    public AdaptiveTimeoutScheduler() {
        this(DEFAULT_BASE_MS, DEFAULT_EXTENSION_MS, DEFAULT_EXTENSION_THRESHOLD_MS);
    }

    public AdaptiveTimeout start(UUID planId, CancellationToken token) {
        AdaptiveTimeout timeout = new AdaptiveTimeout(planId, token);
        timeout.arm(baseMs);
        return timeout;
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * Deadline handle for one attempt. Thread-safe: the parser thread extends it while the scheduler thread
     * may be firing it.
     */
    public class AdaptiveTimeout {

        private final UUID planId;
        private final CancellationToken token;
        private final long startNanos = System.nanoTime();
        private ScheduledFuture<?> pending;
        private boolean extended;
        private boolean fired;
        private boolean stopped;

        private AdaptiveTimeout(UUID planId, CancellationToken token) {
            this.planId = planId;
            this.token = token;
        }

        private synchronized void arm(long delayMs) {
            pending = scheduler.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        }

        /**
         * Extends the deadline once, if progress arrived before the threshold.
         */
        public synchronized void onFirstModule() {
            long elapsedMs = elapsedMs();
            if (extended || fired || stopped || elapsedMs >= extensionThresholdMs) {
                return;
            }
            pending.cancel(false);
            extended = true;
            long remaining = Math.max(0, baseMs + extensionMs - elapsedMs);
            pending = scheduler.schedule(this::fire, remaining, TimeUnit.MILLISECONDS);
            log.info("[TIMEOUT] Deadline extended | planId={} | elapsedMs={} | newDeadlineMs={}",
                planId, elapsedMs, baseMs + extensionMs);
        }

        /**
         * Disarms the deadline. Safe to call more than once.
         */
        public synchronized void stop() {
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        public synchronized boolean isTimedOut() {
            return fired;
        }

        public synchronized boolean isExtended() {
            return extended;
        }

        private void fire() {
            synchronized (this) {
                if (stopped || fired) {
                    return;
                }
                fired = true;
            }
            log.warn("[TIMEOUT] Attempt deadline reached | planId={} | elapsedMs={} | extended={}",
                planId, elapsedMs(), isExtended());
            token.cancel(CancellationReason.TIMEOUT);
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
