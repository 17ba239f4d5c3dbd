package com.planforge.api.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs streaming generations. Each stream holds two workers for its whole life: one runs the attempt, the other
 * relays its events to the client.
 *
 * <p>Admission is bounded by permits, and the pool is sized at two threads per permit, so an admitted stream
 * never waits behind another one. Callers take a permit with {@link #tryAcquire()} before reserving an attempt,
 * then either hand it to {@link #start} or give it back with {@link #release()}.</p>
 */
@Slf4j
public class GenerationStreamExecutor {

    private final int maxStreams;
    private final Semaphore permits;
    private final ThreadPoolExecutor workers;

    public GenerationStreamExecutor(int maxStreams) {
        if (maxStreams < 1) {
            throw new IllegalArgumentException("maxStreams must be positive: " + maxStreams);
        }
        this.maxStreams = maxStreams;
        this.permits = new Semaphore(maxStreams);

        AtomicInteger count = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "generation-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        int threads = maxStreams * 2;
        this.workers = new ThreadPoolExecutor(
            threads,
            threads,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            threadFactory
        );
        this.workers.allowCoreThreadTimeOut(true);
    }

    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    public void release() {
        permits.release();
    }

    /**
     * Starts both halves of a stream on a permit already taken by {@link #tryAcquire()}. From this call on the
     * permit belongs to the stream and returns once every task that was accepted has finished.
     */
    public void start(Runnable attempt, Runnable relay) {
        AtomicInteger remaining = new AtomicInteger(2);
        try {
            workers.execute(() -> runThenRelease(attempt, remaining));
        } catch (RejectedExecutionException e) {
            permits.release();
            throw e;
        }
        try {
            workers.execute(() -> runThenRelease(relay, remaining));
        } catch (RejectedExecutionException e) {
            log.error("[GENERATION_STREAM] Relay rejected after attempt started | error={}", e.getMessage());
            if (remaining.decrementAndGet() == 0) {
                permits.release();
            }
            throw e;
        }
    }

    public int activeStreams() {
        return maxStreams - permits.availablePermits();
    }

    public int getMaxStreams() {
        return maxStreams;
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void runThenRelease(Runnable task, AtomicInteger remaining) {
        try {
            task.run();
        } finally {
            if (remaining.decrementAndGet() == 0) {
                permits.release();
            }
        }
    }
}
