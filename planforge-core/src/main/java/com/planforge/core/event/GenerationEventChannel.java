package com.planforge.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-producer, single-consumer event channel between the orchestrator and whoever renders progress.
 *
 * The channel carries at most one terminal event ({@code complete}, {@code error} or {@code cancelled}).
 * Anything published after it is dropped and {@link #publish} returns false.
 */
@Slf4j
public class GenerationEventChannel {

    private final BlockingQueue<GenerationEvent> queue = new LinkedBlockingQueue<>();
    private final Object monitor = new Object();
    private boolean terminated;

    public boolean publish(GenerationEvent event) {
        synchronized (monitor) {
            if (terminated) {
                log.debug("[ORCHESTRATOR] Dropping event after terminal | type={}", event.getType().getValue());
                return false;
            }
            terminated = event.isTerminal();
            queue.add(event);
            return true;
        }
    }

    /**
     * Next event, waiting up to the given time. Null on timeout.
     */
    public GenerationEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public boolean isTerminated() {
        synchronized (monitor) {
            return terminated;
        }
    }
}
