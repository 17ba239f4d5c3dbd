package com.planforge.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared cancellation handle for one generation attempt.
 *
 * The first {@link #cancel(CancellationReason)} wins; later calls are ignored. Listeners registered with
 * {@link #onCancel(Runnable)} run exactly once, on the cancelling thread, or immediately if the token has
 * already fired. Backends register a listener that disposes their in-flight HTTP exchange.
 */
@Slf4j
public class CancellationToken {

    private final Object monitor = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile CancellationReason reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean cancel(CancellationReason cancellationReason) {
        List<Runnable> toRun;
        synchronized (monitor) {
            if (reason != null) {
                return false;
            }
            reason = cancellationReason;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        log.debug("[CANCEL] Token cancelled | reason={} | listeners={}", cancellationReason, toRun.size());
        toRun.forEach(this::runListener);
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public CancellationReason getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        CancellationReason current = reason;
        if (current != null) {
            throw new GenerationCancelledException(current);
        }
    }

    public void onCancel(Runnable listener) {
        synchronized (monitor) {
            if (reason == null) {
                listeners.add(listener);
                return;
            }
        }
        runListener(listener);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[CANCEL] Cancellation listener failed | error={}", e.getMessage(), e);
        }
    }
}
