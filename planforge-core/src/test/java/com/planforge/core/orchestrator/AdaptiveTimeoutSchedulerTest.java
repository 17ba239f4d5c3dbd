package com.planforge.core.orchestrator;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.core.orchestrator.AdaptiveTimeoutScheduler.AdaptiveTimeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveTimeoutSchedulerTest {

    private AdaptiveTimeoutScheduler scheduler;

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void cancelsTokenWhenTheBaseDeadlinePasses() throws InterruptedException {
        scheduler = new AdaptiveTimeoutScheduler(50, 1_000, 1_000);
        CancellationToken token = CancellationToken.create();

        AdaptiveTimeout timeout = scheduler.start(UUID.randomUUID(), token);

        awaitCancellation(token, 2_000);
        assertThat(token.getReason()).isEqualTo(CancellationReason.TIMEOUT);
        assertThat(timeout.isTimedOut()).isTrue();
        assertThat(timeout.isExtended()).isFalse();
    }

    @Test
    void earlyProgressExtendsTheDeadlineOnce() throws InterruptedException {
        scheduler = new AdaptiveTimeoutScheduler(200, 400, 150);
        CancellationToken token = CancellationToken.create();

        AdaptiveTimeout timeout = scheduler.start(UUID.randomUUID(), token);
        timeout.onFirstModule();
        timeout.onFirstModule();

        Thread.sleep(350);
        assertThat(token.isCancelled()).isFalse();
        assertThat(timeout.isExtended()).isTrue();

        awaitCancellation(token, 2_000);
        assertThat(token.getReason()).isEqualTo(CancellationReason.TIMEOUT);
    }

    @Test
    void progressAfterTheThresholdDoesNotExtend() throws InterruptedException {
        scheduler = new AdaptiveTimeoutScheduler(300, 5_000, 50);
        CancellationToken token = CancellationToken.create();

        AdaptiveTimeout timeout = scheduler.start(UUID.randomUUID(), token);
        Thread.sleep(100);
        timeout.onFirstModule();

        assertThat(timeout.isExtended()).isFalse();
        awaitCancellation(token, 2_000);
    }

    @Test
    void stoppedTimeoutNeverFires() throws InterruptedException {
        scheduler = new AdaptiveTimeoutScheduler(50, 0, 0);
        CancellationToken token = CancellationToken.create();

        AdaptiveTimeout timeout = scheduler.start(UUID.randomUUID(), token);
        timeout.stop();
        timeout.stop();

        Thread.sleep(200);
        assertThat(token.isCancelled()).isFalse();
        assertThat(timeout.isTimedOut()).isFalse();
    }

    private static void awaitCancellation(CancellationToken token, long maxWaitMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + maxWaitMs;
        while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(token.isCancelled()).as("token cancelled within %d ms", maxWaitMs).isTrue();
    }
}
