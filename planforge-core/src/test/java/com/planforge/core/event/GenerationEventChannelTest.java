package com.planforge.core.event;

import com.planforge.common.constants.FailureClassification;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationEventChannelTest {

    private final UUID planId = UUID.randomUUID();
    private final GenerationEventChannel channel = new GenerationEventChannel();

    @Test
    void deliversEventsInOrder() throws InterruptedException {
        channel.publish(GenerationEvent.progress(planId, 0, null));
        channel.publish(GenerationEvent.progress(planId, 1, 2));

        assertThat(channel.poll(10, TimeUnit.MILLISECONDS).getData()).containsEntry("modulesParsed", 0);
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS).getData()).containsEntry("modulesParsed", 1);
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void onlyOneTerminalEventIsEverDelivered() throws InterruptedException {
        assertThat(channel.publish(GenerationEvent.complete(planId, UUID.randomUUID(), 2, 5, 1_000))).isTrue();
        assertThat(channel.publish(GenerationEvent.error(planId, FailureClassification.TIMEOUT, true))).isFalse();
        assertThat(channel.publish(GenerationEvent.cancelled(planId, "client"))).isFalse();

        assertThat(channel.isTerminated()).isTrue();
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS).getType()).isEqualTo(GenerationEventType.COMPLETE);
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void errorEventsNeverCarryRawProviderText() {
        GenerationEvent event = GenerationEvent.error(planId, FailureClassification.RATE_LIMIT, true);

        assertThat(event.getData())
            .containsEntry("code", "rate_limited")
            .containsEntry("message", "Rate limit exceeded. Please wait and try again.")
            .containsEntry("classification", "rate_limit")
            .containsEntry("retryable", true);
    }
}
