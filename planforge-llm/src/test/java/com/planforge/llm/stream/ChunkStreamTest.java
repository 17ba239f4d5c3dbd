package com.planforge.llm.stream;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.concurrent.GenerationCancelledException;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.RateLimitException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStreamTest {

    @Test
    void yieldsChunksInOrderThenEnds() {
        ChunkStream stream = ChunkStream.of("a", "b", "c");

        List<String> seen = new ArrayList<>();
        stream.forEachRemaining(seen::add);

        assertThat(seen).containsExactly("a", "b", "c");
        assertThat(stream.getChunksConsumed()).isEqualTo(3);
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    void upstreamErrorSurfacesAfterDeliveredChunks() {
        RateLimitException failure = new RateLimitException("quota", LlmProvider.GROQ, null);
        ChunkStream stream = ChunkStream.open(Flux.concat(Flux.just("a"), Flux.error(failure)), CancellationToken.create());

        assertThat(stream.next()).isEqualTo("a");
        assertThatThrownBy(stream::hasNext).isSameAs(failure);
    }

    @Test
    void cancellingTheTokenUnblocksTheReaderAndCancelsUpstream() {
        CancellationToken token = CancellationToken.create();
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        ChunkStream stream = ChunkStream.open(Flux.<String>never().doOnCancel(() -> upstreamCancelled.set(true)), token);

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> token.cancel(CancellationReason.TIMEOUT), 100, TimeUnit.MILLISECONDS);

            assertThatThrownBy(stream::hasNext)
                .isInstanceOfSatisfying(GenerationCancelledException.class, e -> assertThat(e.isTimeout()).isTrue());
            assertThat(upstreamCancelled).isTrue();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void closeCancelsUpstream() {
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        ChunkStream stream = ChunkStream.open(
            Flux.interval(Duration.ofMillis(10)).map(String::valueOf).doOnCancel(() -> upstreamCancelled.set(true)),
            CancellationToken.create());

        assertThat(stream.next()).isEqualTo("0");
        stream.close();

        assertThat(upstreamCancelled).isTrue();
    }
}
