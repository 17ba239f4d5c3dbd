package com.planforge.llm.stream;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.concurrent.GenerationCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking, pull-based view over a reactive chunk source.
 *
 * Demand is requested from upstream one chunk at a time (after a small prefetch), so a slow consumer never
 * buffers more than {@value #PREFETCH} chunks. Closing the stream, or cancelling the token it was opened with,
 * cancels the upstream subscription, which aborts the underlying HTTP exchange. A cancelled token is observed
 * on the next {@link #hasNext()} even when chunks are already queued.
 */
@Slf4j
public class ChunkStream implements Iterator<String>, AutoCloseable {

    private static final int PREFETCH = 16;
    private static final long POLL_INTERVAL_MS = 50;
    private static final Object COMPLETE = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final ChunkSubscriber subscriber = new ChunkSubscriber();
    private final CancellationToken cancellationToken;

    private String peeked;
    private boolean finished;
    private long chunksConsumed;

    private ChunkStream(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
    }

    public static ChunkStream open(Flux<String> source, CancellationToken cancellationToken) {
        ChunkStream stream = new ChunkStream(cancellationToken);
        cancellationToken.onCancel(stream::close);
        source.subscribe(stream.subscriber);
        return stream;
    }

    public static ChunkStream of(List<String> chunks) {
        return open(Flux.fromIterable(chunks), CancellationToken.create());
    }

    public static ChunkStream of(String... chunks) {
        return of(List.of(chunks));
    }

    @Override
    public boolean hasNext() {
        if (peeked != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        while (true) {
            if (cancellationToken.isCancelled()) {
                close();
                cancellationToken.throwIfCancelled();
            }
            Object signal;
            try {
                signal = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new GenerationCancelledException(CancellationReason.CLIENT);
            }
            if (signal == null) {
                continue;
            }
            if (signal == COMPLETE) {
                finished = true;
                return false;
            }
            if (signal instanceof ErrorSignal error) {
                finished = true;
                throw error.asRuntimeException();
            }
            peeked = (String) signal;
            subscriber.requestMore();
            return true;
        }
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Chunk stream exhausted");
        }
        String chunk = peeked;
        peeked = null;
        chunksConsumed++;
        return chunk;
    }

    public long getChunksConsumed() {
        return chunksConsumed;
    }

    @Override
    public void close() {
        if (!subscriber.isDisposed()) {
            log.debug("[STREAM] Closing chunk stream | chunksConsumed={}", chunksConsumed);
            subscriber.dispose();
        }
    }

    private final class ChunkSubscriber extends BaseSubscriber<String> {

        @Override
        protected void hookOnSubscribe(Subscription subscription) {
            subscription.request(PREFETCH);
        }

        @Override
        protected void hookOnNext(String chunk) {
            queue.offer(chunk);
        }

        @Override
        protected void hookOnComplete() {
            queue.offer(COMPLETE);
        }

        @Override
        protected void hookOnError(Throwable throwable) {
            queue.offer(new ErrorSignal(throwable));
        }

        void requestMore() {
            if (!isDisposed()) {
                request(1);
            }
        }
    }

    private record ErrorSignal(Throwable error) {
        RuntimeException asRuntimeException() {
            if (error instanceof RuntimeException runtime) {
                return runtime;
            }
            return new IllegalStateException("Chunk stream failed: " + error.getMessage(), error);
        }
    }
}
