package com.planforge.llm.model;

import com.planforge.llm.stream.ChunkStream;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An open generation stream plus the metadata of the backend serving it. Usage figures are usually only known
 * once the stream has been drained, so metadata is read through a supplier.
 */
public class ProviderResult implements AutoCloseable {

    private final ChunkStream chunks;
    private final Supplier<ProviderMetadata> metadata;

    public ProviderResult(ChunkStream chunks, Supplier<ProviderMetadata> metadata) {
        this.chunks = chunks;
        this.metadata = metadata;
    }

    public ChunkStream getChunks() {
        return chunks;
    }

    public ProviderMetadata getMetadata() {
        return metadata.get();
    }

    public ProviderResult withMetadata(Function<ProviderMetadata, ProviderMetadata> customizer) {
        return new ProviderResult(chunks, () -> customizer.apply(metadata.get()));
    }

    @Override
    public void close() {
        chunks.close();
    }
}
