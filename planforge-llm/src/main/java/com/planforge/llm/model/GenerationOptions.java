package com.planforge.llm.model;

import com.planforge.common.concurrent.CancellationToken;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class GenerationOptions {

    /** Correlates router and client log lines for one attempt. */
    String requestId;

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.create();

    /** Upper bound on the wait for the backend to accept the request and emit its first chunk. */
    @Builder.Default
    Duration firstChunkTimeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxOutputTokens = 4096;

    @Builder.Default
    double temperature = 0.4;
}
