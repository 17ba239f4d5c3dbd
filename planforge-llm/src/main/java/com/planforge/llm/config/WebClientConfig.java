package com.planforge.llm.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient setup for the generation backends. Each client clones this builder and sets its own base URL.
 *
 * The response timeout bounds the gap between bytes on a streaming response, not the whole stream;
 * the attempt deadline is enforced separately through the cancellation token.
 */
@Configuration
public class WebClientConfig {

    // Buffers a single SSE event, not the whole curriculum
    private static final int MAX_IN_MEMORY_SIZE = 2 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${llm.http.response-timeout-ms:60000}") long responseTimeoutMs,
            @Value("${llm.http.connect-timeout-ms:10000}") int connectTimeoutMs) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofMillis(responseTimeoutMs))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
