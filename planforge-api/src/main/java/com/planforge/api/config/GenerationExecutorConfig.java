package com.planforge.api.config;

import com.planforge.api.stream.GenerationStreamExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GenerationExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public GenerationStreamExecutor generationStreamExecutor(
            @Value("${planforge.generation.max-concurrent-streams:20}") int maxConcurrentStreams) {
        return new GenerationStreamExecutor(maxConcurrentStreams);
    }
}
