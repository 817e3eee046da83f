package com.company.fermentation.config;

import com.company.fermentation.broadcast.Broadcaster;
import com.company.fermentation.stream.StreamOrchestrator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder fermentationMetrics(StreamOrchestrator orchestrator, Broadcaster broadcaster) {
        return (reg) -> {
            Gauge.builder("fermentation.batches.streaming", orchestrator, StreamOrchestrator::streamingBatches)
                    .description("Number of batches currently streaming")
                    .register(reg);

            Gauge.builder("fermentation.broadcast.subscribers", broadcaster, Broadcaster::subscriberCount)
                    .description("Number of connected stream subscribers")
                    .register(reg);

            log.info("Custom metrics registered");
        };
    }
}
