package com.company.fermentation.scheduled;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.stream.StreamOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic driver of the stream: one tick per {@code fermentation.stream.interval-ms},
 * measured from the end of the previous tick. Cancels itself once the stream is finished.
 */
@Slf4j
@Component
public class StreamDriver {

    private final StreamOrchestrator orchestrator;
    private final TaskScheduler taskScheduler;
    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    private ScheduledFuture<?> schedule;

    public StreamDriver(StreamOrchestrator orchestrator,
                        @Qualifier("streamScheduler") TaskScheduler taskScheduler,
                        MonitoringProperties properties,
                        MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getStream().isAutoStart()) {
            start();
        } else {
            log.info("Stream auto-start disabled");
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        MonitoringProperties.Stream config = properties.getStream();
        schedule = taskScheduler.scheduleWithFixedDelay(
                this::runTick,
                Instant.now().plusMillis(config.getInitialDelayMs()),
                Duration.ofMillis(config.getIntervalMs()));
        log.info("Stream started: {} batches, interval {} ms, cursor mode {}",
                config.getBatchCount(), config.getIntervalMs(), config.getCursorMode());
    }

    @PreDestroy
    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            log.info("Stream stopped after {} ticks", orchestrator.getTickCount());
        }
    }

    public synchronized boolean isRunning() {
        return schedule != null && !schedule.isDone();
    }

    void runTick() {
        try {
            orchestrator.tick();
        } catch (Exception e) {
            log.error("Stream tick failed", e);
            meterRegistry.counter("fermentation.ticks.failed").increment();
        }
        if (orchestrator.isFinished()) {
            stop();
        }
    }
}
