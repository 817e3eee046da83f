package com.company.fermentation.scheduled;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.stream.StreamOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Stream driver")
class StreamDriverTest {

    @Mock
    private StreamOrchestrator orchestrator;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<?> future;

    private MonitoringProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private StreamDriver driver;

    @BeforeEach
    void setUp() {
        properties = new MonitoringProperties();
        meterRegistry = new SimpleMeterRegistry();
        driver = new StreamDriver(orchestrator, taskScheduler, properties, meterRegistry);
    }

    @Test
    @DisplayName("Starts with a fixed delay of the configured interval")
    void start() {
        properties.getStream().setIntervalMs(250);
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

        driver.start();
        driver.start();

        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(250)));
        assertTrue(driver.isRunning());
    }

    @Test
    @DisplayName("Does not start when auto-start is disabled")
    void autoStartDisabled() {
        properties.getStream().setAutoStart(false);

        driver.onApplicationReady();

        verify(taskScheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertFalse(driver.isRunning());
    }

    @Test
    @DisplayName("A failed tick is counted and the driver keeps running")
    void failedTick() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(orchestrator.tick()).thenThrow(new IllegalStateException("boom"));
        driver.start();

        driver.runTick();

        assertEquals(1.0, meterRegistry.get("fermentation.ticks.failed").counter().count());
        verify(future, never()).cancel(false);
    }

    @Test
    @DisplayName("Stops itself once the stream is finished")
    void stopsWhenFinished() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(orchestrator.isFinished()).thenReturn(true);
        driver.start();

        driver.runTick();

        verify(future).cancel(false);
        assertFalse(driver.isRunning());
    }
}
