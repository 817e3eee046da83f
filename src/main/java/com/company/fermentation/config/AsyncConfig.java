package com.company.fermentation.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Thread pools:
 * - alertExecutor: notification delivery, off the tick path
 * - broadcastExecutor: per-subscriber message delivery
 * - streamScheduler: the periodic tick driver
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class AsyncConfig {

    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Bounded. When the queue is full the alert is dropped and counted; the publishing tick
     * thread never runs delivery itself. Pending alerts are discarded on shutdown.
     */
    @Bean(name = "alertExecutor")
    public Executor alertExecutor() {
        MonitoringProperties.Alerts alerts = properties.getAlerts();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alerts.getPoolSize());
        executor.setMaxPoolSize(alerts.getPoolSize());
        executor.setQueueCapacity(alerts.getQueueCapacity());
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Alert task rejected - queue full. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            meterRegistry.counter("fermentation.alerts.rejected").increment();
        });
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Created alertExecutor: poolSize={}, queue={}", alerts.getPoolSize(), alerts.getQueueCapacity());
        return executor;
    }

    @Bean(name = "broadcastExecutor")
    public Executor broadcastExecutor() {
        int poolSize = properties.getBroadcast().getDeliveryPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("broadcast-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Created broadcastExecutor: poolSize={}", poolSize);
        return executor;
    }

    @Bean(name = "streamScheduler")
    public ThreadPoolTaskScheduler streamScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("stream-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.initialize();
        return scheduler;
    }
}
