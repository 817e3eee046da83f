package com.company.fermentation.alert;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.event.StatusTransitionEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Delivers status transitions on the alert pool. Delivery failures end here: they are logged
 * and counted, never rethrown to the stream.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertHandlerService {

    private final AlertSender alertSender;
    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    @EventListener
    @Async("alertExecutor")
    public void handleStatusTransition(StatusTransitionEvent event) {
        String target = properties.getAlerts().targetFor(event.getBatchId());

        try {
            alertSender.send(event, target);

            meterRegistry.counter("fermentation.alerts.sent",
                    "batch", String.valueOf(event.getBatchId()),
                    "status", event.getCurrentStatus().getLabel()
            ).increment();

            log.info("Alert sent for batch {} ({} -> {})",
                    event.getBatchId(), event.getPreviousStatus(), event.getCurrentStatus().getLabel());

        } catch (Exception e) {
            log.error("Failed to send alert for batch {} ({} -> {})",
                    event.getBatchId(), event.getPreviousStatus(), event.getCurrentStatus().getLabel(), e);

            meterRegistry.counter("fermentation.alerts.failed",
                    "batch", String.valueOf(event.getBatchId())
            ).increment();
        }
    }
}
