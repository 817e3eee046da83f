package com.company.fermentation.alert;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.event.StatusTransitionEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the last known band of every batch and reports changes.
 *
 * <p>A batch first observed in a degraded band reports a transition from {@code "unknown"}.
 * Every change alerts; there is no cooldown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertStateMachine {

    public static final String UNKNOWN = "unknown";

    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final MonitoringProperties properties;

    private final Map<Integer, QualityBand> lastStatus = new ConcurrentHashMap<>();

    /**
     * Records {@code current} and returns the previous status when it changed.
     */
    public Optional<String> check(int batchId, QualityBand current) {
        QualityBand previous = lastStatus.put(batchId, current);
        if (previous == null) {
            return current.isDegraded() ? Optional.of(UNKNOWN) : Optional.empty();
        }
        if (previous != current) {
            return Optional.of(previous.getLabel());
        }
        return Optional.empty();
    }

    /**
     * Hands the transition to the asynchronous alert handlers. Returns immediately.
     */
    public void notify(int batchId, QualityBand current, String previous, String details) {
        log.warn("Batch {} status changed: {} -> {}", batchId, previous, current.getLabel());

        meterRegistry.counter("fermentation.status.transitions",
                "batch", String.valueOf(batchId),
                "status", current.getLabel()
        ).increment();

        if (!properties.getAlerts().isEnabled()) {
            log.debug("Alerts disabled, not dispatching transition for batch {}", batchId);
            return;
        }
        eventPublisher.publishEvent(new StatusTransitionEvent(batchId, previous, current, details, Instant.now()));
    }

    public Optional<QualityBand> lastStatus(int batchId) {
        return Optional.ofNullable(lastStatus.get(batchId));
    }
}
