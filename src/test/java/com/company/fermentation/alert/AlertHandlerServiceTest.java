package com.company.fermentation.alert;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.event.StatusTransitionEvent;
import com.company.fermentation.exception.AlertSendException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Alert delivery handler")
class AlertHandlerServiceTest {

    @Mock
    private AlertSender alertSender;

    private SimpleMeterRegistry meterRegistry;
    private MonitoringProperties properties;
    private AlertHandlerService handler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new MonitoringProperties();
        properties.getAlerts().setTargetNumbers(Map.of("default", "+100", "2", "+200"));
        handler = new AlertHandlerService(alertSender, properties, meterRegistry);
    }

    @Test
    @DisplayName("Delivers to the batch-specific target and counts the alert")
    void delivers() {
        StatusTransitionEvent event = event(2);

        handler.handleStatusTransition(event);

        verify(alertSender).send(event, "+200");
        assertEquals(1.0, meterRegistry.get("fermentation.alerts.sent").tag("batch", "2").counter().count());
    }

    @Test
    @DisplayName("Falls back to the default target")
    void defaultTarget() {
        StatusTransitionEvent event = event(4);

        handler.handleStatusTransition(event);

        verify(alertSender).send(event, "+100");
    }

    @Test
    @DisplayName("Delivery failure is logged and counted, not rethrown")
    void failureIsSwallowed() {
        doThrow(new AlertSendException("gateway down", new RuntimeException()))
                .when(alertSender).send(any(), anyString());

        assertDoesNotThrow(() -> handler.handleStatusTransition(event(1)));

        verify(alertSender).send(any(), eq("+100"));
        assertEquals(1.0, meterRegistry.get("fermentation.alerts.failed").tag("batch", "1").counter().count());
        assertNull(meterRegistry.find("fermentation.alerts.sent").counter());
    }

    private static StatusTransitionEvent event(int batchId) {
        return new StatusTransitionEvent(batchId, "perfect", QualityBand.FAILED,
                "pH: 6.300 | Temp: 18.00 | CO2: 1.000", Instant.now());
    }
}
