package com.company.fermentation.alert;

import com.company.fermentation.domain.ParameterReadings;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.event.StatusTransitionEvent;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Alert message rendering")
class AlertMessagesTest {

    @Test
    @DisplayName("Details show readings with fixed precision")
    void details() {
        assertEquals("pH: 5.500 | Temp: 18.25 | CO2: 1.000",
                AlertMessages.details(new ParameterReadings(5.5, 18.25, 1.0)));
    }

    @Test
    @DisplayName("Message names the batch, both statuses and the details")
    void render() {
        StatusTransitionEvent event = new StatusTransitionEvent(3, "unknown", QualityBand.FAILED,
                "pH: 6.300 | Temp: 18.00 | CO2: 1.000", Instant.now());

        assertEquals("FermentIQ Alert: Batch #3 status changed.\n"
                + "Old: unknown\n"
                + "New: FAILED ❌\n"
                + "Details: pH: 6.300 | Temp: 18.00 | CO2: 1.000", AlertMessages.render(event));
    }

    @Test
    @DisplayName("Telemetry sender completes against a no-op tracer")
    void telemetrySender() {
        TelemetryAlertSender sender = new TelemetryAlertSender(OpenTelemetry.noop().getTracer("test"));
        StatusTransitionEvent event = new StatusTransitionEvent(1, "perfect", QualityBand.CONCERNING,
                "details", Instant.now());

        assertDoesNotThrow(() -> sender.send(event, "+100"));
    }
}
