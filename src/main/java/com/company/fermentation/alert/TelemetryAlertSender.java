package com.company.fermentation.alert;

import com.company.fermentation.event.StatusTransitionEvent;
import com.company.fermentation.exception.AlertSendException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Records the alert as a span and writes the notification text to the log, standing in for
 * an SMS gateway.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelemetryAlertSender implements AlertSender {

    private final Tracer tracer;

    @Override
    @CircuitBreaker(name = "alertDelivery")
    public void send(StatusTransitionEvent event, String target) {
        Span span = tracer.spanBuilder("fermentation.status.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("batch.id", event.getBatchId());
            span.setAttribute("status.previous", event.getPreviousStatus());
            span.setAttribute("status.current", event.getCurrentStatus().getLabel());
            span.setAttribute("alert.target", target);

            String message = AlertMessages.render(event);
            span.addEvent("Status transition",
                    Attributes.of(
                            AttributeKey.stringKey("details"), event.getDetails(),
                            AttributeKey.stringKey("message"), message
                    ));

            log.info("Alert to {}:\n{}", target, message);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send alert");
            throw new AlertSendException("Failed to send alert for batch " + event.getBatchId(), e);
        } finally {
            span.end();
        }
    }
}
