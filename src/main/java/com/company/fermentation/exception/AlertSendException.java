package com.company.fermentation.exception;

/**
 * Delivery failure of a status alert. Never propagated past the alert handler.
 */
public class AlertSendException extends RuntimeException {
    public AlertSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
