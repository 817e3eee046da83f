package com.company.fermentation.alert;

import com.company.fermentation.event.StatusTransitionEvent;

/**
 * Notification channel for status transitions.
 */
public interface AlertSender {

    /**
     * @throws com.company.fermentation.exception.AlertSendException when delivery fails
     */
    void send(StatusTransitionEvent event, String target);
}
