package com.company.fermentation.alert;

import com.company.fermentation.domain.ParameterReadings;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.event.StatusTransitionEvent;

import java.util.Locale;

/**
 * Text of the status-change notification.
 */
public final class AlertMessages {

    private AlertMessages() {
    }

    public static String render(StatusTransitionEvent event) {
        QualityBand current = event.getCurrentStatus();
        return "FermentIQ Alert: Batch #" + event.getBatchId() + " status changed.\n"
                + "Old: " + event.getPreviousStatus() + "\n"
                + "New: " + current.getLabel().toUpperCase(Locale.ROOT) + " " + emoji(current) + "\n"
                + "Details: " + event.getDetails();
    }

    public static String details(ParameterReadings actual) {
        return String.format(Locale.ROOT, "pH: %.3f | Temp: %.2f | CO2: %.3f",
                actual.getPh(), actual.getTemperature(), actual.getCo2());
    }

    static String emoji(QualityBand band) {
        switch (band) {
            case PERFECT:
                return "✅";
            case ACCEPTABLE:
                return "👌";
            case CONCERNING:
                return "⚠️";
            case FAILED:
                return "❌";
            default:
                return "ℹ️";
        }
    }
}
