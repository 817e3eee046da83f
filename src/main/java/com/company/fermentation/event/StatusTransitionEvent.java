package com.company.fermentation.event;

import com.company.fermentation.domain.enums.QualityBand;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class StatusTransitionEvent {
    private final int batchId;

    // Label of the previous band, or "unknown" for a batch first seen in a degraded band
    private final String previousStatus;
    private final QualityBand currentStatus;
    private final String details;
    private final Instant occurredAt;
}
