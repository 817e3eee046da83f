package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one batch on one tick, as stored in history and sent to subscribers.
 */
@Value
@Builder
@AllArgsConstructor
public class ResultEnvelope {
    int batchNumber;
    long tick;
    BatchDataPoint dataPoint;
    ComparisonReport comparison;
    Instant producedAt;
}
