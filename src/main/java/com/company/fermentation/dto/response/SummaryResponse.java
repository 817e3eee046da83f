package com.company.fermentation.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {
    private int totalActiveBatches;

    // Band label -> number of batches whose latest result is in it
    private Map<String, Long> statusDistribution;
    private double averageQualityScore;
    private double minQualityScore;
    private double maxQualityScore;

    // Concerning or failed
    private int batchesNeedingAttention;
    private List<Integer> attentionBatchNumbers;

    private long tick;
    private boolean streamFinished;
    private Instant retrievedAt;
}
