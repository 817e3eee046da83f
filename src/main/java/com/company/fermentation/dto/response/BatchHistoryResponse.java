package com.company.fermentation.dto.response;

import com.company.fermentation.domain.ResultEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchHistoryResponse {
    private int batchNumber;
    private int totalDataPoints;
    private List<ResultEnvelope> history;
    private Instant retrievedAt;
}
