package com.company.fermentation.dto.response;

import com.company.fermentation.domain.ResultEnvelope;
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
public class ExportResponse {
    private String format;
    private int totalRecords;
    private Map<Integer, List<ResultEnvelope>> batches;
    private Instant generatedAt;
}
