package com.company.fermentation.dto.response;

import com.company.fermentation.domain.ResultEnvelope;
import com.company.fermentation.domain.enums.CursorState;
import com.company.fermentation.domain.enums.QualityBand;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchStatusResponse {
    private int batchNumber;
    private CursorState cursorState;

    // Profile label, e.g. "acceptable"
    private String batchStatus;
    private Integer expectedQuality;
    private String description;

    private QualityBand currentStatus;
    private Double qualityScore;
    private int samplesProcessed;
    private Integer totalSamples;

    private ResultEnvelope latest;
}
