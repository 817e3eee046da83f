package com.company.fermentation.dto.response;

import com.company.fermentation.domain.ParameterStatistics;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.dto.request.SeriesPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceResponse {
    private int samples;
    private SeriesPayload series;
    private Map<Parameter, ParameterStatistics> statistics;
    private double detectorThreshold;
}
