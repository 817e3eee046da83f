package com.company.fermentation.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {

    @NotNull
    @Valid
    private SeriesPayload generated;

    // Loaded reference trajectory when absent
    @Valid
    private SeriesPayload reference;
}
