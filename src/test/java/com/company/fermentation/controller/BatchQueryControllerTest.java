package com.company.fermentation.controller;

import com.company.fermentation.domain.BatchDataPoint;
import com.company.fermentation.domain.ComparisonReport;
import com.company.fermentation.domain.ParameterReadings;
import com.company.fermentation.domain.ResultEnvelope;
import com.company.fermentation.domain.enums.CursorState;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.dto.response.BatchStatusResponse;
import com.company.fermentation.exception.BatchDataNotAvailableException;
import com.company.fermentation.exception.GlobalExceptionHandler;
import com.company.fermentation.exception.InvalidBatchException;
import com.company.fermentation.service.BatchQueryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("Batch query endpoints")
class BatchQueryControllerTest {

    @Mock
    private BatchQueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new BatchQueryController(queryService, new SimpleMeterRegistry()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Returns the latest status of a batch")
    void batchStatus() throws Exception {
        when(queryService.getBatch(2)).thenReturn(BatchStatusResponse.builder()
                .batchNumber(2)
                .cursorState(CursorState.STREAMING)
                .batchStatus("perfect")
                .currentStatus(QualityBand.PERFECT)
                .qualityScore(99.5)
                .samplesProcessed(10)
                .totalSamples(144)
                .build());

        mockMvc.perform(get("/api/v1/batches/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchNumber").value(2))
                .andExpect(jsonPath("$.currentStatus").value("perfect"))
                .andExpect(jsonPath("$.qualityScore").value(99.5));
    }

    @Test
    @DisplayName("Unknown batch ids are a bad request")
    void invalidBatch() throws Exception {
        when(queryService.getBatch(9)).thenThrow(new InvalidBatchException(9, 4));

        mockMvc.perform(get("/api/v1/batches/9"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("A batch without data yet is not found")
    void noData() throws Exception {
        when(queryService.getHistory(1)).thenThrow(new BatchDataNotAvailableException(1));

        mockMvc.perform(get("/api/v1/batches/1/history"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("A non-numeric batch id is a bad request")
    void nonNumericId() throws Exception {
        mockMvc.perform(get("/api/v1/batches/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("CSV download is an attachment with a header row")
    void csvDownload() throws Exception {
        when(queryService.requireHistory(1)).thenReturn(List.of(envelope()));

        mockMvc.perform(get("/api/v1/batches/1/download").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", startsWith("text/csv")))
                .andExpect(header().string("Content-Disposition", containsString("batch_1_data.csv")))
                .andExpect(content().string(startsWith("timestamp,ph,temperature,co2")))
                .andExpect(content().string(containsString("0.5,5.8,18.0,0.1,5.8,18.0,0.1,100.0,perfect")));
    }

    @Test
    @DisplayName("Unsupported export formats are rejected before any data is read")
    void unsupportedFormat() throws Exception {
        mockMvc.perform(get("/api/v1/batches/export").param("format", "xml"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(queryService);
    }

    private static ResultEnvelope envelope() {
        ParameterReadings readings = new ParameterReadings(5.8, 18.0, 0.1);
        return ResultEnvelope.builder()
                .batchNumber(1)
                .tick(2)
                .dataPoint(BatchDataPoint.builder()
                        .batchNumber(1)
                        .batchStatus("perfect")
                        .timestamp(0.5)
                        .ph(5.8)
                        .temperature(18.0)
                        .co2(0.1)
                        .sampleIndex(1)
                        .totalSamples(144)
                        .build())
                .comparison(ComparisonReport.builder()
                        .batchNumber(1)
                        .actual(readings)
                        .ideal(readings)
                        .qualityScore(100.0)
                        .overallStatus(QualityBand.PERFECT)
                        .build())
                .producedAt(Instant.now())
                .build();
    }
}
