package com.company.fermentation.controller;

import com.company.fermentation.domain.enums.ExportFormat;
import com.company.fermentation.dto.response.BatchHistoryResponse;
import com.company.fermentation.dto.response.BatchStatusResponse;
import com.company.fermentation.dto.response.SummaryResponse;
import com.company.fermentation.service.BatchQueryService;
import com.company.fermentation.util.CsvExport;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/batches")
@Tag(name = "Batches", description = "Live batch status, history and exports")
@RequiredArgsConstructor
@Slf4j
public class BatchQueryController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final BatchQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "Current status of every batch")
    public ResponseEntity<List<BatchStatusResponse>> getAllBatches() {
        meterRegistry.counter("api.batches.requests", "endpoint", "list").increment();
        return ResponseEntity.ok(queryService.getAllBatches());
    }

    @GetMapping("/summary")
    @Operation(
            summary = "Summary over the latest result of every batch",
            description = "Band distribution, quality score range and batches needing attention"
    )
    public ResponseEntity<SummaryResponse> getSummary() {
        meterRegistry.counter("api.batches.requests", "endpoint", "summary").increment();
        return ResponseEntity.ok(queryService.getSummary());
    }

    @GetMapping("/export")
    @Operation(summary = "Export the history of all batches as JSON or CSV")
    public ResponseEntity<?> exportAll(
            @Parameter(description = "json or csv")
            @RequestParam(defaultValue = "json") String format) {

        meterRegistry.counter("api.batches.requests", "endpoint", "export").increment();

        if (ExportFormat.fromString(format) == ExportFormat.CSV) {
            return csv(CsvExport.allBatches(queryService.requireAllHistory()), "all_batches_data.csv");
        }
        return ResponseEntity.ok(queryService.exportAll());
    }

    @GetMapping("/{batchId}")
    @Operation(summary = "Latest result of one batch")
    public ResponseEntity<BatchStatusResponse> getBatch(@PathVariable int batchId) {
        meterRegistry.counter("api.batches.requests", "endpoint", "detail").increment();
        return ResponseEntity.ok(queryService.getBatch(batchId));
    }

    @GetMapping("/{batchId}/history")
    @Operation(summary = "Every result recorded for one batch")
    public ResponseEntity<BatchHistoryResponse> getHistory(@PathVariable int batchId) {
        meterRegistry.counter("api.batches.requests", "endpoint", "history").increment();
        return ResponseEntity.ok(queryService.getHistory(batchId));
    }

    @GetMapping("/{batchId}/download")
    @Operation(summary = "Download the history of one batch as JSON or CSV")
    public ResponseEntity<?> download(
            @PathVariable int batchId,
            @Parameter(description = "json or csv")
            @RequestParam(defaultValue = "json") String format) {

        meterRegistry.counter("api.batches.requests", "endpoint", "download").increment();

        if (ExportFormat.fromString(format) == ExportFormat.CSV) {
            return csv(CsvExport.batch(queryService.requireHistory(batchId)), "batch_" + batchId + "_data.csv");
        }
        return ResponseEntity.ok(queryService.getHistory(batchId));
    }

    private ResponseEntity<String> csv(String body, String filename) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }
}
