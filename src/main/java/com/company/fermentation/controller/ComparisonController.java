package com.company.fermentation.controller;

import com.company.fermentation.analysis.ComparisonReportFormatter;
import com.company.fermentation.analysis.QualityComparator;
import com.company.fermentation.domain.Series;
import com.company.fermentation.domain.SeriesComparison;
import com.company.fermentation.dto.request.CompareRequest;
import com.company.fermentation.dto.request.SeriesPayload;
import com.company.fermentation.dto.response.ReferenceResponse;
import com.company.fermentation.reference.ReferenceModel;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Comparison", description = "Compare whole series against the reference trajectory")
@RequiredArgsConstructor
@Slf4j
public class ComparisonController {

    private final QualityComparator comparator;
    private final ComparisonReportFormatter reportFormatter;
    private final ReferenceModel referenceModel;

    @PostMapping("/comparisons")
    @Operation(
            summary = "Compare a series against the reference",
            description = "Deviation metrics, anomaly detection, similarity and an overall assessment. "
                    + "Uses the loaded reference unless one is supplied."
    )
    public ResponseEntity<SeriesComparison> compare(@RequestBody @Valid CompareRequest request) {
        SeriesComparison comparison = run(request);
        log.debug("Compared {} points: {}", comparison.getComparedPoints(),
                comparison.getAssessment().getOverallStatus());
        return ResponseEntity.ok(comparison);
    }

    @PostMapping(value = "/comparisons/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Compare a series and render the result as a text report")
    public ResponseEntity<String> report(@RequestBody @Valid CompareRequest request) {
        return ResponseEntity.ok(reportFormatter.format(run(request)));
    }

    @GetMapping("/reference")
    @Operation(summary = "The loaded reference trajectory and its statistics")
    public ResponseEntity<ReferenceResponse> reference() {
        ReferenceModel.Snapshot installed = referenceModel.requireSnapshot();
        Series series = installed.getSeries();
        return ResponseEntity.ok(ReferenceResponse.builder()
                .samples(series.size())
                .series(SeriesPayload.from(series))
                .statistics(referenceModel.getStatistics())
                .detectorThreshold(installed.getDetector().getThreshold())
                .build());
    }

    private SeriesComparison run(CompareRequest request) {
        Series generated = request.getGenerated().toSeries();
        if (request.getReference() != null) {
            return comparator.compare(generated, request.getReference().toSeries());
        }
        return comparator.compare(generated);
    }
}
