package com.company.fermentation.service;

import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.ComparisonReport;
import com.company.fermentation.domain.ResultEnvelope;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.dto.response.BatchHistoryResponse;
import com.company.fermentation.dto.response.BatchStatusResponse;
import com.company.fermentation.dto.response.ExportResponse;
import com.company.fermentation.dto.response.SummaryResponse;
import com.company.fermentation.exception.BatchDataNotAvailableException;
import com.company.fermentation.history.BatchHistoryStore;
import com.company.fermentation.stream.StreamOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the stream: latest results, history, summaries and exports.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchQueryService {

    private final StreamOrchestrator orchestrator;
    private final BatchHistoryStore historyStore;

    public List<BatchStatusResponse> getAllBatches() {
        List<BatchStatusResponse> batches = new ArrayList<>(orchestrator.getBatchCount());
        for (int id = 1; id <= orchestrator.getBatchCount(); id++) {
            batches.add(toStatus(id));
        }
        return batches;
    }

    public BatchStatusResponse getBatch(int batchId) {
        orchestrator.requireBatch(batchId);
        if (orchestrator.latest(batchId).isEmpty()) {
            throw new BatchDataNotAvailableException(batchId);
        }
        return toStatus(batchId);
    }

    public BatchHistoryResponse getHistory(int batchId) {
        List<ResultEnvelope> history = requireHistory(batchId);
        return BatchHistoryResponse.builder()
                .batchNumber(batchId)
                .totalDataPoints(history.size())
                .history(history)
                .retrievedAt(Instant.now())
                .build();
    }

    /**
     * History of one batch, rejecting unknown ids and batches without data.
     */
    public List<ResultEnvelope> requireHistory(int batchId) {
        List<ResultEnvelope> history = orchestrator.history(batchId);
        if (history.isEmpty()) {
            throw new BatchDataNotAvailableException(batchId);
        }
        return history;
    }

    public Map<Integer, List<ResultEnvelope>> requireAllHistory() {
        Map<Integer, List<ResultEnvelope>> all = historyStore.all();
        if (all.isEmpty()) {
            throw new BatchDataNotAvailableException();
        }
        return all;
    }

    public ExportResponse exportAll() {
        Map<Integer, List<ResultEnvelope>> all = requireAllHistory();
        return ExportResponse.builder()
                .format("json")
                .totalRecords(all.values().stream().mapToInt(List::size).sum())
                .batches(all)
                .generatedAt(Instant.now())
                .build();
    }

    public SummaryResponse getSummary() {
        List<ResultEnvelope> latest = historyStore.latestOfAll();

        Map<String, Long> distribution = new LinkedHashMap<>();
        for (QualityBand band : QualityBand.values()) {
            distribution.put(band.getLabel(), 0L);
        }
        DoubleSummaryStatistics scores = new DoubleSummaryStatistics();
        List<Integer> attention = new ArrayList<>();

        for (ResultEnvelope envelope : latest) {
            ComparisonReport comparison = envelope.getComparison();
            QualityBand band = comparison.getOverallStatus();
            distribution.merge(band.getLabel(), 1L, Long::sum);
            scores.accept(comparison.getQualityScore());
            if (band.needsAttention()) {
                attention.add(envelope.getBatchNumber());
            }
        }

        boolean empty = latest.isEmpty();
        return SummaryResponse.builder()
                .totalActiveBatches(latest.size())
                .statusDistribution(distribution)
                .averageQualityScore(empty ? 0.0 : scores.getAverage())
                .minQualityScore(empty ? 0.0 : scores.getMin())
                .maxQualityScore(empty ? 0.0 : scores.getMax())
                .batchesNeedingAttention(attention.size())
                .attentionBatchNumbers(attention)
                .tick(orchestrator.getTickCount())
                .streamFinished(orchestrator.isFinished())
                .retrievedAt(Instant.now())
                .build();
    }

    private BatchStatusResponse toStatus(int batchId) {
        Optional<ResultEnvelope> latest = orchestrator.latest(batchId);
        Optional<BatchProfile> profile = orchestrator.profile(batchId);

        BatchStatusResponse.BatchStatusResponseBuilder response = BatchStatusResponse.builder()
                .batchNumber(batchId)
                .cursorState(orchestrator.cursorState(batchId))
                .samplesProcessed(historyStore.size(batchId));

        profile.ifPresent(p -> response
                .batchStatus(p.getBatchStatus())
                .expectedQuality(p.getExpectedQualityScore())
                .description(p.getDescription())
                .totalSamples(p.totalSamples()));

        latest.ifPresent(envelope -> response
                .currentStatus(envelope.getComparison().getOverallStatus())
                .qualityScore(envelope.getComparison().getQualityScore())
                .latest(envelope));

        return response.build();
    }
}
