package com.company.fermentation.stream;

import com.company.fermentation.alert.AlertMessages;
import com.company.fermentation.alert.AlertStateMachine;
import com.company.fermentation.analysis.QualityComparator;
import com.company.fermentation.broadcast.Broadcaster;
import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.BatchCursor;
import com.company.fermentation.domain.BatchDataPoint;
import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.ComparisonReport;
import com.company.fermentation.domain.ResultEnvelope;
import com.company.fermentation.domain.enums.CursorMode;
import com.company.fermentation.domain.enums.CursorState;
import com.company.fermentation.exception.InvalidBatchException;
import com.company.fermentation.history.BatchHistoryStore;
import com.company.fermentation.reference.ReferenceModel;
import com.company.fermentation.source.BatchProfileSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Advances every batch by one sample per tick.
 *
 * <p>Batches are processed in id order within a tick; for each one the sample is compared to
 * the reference, appended to history and checked for a status change. The tick's results are
 * broadcast together once all batches are done. Each cursor opens lazily on its first tick
 * and, at the end of its profile, halts or wraps according to {@code cursor-mode}. When every
 * batch has halted the stream is finished and further ticks return nothing.
 */
@Slf4j
@Service
public class StreamOrchestrator {

    static final String MDC_BATCH_ID = "batchId";

    private final BatchProfileSource profileSource;
    private final QualityComparator comparator;
    private final BatchHistoryStore historyStore;
    private final AlertStateMachine alertStateMachine;
    private final Broadcaster broadcaster;
    private final ReferenceModel referenceModel;
    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    private final List<BatchCursor> cursors;
    private long tickCount;
    private volatile boolean finished;
    private boolean referenceWarningLogged;

    public StreamOrchestrator(BatchProfileSource profileSource,
                              QualityComparator comparator,
                              BatchHistoryStore historyStore,
                              AlertStateMachine alertStateMachine,
                              Broadcaster broadcaster,
                              ReferenceModel referenceModel,
                              MonitoringProperties properties,
                              MeterRegistry meterRegistry) {
        this.profileSource = profileSource;
        this.comparator = comparator;
        this.historyStore = historyStore;
        this.alertStateMachine = alertStateMachine;
        this.broadcaster = broadcaster;
        this.referenceModel = referenceModel;
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        int batchCount = properties.getStream().getBatchCount();
        List<BatchCursor> initial = new ArrayList<>(batchCount);
        for (int id = 1; id <= batchCount; id++) {
            initial.add(BatchCursor.builder()
                    .batchId(id)
                    .state(CursorState.IDLE)
                    .build());
        }
        this.cursors = Collections.unmodifiableList(initial);
    }

    /**
     * Runs one tick.
     *
     * @return one envelope per batch that produced a sample, in batch order; empty once the
     * stream is finished, while the reference is unavailable, or while gated on subscribers
     */
    public synchronized List<ResultEnvelope> tick() {
        if (finished) {
            return List.of();
        }
        if (!referenceModel.isAvailable()) {
            if (!referenceWarningLogged) {
                log.warn("Reference trajectory unavailable, stream is paused");
                referenceWarningLogged = true;
            }
            return List.of();
        }
        referenceWarningLogged = false;
        if (properties.getStream().isRequireSubscribers() && broadcaster.subscriberCount() == 0) {
            log.debug("No subscribers, skipping tick");
            return List.of();
        }

        Timer.Sample timer = Timer.start(meterRegistry);
        long tick = ++tickCount;
        List<ResultEnvelope> results = new ArrayList<>(cursors.size());

        for (BatchCursor cursor : cursors) {
            if (cursor.isExhausted()) {
                continue;
            }
            MDC.put(MDC_BATCH_ID, String.valueOf(cursor.getBatchId()));
            try {
                advance(cursor, tick).ifPresent(results::add);
            } catch (RuntimeException e) {
                // The cursor did not move; the batch is retried next tick
                log.error("Tick {} failed for batch {}", tick, cursor.getBatchId(), e);
                meterRegistry.counter("fermentation.batches.failed",
                        "batch", String.valueOf(cursor.getBatchId())
                ).increment();
            } finally {
                MDC.remove(MDC_BATCH_ID);
            }
        }

        if (cursors.stream().allMatch(BatchCursor::isExhausted)) {
            finished = true;
            log.info("All {} batches exhausted after {} ticks, stream finished", cursors.size(), tick);
        }

        if (!results.isEmpty()) {
            broadcaster.publish(results);
        }

        meterRegistry.counter("fermentation.ticks").increment();
        timer.stop(meterRegistry.timer("fermentation.tick.duration"));
        log.debug("Tick {} produced {} results", tick, results.size());

        return results;
    }

    private Optional<ResultEnvelope> advance(BatchCursor cursor, long tick) {
        if (cursor.getState() == CursorState.IDLE) {
            open(cursor);
        }
        if (!cursor.hasNext()) {
            // Empty profile
            exhaust(cursor);
            return Optional.empty();
        }

        BatchProfile profile = cursor.getProfile();
        int index = cursor.getPosition();
        BatchDataPoint dataPoint = BatchDataPoint.from(profile, index);
        ComparisonReport report = comparator.compareTick(profile, index);

        ResultEnvelope envelope = ResultEnvelope.builder()
                .batchNumber(cursor.getBatchId())
                .tick(tick)
                .dataPoint(dataPoint)
                .comparison(report)
                .producedAt(Instant.now())
                .build();

        historyStore.append(envelope);

        alertStateMachine.check(cursor.getBatchId(), report.getOverallStatus())
                .ifPresent(previous -> alertStateMachine.notify(
                        cursor.getBatchId(),
                        report.getOverallStatus(),
                        previous,
                        AlertMessages.details(report.getActual())));

        cursor.setStatus(report.getOverallStatus());
        cursor.setSamplesProcessed(cursor.getSamplesProcessed() + 1);
        cursor.setPosition(index + 1);

        if (!cursor.hasNext()) {
            if (properties.getStream().getCursorMode() == CursorMode.WRAP) {
                cursor.setPosition(0);
                cursor.setWraps(cursor.getWraps() + 1);
                log.info("Batch {} reached the end of its profile, restarting (wrap {})",
                        cursor.getBatchId(), cursor.getWraps());
            } else {
                exhaust(cursor);
            }
        }
        return Optional.of(envelope);
    }

    private void open(BatchCursor cursor) {
        BatchProfile profile = profileSource.load(cursor.getBatchId());
        cursor.setProfile(profile);
        cursor.setPosition(0);
        cursor.setState(CursorState.STREAMING);
        int retention = historyRetention(profile);
        if (retention > 0) {
            historyStore.retain(cursor.getBatchId(), retention);
        }
        log.info("Batch {} streaming: {} ({} samples, history retention {})",
                cursor.getBatchId(), profile.getBatchStatus(), profile.totalSamples(), retention);
    }

    private int historyRetention(BatchProfile profile) {
        MonitoringProperties.Stream stream = properties.getStream();
        if (stream.getHistoryRetention() > 0) {
            return stream.getHistoryRetention();
        }
        if (stream.getCursorMode() == CursorMode.WRAP) {
            return Math.max(1, profile.totalSamples());
        }
        return 0;
    }

    private void exhaust(BatchCursor cursor) {
        cursor.setState(CursorState.EXHAUSTED);
        meterRegistry.counter("fermentation.batches.exhausted").increment();
        log.info("Batch {} exhausted after {} samples", cursor.getBatchId(), cursor.getSamplesProcessed());
    }

    public boolean isFinished() {
        return finished;
    }

    public synchronized long getTickCount() {
        return tickCount;
    }

    public int getBatchCount() {
        return cursors.size();
    }

    public void requireBatch(int batchId) {
        if (batchId < 1 || batchId > cursors.size()) {
            throw new InvalidBatchException(batchId, cursors.size());
        }
    }

    public synchronized CursorState cursorState(int batchId) {
        requireBatch(batchId);
        return cursors.get(batchId - 1).getState();
    }

    public synchronized long streamingBatches() {
        return cursors.stream().filter(c -> c.getState() == CursorState.STREAMING).count();
    }

    /**
     * Profile of a batch whose cursor has opened.
     */
    public synchronized Optional<BatchProfile> profile(int batchId) {
        requireBatch(batchId);
        return Optional.ofNullable(cursors.get(batchId - 1).getProfile());
    }

    public List<ResultEnvelope> history(int batchId) {
        requireBatch(batchId);
        return historyStore.history(batchId);
    }

    public Optional<ResultEnvelope> latest(int batchId) {
        requireBatch(batchId);
        return historyStore.latest(batchId);
    }
}
