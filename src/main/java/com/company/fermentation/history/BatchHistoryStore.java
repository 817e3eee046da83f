package com.company.fermentation.history;

import com.company.fermentation.domain.ResultEnvelope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link HistoryLog} per batch, created on first append.
 */
@Component
public class BatchHistoryStore {

    private final Map<Integer, HistoryLog> logs = new ConcurrentHashMap<>();

    public void append(ResultEnvelope envelope) {
        logs.computeIfAbsent(envelope.getBatchNumber(), HistoryLog::new).append(envelope);
    }

    /**
     * Caps the history of a batch, creating its log if needed. 0 removes the cap.
     */
    public void retain(int batchId, int capacity) {
        logs.computeIfAbsent(batchId, HistoryLog::new).setCapacity(capacity);
    }

    public List<ResultEnvelope> history(int batchId) {
        HistoryLog log = logs.get(batchId);
        return log == null ? List.of() : log.snapshot();
    }

    public int size(int batchId) {
        HistoryLog log = logs.get(batchId);
        return log == null ? 0 : log.size();
    }

    public Optional<ResultEnvelope> latest(int batchId) {
        HistoryLog log = logs.get(batchId);
        return log == null ? Optional.empty() : log.latest();
    }

    /**
     * Latest envelope of every batch with data, ordered by batch id.
     */
    public List<ResultEnvelope> latestOfAll() {
        List<ResultEnvelope> latest = new ArrayList<>();
        new TreeMap<>(logs).values().forEach(log -> log.latest().ifPresent(latest::add));
        return latest;
    }

    /**
     * Full history of every batch with data, keyed and ordered by batch id.
     */
    public Map<Integer, List<ResultEnvelope>> all() {
        Map<Integer, List<ResultEnvelope>> all = new TreeMap<>();
        logs.forEach((id, log) -> all.put(id, log.snapshot()));
        return all;
    }
}
