package com.company.fermentation.history;

import com.company.fermentation.domain.ResultEnvelope;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only result log of one batch. Appended by the stream, read by HTTP and WebSocket
 * callers; every read returns a copy.
 *
 * <p>With a capacity set, appending beyond it evicts the oldest entries. A capacity of 0
 * keeps everything.
 */
public class HistoryLog {

    private final int batchId;
    private final Deque<ResultEnvelope> entries = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int capacity;

    public HistoryLog(int batchId) {
        this.batchId = batchId;
    }

    public void append(ResultEnvelope envelope) {
        if (envelope.getBatchNumber() != batchId) {
            throw new IllegalArgumentException(String.format(
                    "Envelope of batch %d appended to history of batch %d", envelope.getBatchNumber(), batchId));
        }
        lock.writeLock().lock();
        try {
            entries.addLast(envelope);
            evict();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Caps the log at {@code capacity} entries, trimming immediately. 0 removes the cap.
     */
    public void setCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("History capacity must not be negative, got " + capacity);
        }
        lock.writeLock().lock();
        try {
            this.capacity = capacity;
            evict();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getCapacity() {
        lock.readLock().lock();
        try {
            return capacity;
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock
    private void evict() {
        while (capacity > 0 && entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public List<ResultEnvelope> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ResultEnvelope> latest() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getBatchId() {
        return batchId;
    }
}
