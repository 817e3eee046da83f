package com.company.fermentation.broadcast;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.ResultEnvelope;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers messages through a bounded queue per subscriber, drained on the broadcast pool.
 *
 * <p>Publishing only enqueues. A subscriber whose queue is full or whose send fails is
 * dropped; the others are unaffected. At most one drain task runs per subscriber, so each
 * subscriber sees messages in publish order.
 *
 * <p>The snapshot and replay sent on join are built from what has been published, never from
 * history still being written by a tick in progress.
 */
@Slf4j
@Component
public class FanOutBroadcaster implements Broadcaster {

    private final Executor executor;
    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    // Orders joins against publishes, so a joining subscriber gets its snapshot before later updates
    private final Object enqueueLock = new Object();

    // Most recent published envelopes per batch, guarded by enqueueLock
    private final Map<Integer, Deque<ResultEnvelope>> published = new TreeMap<>();

    public FanOutBroadcaster(@Qualifier("broadcastExecutor") Executor executor,
                             MonitoringProperties properties,
                             MeterRegistry meterRegistry) {
        this.executor = executor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void publish(List<ResultEnvelope> results) {
        if (results.isEmpty()) {
            return;
        }
        synchronized (enqueueLock) {
            for (ResultEnvelope envelope : results) {
                record(envelope);
                StreamMessage message = StreamMessage.batchUpdate(envelope);
                for (Channel channel : channels.values()) {
                    enqueue(channel, message);
                }
            }
        }
        meterRegistry.counter("fermentation.broadcast.messages").increment(results.size());
        channels.values().forEach(this::scheduleDrain);
    }

    @Override
    public void join(Subscriber subscriber) {
        Channel channel = new Channel(subscriber, properties.getBroadcast().getSubscriberQueueCapacity());
        synchronized (enqueueLock) {
            channels.put(subscriber.getId(), channel);
            List<ResultEnvelope> latest = new ArrayList<>(published.size());
            published.values().forEach(recent -> latest.add(recent.peekLast()));
            enqueue(channel, StreamMessage.initialState(latest));
            if (properties.getStream().getReplayWindow() > 0) {
                published.forEach((batchId, recent) ->
                        enqueue(channel, StreamMessage.historyReplay(batchId, List.copyOf(recent))));
            }
        }
        log.info("Subscriber {} joined, {} connected", subscriber.getId(), channels.size());
        scheduleDrain(channel);
    }

    @Override
    public void leave(String subscriberId) {
        Channel channel = channels.remove(subscriberId);
        if (channel != null) {
            channel.queue.clear();
            log.info("Subscriber {} left, {} connected", subscriberId, channels.size());
        }
    }

    @Override
    public int subscriberCount() {
        return channels.size();
    }

    /**
     * Queues a message for one subscriber only, e.g. a pong.
     */
    public void reply(String subscriberId, StreamMessage message) {
        Channel channel = channels.get(subscriberId);
        if (channel != null) {
            enqueue(channel, message);
            scheduleDrain(channel);
        }
    }

    // Caller holds enqueueLock
    private void record(ResultEnvelope envelope) {
        Deque<ResultEnvelope> recent = published.computeIfAbsent(envelope.getBatchNumber(), id -> new ArrayDeque<>());
        recent.addLast(envelope);
        int keep = Math.max(1, properties.getStream().getReplayWindow());
        while (recent.size() > keep) {
            recent.removeFirst();
        }
    }

    private void enqueue(Channel channel, StreamMessage message) {
        if (!channel.queue.offer(message)) {
            drop(channel, "queue full");
        }
    }

    private void scheduleDrain(Channel channel) {
        if (channel.queue.isEmpty() || !channels.containsKey(channel.subscriber.getId())) {
            return;
        }
        if (!channel.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> drain(channel));
        } catch (RejectedExecutionException e) {
            channel.draining.set(false);
            log.warn("Broadcast pool rejected delivery to subscriber {}", channel.subscriber.getId());
        }
    }

    private void drain(Channel channel) {
        try {
            StreamMessage message;
            while (channels.containsKey(channel.subscriber.getId()) && (message = channel.queue.poll()) != null) {
                channel.subscriber.send(message);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Delivery to subscriber {} failed: {}", channel.subscriber.getId(), e.getMessage());
            drop(channel, "send failed");
        } finally {
            channel.draining.set(false);
        }
        // Messages enqueued after the last poll but before the flag was cleared
        scheduleDrain(channel);
    }

    private void drop(Channel channel, String reason) {
        String id = channel.subscriber.getId();
        if (channels.remove(id, channel)) {
            channel.queue.clear();
            meterRegistry.counter("fermentation.broadcast.subscribers.dropped", "reason", reason).increment();
            log.warn("Dropped subscriber {}: {}", id, reason);
            channel.subscriber.close();
        }
    }

    private static final class Channel {
        private final Subscriber subscriber;
        private final BlockingQueue<StreamMessage> queue;
        private final AtomicBoolean draining = new AtomicBoolean();

        private Channel(Subscriber subscriber, int capacity) {
            this.subscriber = subscriber;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }
    }
}
