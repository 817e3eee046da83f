package com.company.fermentation.broadcast;

import com.company.fermentation.SeriesFixtures;
import com.company.fermentation.alert.AlertStateMachine;
import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.ResultEnvelope;
import com.company.fermentation.domain.Series;
import com.company.fermentation.history.BatchHistoryStore;
import com.company.fermentation.reference.ReferenceModel;
import com.company.fermentation.source.BatchProfileSource;
import com.company.fermentation.stream.StreamOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fan-out broadcaster")
class FanOutBroadcasterTest {

    private MonitoringProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new MonitoringProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    private FanOutBroadcaster broadcaster(Executor executor) {
        return new FanOutBroadcaster(executor, properties, meterRegistry);
    }

    @Test
    @DisplayName("A joining subscriber gets the initial state, then a replay per batch")
    void joinSendsSnapshotAndReplay() {
        properties.getStream().setReplayWindow(1);
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        broadcaster.publish(List.of(envelope(1, 1), envelope(2, 1)));
        broadcaster.publish(List.of(envelope(1, 2)));
        RecordingSubscriber subscriber = new RecordingSubscriber("a");

        broadcaster.join(subscriber);

        assertEquals(List.of(StreamMessage.INITIAL_STATE, StreamMessage.HISTORY_REPLAY, StreamMessage.HISTORY_REPLAY),
                subscriber.types());
        assertEquals(2, subscriber.received.get(0).getItems().size());
        StreamMessage replay = subscriber.received.get(1);
        assertEquals(1, replay.getBatchNumber());
        assertEquals(1, replay.getItems().size());
        assertEquals(2L, replay.getItems().get(0).getTick());
    }

    @Test
    @DisplayName("Without a replay window the join sends the initial state only")
    void noReplayWindow() {
        properties.getStream().setReplayWindow(0);
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        broadcaster.publish(List.of(envelope(1, 1), envelope(1, 2)));
        RecordingSubscriber subscriber = new RecordingSubscriber("a");

        broadcaster.join(subscriber);

        assertEquals(List.of(StreamMessage.INITIAL_STATE), subscriber.types());
        assertEquals(2L, subscriber.received.get(0).getItems().get(0).getTick());
    }

    @Test
    @DisplayName("A subscriber joining during a tick sees only published ticks, then each new result once")
    void joinDuringTick() {
        properties.getStream().setBatchCount(2);
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        RecordingSubscriber late = new RecordingSubscriber("late");
        Series reference = SeriesFixtures.ph(5.5, 5.47, 5.44);
        ReferenceModel referenceModel = SeriesFixtures.referenceModel(properties, reference);
        BatchHistoryStore historyStore = new BatchHistoryStore();
        BatchProfileSource profileSource = batchId -> {
            if (batchId == 2) {
                // Batch 1 is already in history but not yet published
                broadcaster.join(late);
            }
            return SeriesFixtures.profile(batchId, reference);
        };
        StreamOrchestrator orchestrator = new StreamOrchestrator(profileSource,
                SeriesFixtures.comparator(properties, referenceModel), historyStore,
                new AlertStateMachine(event -> { }, meterRegistry, properties),
                broadcaster, referenceModel, properties, meterRegistry);

        orchestrator.tick();

        assertEquals(1, historyStore.size(1));
        assertEquals(List.of(StreamMessage.INITIAL_STATE, StreamMessage.BATCH_UPDATE, StreamMessage.BATCH_UPDATE),
                late.types());
        assertTrue(late.received.get(0).getItems().isEmpty());
        assertEquals(1, late.received.get(1).getBatchNumber());
        assertEquals(2, late.received.get(2).getBatchNumber());
    }

    @Test
    @DisplayName("A join after a tick sees every batch at that same tick")
    void joinAfterTickIsConsistent() {
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        broadcaster.publish(List.of(envelope(1, 1), envelope(2, 1), envelope(3, 1)));
        broadcaster.publish(List.of(envelope(1, 2), envelope(2, 2), envelope(3, 2)));
        RecordingSubscriber subscriber = new RecordingSubscriber("a");

        broadcaster.join(subscriber);

        List<ResultEnvelope> latest = subscriber.received.get(0).getItems();
        assertEquals(List.of(1, 2, 3), latest.stream().map(ResultEnvelope::getBatchNumber).toList());
        assertTrue(latest.stream().allMatch(e -> e.getTick() == 2L));
    }

    @Test
    @DisplayName("Every subscriber receives each update in publish order")
    void publishFansOut() {
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        RecordingSubscriber a = new RecordingSubscriber("a");
        RecordingSubscriber b = new RecordingSubscriber("b");
        broadcaster.join(a);
        broadcaster.join(b);

        broadcaster.publish(List.of(envelope(1, 1), envelope(2, 1)));

        for (RecordingSubscriber subscriber : List.of(a, b)) {
            assertEquals(List.of(StreamMessage.INITIAL_STATE, StreamMessage.BATCH_UPDATE, StreamMessage.BATCH_UPDATE),
                    subscriber.types());
            assertEquals(1, subscriber.received.get(1).getBatchNumber());
            assertEquals(2, subscriber.received.get(2).getBatchNumber());
        }
        assertEquals(2.0, meterRegistry.get("fermentation.broadcast.messages").counter().count());
    }

    @Test
    @DisplayName("A failing subscriber is dropped without affecting the others")
    void failingSubscriberDropped() {
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        RecordingSubscriber healthy = new RecordingSubscriber("healthy");
        RecordingSubscriber broken = new RecordingSubscriber("broken");
        broadcaster.join(healthy);
        broadcaster.join(broken);
        broken.failing = true;

        broadcaster.publish(List.of(envelope(1, 1)));

        assertTrue(broken.closed);
        assertEquals(1, broadcaster.subscriberCount());
        assertEquals(2, healthy.received.size());
        assertEquals(1.0, meterRegistry.get("fermentation.broadcast.subscribers.dropped")
                .tag("reason", "send failed").counter().count());
    }

    @Test
    @DisplayName("A subscriber whose queue overflows is dropped")
    void slowSubscriberDropped() {
        properties.getBroadcast().setSubscriberQueueCapacity(2);
        List<Runnable> pending = new ArrayList<>();
        FanOutBroadcaster broadcaster = broadcaster(pending::add);
        RecordingSubscriber slow = new RecordingSubscriber("slow");
        broadcaster.join(slow);

        broadcaster.publish(List.of(envelope(1, 1)));
        assertEquals(1, broadcaster.subscriberCount());

        broadcaster.publish(List.of(envelope(1, 2)));

        assertEquals(0, broadcaster.subscriberCount());
        assertTrue(slow.closed);
        assertEquals(1, pending.size());
        assertEquals(1.0, meterRegistry.get("fermentation.broadcast.subscribers.dropped")
                .tag("reason", "queue full").counter().count());
    }

    @Test
    @DisplayName("Replies go to one subscriber only and departed subscribers receive nothing")
    void replyAndLeave() {
        FanOutBroadcaster broadcaster = broadcaster(Runnable::run);
        RecordingSubscriber a = new RecordingSubscriber("a");
        RecordingSubscriber b = new RecordingSubscriber("b");
        broadcaster.join(a);
        broadcaster.join(b);

        broadcaster.reply("a", StreamMessage.pong());
        broadcaster.leave("b");
        broadcaster.publish(List.of(envelope(1, 1)));

        assertEquals(List.of(StreamMessage.INITIAL_STATE, StreamMessage.PONG, StreamMessage.BATCH_UPDATE), a.types());
        assertEquals(List.of(StreamMessage.INITIAL_STATE), b.types());
        assertEquals(1, broadcaster.subscriberCount());
    }

    private static ResultEnvelope envelope(int batchNumber, long tick) {
        return ResultEnvelope.builder()
                .batchNumber(batchNumber)
                .tick(tick)
                .build();
    }

    private static final class RecordingSubscriber implements Subscriber {
        private final String id;
        private final List<StreamMessage> received = new ArrayList<>();
        private boolean failing;
        private boolean closed;

        private RecordingSubscriber(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void send(StreamMessage message) throws IOException {
            if (failing) {
                throw new IOException("connection reset");
            }
            received.add(message);
        }

        @Override
        public void close() {
            closed = true;
        }

        List<String> types() {
            return received.stream().map(StreamMessage::getType).toList();
        }
    }
}
