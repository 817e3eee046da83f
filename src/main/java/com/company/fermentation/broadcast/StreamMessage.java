package com.company.fermentation.broadcast;

import com.company.fermentation.domain.ResultEnvelope;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamMessage {

    public static final String BATCH_UPDATE = "batch_update";
    public static final String INITIAL_STATE = "initial_state";
    public static final String HISTORY_REPLAY = "history_replay";
    public static final String PONG = "pong";

    String type;
    Integer batchNumber;

    // batch_update
    ResultEnvelope data;

    // initial_state, history_replay
    List<ResultEnvelope> items;

    Instant timestamp;

    public static StreamMessage batchUpdate(ResultEnvelope envelope) {
        return StreamMessage.builder()
                .type(BATCH_UPDATE)
                .batchNumber(envelope.getBatchNumber())
                .data(envelope)
                .timestamp(Instant.now())
                .build();
    }

    public static StreamMessage initialState(List<ResultEnvelope> latest) {
        return StreamMessage.builder()
                .type(INITIAL_STATE)
                .items(latest)
                .timestamp(Instant.now())
                .build();
    }

    public static StreamMessage historyReplay(int batchNumber, List<ResultEnvelope> history) {
        return StreamMessage.builder()
                .type(HISTORY_REPLAY)
                .batchNumber(batchNumber)
                .items(history)
                .timestamp(Instant.now())
                .build();
    }

    public static StreamMessage pong() {
        return StreamMessage.builder()
                .type(PONG)
                .timestamp(Instant.now())
                .build();
    }
}
