package com.company.fermentation.websocket;

import com.company.fermentation.broadcast.FanOutBroadcaster;
import com.company.fermentation.config.MonitoringProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("WebSocket stream handler")
class BatchStreamWebSocketHandlerTest {

    private FanOutBroadcaster broadcaster;
    private BatchStreamWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        MonitoringProperties properties = new MonitoringProperties();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        broadcaster = new FanOutBroadcaster(Runnable::run, properties, new SimpleMeterRegistry());
        handler = new BatchStreamWebSocketHandler(broadcaster, objectMapper, properties);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    @Test
    @DisplayName("A new session receives the initial state")
    void initialState() throws Exception {
        handler.afterConnectionEstablished(session);

        assertEquals(1, broadcaster.subscriberCount());
        assertTrue(sentPayloads().get(0).contains("\"type\":\"initial_state\""));
    }

    @Test
    @DisplayName("A ping is answered with a pong")
    void pingPong() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleTextMessage(session, new TextMessage("not json"));

        List<String> payloads = sentPayloads();
        assertEquals(2, payloads.size());
        assertTrue(payloads.get(1).contains("\"type\":\"pong\""));
    }

    @Test
    @DisplayName("Closing the session unsubscribes it")
    void close() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, broadcaster.subscriberCount());
    }

    @SuppressWarnings("unchecked")
    private List<String> sentPayloads() throws Exception {
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass((Class) WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> (String) m.getPayload()).toList();
    }
}
