package com.company.fermentation.websocket;

import com.company.fermentation.broadcast.FanOutBroadcaster;
import com.company.fermentation.broadcast.StreamMessage;
import com.company.fermentation.config.MonitoringProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds WebSocket sessions to the broadcaster. Clients receive the current state and recent
 * history on connect, then every batch update. A {@code {"type":"ping"}} is answered with a pong.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchStreamWebSocketHandler extends TextWebSocketHandler {

    private final FanOutBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final MonitoringProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        MonitoringProperties.Broadcast config = properties.getBroadcast();
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, config.getSendTimeLimitMs(), config.getBufferSizeLimit());
        broadcaster.join(new WebSocketSubscriber(concurrent, objectMapper));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            JsonNode node = objectMapper.readTree(message.getPayload());
            if ("ping".equals(node.path("type").asText())) {
                broadcaster.reply(session.getId(), StreamMessage.pong());
            } else {
                log.debug("Ignoring message from {}: {}", session.getId(), node.path("type").asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed message from {}", session.getId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        broadcaster.leave(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.leave(session.getId());
    }
}
