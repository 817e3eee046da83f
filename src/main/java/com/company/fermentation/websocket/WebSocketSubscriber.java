package com.company.fermentation.websocket;

import com.company.fermentation.broadcast.StreamMessage;
import com.company.fermentation.broadcast.Subscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Writes stream messages as JSON text frames to one WebSocket session.
 */
@Slf4j
public class WebSocketSubscriber implements Subscriber {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    /**
     * @param session expected to be thread-safe for sends, e.g. a
     *                {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
     */
    public WebSocketSubscriber(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(StreamMessage message) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SERVICE_OVERLOAD);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
