package com.company.fermentation.broadcast;

import java.io.IOException;

/**
 * A consumer of stream messages, typically one WebSocket connection.
 */
public interface Subscriber {

    String getId();

    void send(StreamMessage message) throws IOException;

    void close();
}
