package com.company.fermentation.broadcast;

import com.company.fermentation.domain.ResultEnvelope;

import java.util.List;

public interface Broadcaster {

    /**
     * Hands one tick's results to every subscriber. Must not block on subscriber I/O.
     */
    void publish(List<ResultEnvelope> results);

    void join(Subscriber subscriber);

    void leave(String subscriberId);

    int subscriberCount();
}
