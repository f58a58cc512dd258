package com.shlawgathon.recovery.backend.events;

import java.util.function.Consumer;

/**
 * Publish/subscribe port for agent failure and recovery events.
 * Publishers and subscribers never reference each other directly.
 */
public interface AgentEventBus {

    /**
     * Deliver a payload to every subscriber of the channel whose payload type matches.
     * Subscriber exceptions are contained and never reach the publisher.
     */
    void publish(String channel, Object payload);

    /**
     * Subscribe to a channel. Payloads that are not instances of {@code payloadType} are skipped.
     */
    <T> Subscription subscribe(String channel, Class<T> payloadType, Consumer<? super T> listener);

    interface Subscription {
        void cancel();
    }
}
