package com.shlawgathon.recovery.backend.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process event bus. Dispatch is synchronous on the publishing thread.
 */
@Component
public class LocalAgentEventBus implements AgentEventBus {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentEventBus.class);

    // channel -> subscribers
    private final Map<String, List<Subscriber<?>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, Object payload) {
        List<Subscriber<?>> channelSubscribers = subscribers.get(channel);
        if (channelSubscribers == null || channelSubscribers.isEmpty()) {
            log.debug("[BUS] No subscribers for {}", channel);
            return;
        }

        for (Subscriber<?> subscriber : channelSubscribers) {
            try {
                subscriber.deliver(payload);
            } catch (RuntimeException e) {
                log.error("[BUS] Subscriber failed on {}", channel, e);
            }
        }
    }

    @Override
    public <T> Subscription subscribe(String channel, Class<T> payloadType, Consumer<? super T> listener) {
        Subscriber<T> subscriber = new Subscriber<>(payloadType, listener);
        List<Subscriber<?>> channelSubscribers = subscribers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>());
        channelSubscribers.add(subscriber);
        log.debug("[BUS] Subscribed {} listener to {}", payloadType.getSimpleName(), channel);
        return () -> channelSubscribers.remove(subscriber);
    }

    private record Subscriber<T>(Class<T> payloadType, Consumer<? super T> listener) {

        void deliver(Object payload) {
            if (payloadType.isInstance(payload)) {
                listener.accept(payloadType.cast(payload));
            }
        }
    }
}
