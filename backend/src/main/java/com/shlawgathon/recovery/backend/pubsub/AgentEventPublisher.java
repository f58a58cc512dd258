package com.shlawgathon.recovery.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.recovery.backend.events.AgentChannels;
import com.shlawgathon.recovery.backend.events.AgentEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Relays failure and recovery events to Redis Pub/Sub so push layers and audit
 * sinks in other processes can follow them.
 */
@Component
public class AgentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AgentEventPublisher.class);

    public static final String AGENT_EVENTS_CHANNEL = "recovery:agent-events";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AgentEventBus eventBus;

    private final List<AgentEventBus.Subscription> subscriptions = new ArrayList<>();

    public AgentEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, AgentEventBus eventBus) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void start() {
        for (String channel : AgentChannels.ALL) {
            subscriptions.add(eventBus.subscribe(channel, Object.class, payload -> publishEvent(channel, payload)));
        }
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(AgentEventBus.Subscription::cancel);
        subscriptions.clear();
    }

    /**
     * Publish an event to the agent events channel.
     *
     * @param channel bus channel the event was raised on
     * @param payload event payload
     */
    public void publishEvent(String channel, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(new AgentEventMessage(channel, payload));
            redisTemplate.convertAndSend(AGENT_EVENTS_CHANNEL, json);
            log.debug("[PUB/SUB] Published {} event", channel);
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to publish {} event", channel, e);
        }
    }

    /**
     * Message wrapper for Redis Pub/Sub.
     */
    public record AgentEventMessage(String channel, Object payload) {
    }
}
