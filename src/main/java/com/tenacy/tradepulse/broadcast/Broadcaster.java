package com.tenacy.tradepulse.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fan-out hub for live subscribers. Closed or failing subscribers are dropped
 * during a push without affecting the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Broadcaster {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public void join(Subscriber subscriber) {
        subscribers.put(subscriber.getId(), subscriber);
        log.info("Subscriber connected: {} (total {})", subscriber.getId(), subscribers.size());

        Map<String, Object> ack = Map.of("message", "Connected to diagnostic service");
        if (!deliver(subscriber, BroadcastMessage.CONNECTED, ack)) {
            subscribers.remove(subscriber.getId());
        }
    }

    public void leave(Subscriber subscriber) {
        if (subscribers.remove(subscriber.getId()) != null) {
            log.info("Subscriber disconnected: {} (total {})", subscriber.getId(), subscribers.size());
        }
    }

    /**
     * Pushes one frame to every open subscriber.
     *
     * @return number of subscribers the frame reached
     */
    public int broadcast(String type, Object data) {
        String payload;
        try {
            payload = serialize(type, data);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} broadcast: {}", type, e.getMessage());
            return 0;
        }

        int delivered = 0;
        for (Subscriber subscriber : subscribers.values()) {
            if (!subscriber.isOpen()) {
                subscribers.remove(subscriber.getId());
                log.debug("Pruned closed subscriber {}", subscriber.getId());
                continue;
            }
            try {
                subscriber.send(payload);
                delivered++;
            } catch (IOException | RuntimeException e) {
                subscribers.remove(subscriber.getId());
                log.debug("Dropped subscriber {} after failed push: {}", subscriber.getId(), e.getMessage());
            }
        }
        return delivered;
    }

    /**
     * Only {@code {"type":"ping"}} is answered; everything else is ignored.
     */
    public void handleInbound(Subscriber subscriber, String text) {
        String type = null;
        try {
            JsonNode node = objectMapper.readTree(text);
            type = node.path("type").asText(null);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed message from {}: {}", subscriber.getId(), e.getOriginalMessage());
        }

        if ("ping".equals(type)) {
            deliver(subscriber, BroadcastMessage.PONG, null);
        } else {
            log.debug("Ignoring message from {}: {}", subscriber.getId(), text);
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    private boolean deliver(Subscriber subscriber, String type, Object data) {
        try {
            subscriber.send(serialize(type, data));
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to send {} to {}: {}", type, subscriber.getId(), e.getMessage());
            return false;
        }
    }

    private String serialize(String type, Object data) throws JsonProcessingException {
        return objectMapper.writeValueAsString(BroadcastMessage.builder()
                .type(type)
                .data(data)
                .timestamp(clock.instant())
                .build());
    }
}
