package com.tenacy.tradepulse.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.util.MutableClock;
import com.tenacy.tradepulse.util.TestObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BroadcasterTest {

    private ObjectMapper objectMapper;
    private Broadcaster broadcaster;

    @BeforeEach
    void setUp() {
        objectMapper = TestObjectMappers.json();
        broadcaster = new Broadcaster(objectMapper, new MutableClock(Instant.parse("2026-03-01T12:00:00Z")));
    }

    private static class RecordingSubscriber implements Subscriber {
        private final String id;
        private final List<String> frames = new ArrayList<>();
        private boolean open = true;
        private boolean failing;

        RecordingSubscriber(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String payload) throws IOException {
            if (failing) {
                throw new IOException("broken pipe");
            }
            frames.add(payload);
        }
    }

    @Test
    @DisplayName("접속하면 connected 프레임을 받는다")
    void join_ShouldSendConnectedFrame() throws Exception {
        // given
        RecordingSubscriber subscriber = new RecordingSubscriber("s1");

        // when
        broadcaster.join(subscriber);

        // then
        assertEquals(1, broadcaster.getSubscriberCount());
        JsonNode frame = objectMapper.readTree(subscriber.frames.get(0));
        assertEquals("connected", frame.get("type").asText());
        assertEquals("Connected to diagnostic service", frame.get("data").get("message").asText());
    }

    @Test
    @DisplayName("닫히거나 실패한 구독자는 제거되고 나머지는 계속 받는다")
    void broadcast_ShouldPruneDeadSubscribers() throws Exception {
        // given
        RecordingSubscriber healthy = new RecordingSubscriber("healthy");
        RecordingSubscriber closed = new RecordingSubscriber("closed");
        RecordingSubscriber failing = new RecordingSubscriber("failing");
        broadcaster.join(healthy);
        broadcaster.join(closed);
        broadcaster.join(failing);
        closed.open = false;
        failing.failing = true;

        // when
        int delivered = broadcaster.broadcast(BroadcastMessage.METRICS, Map.of("cpuUsage", 12.5));

        // then
        assertEquals(1, delivered);
        assertEquals(1, broadcaster.getSubscriberCount());
        JsonNode frame = objectMapper.readTree(healthy.frames.get(1));
        assertEquals("metrics", frame.get("type").asText());
        assertEquals(12.5, frame.get("data").get("cpuUsage").asDouble());
        assertTrue(frame.hasNonNull("timestamp"));
    }

    @Test
    @DisplayName("ping 에는 pong 으로 답하고 그 외 메시지는 무시")
    void handleInbound_ShouldAnswerPingOnly() throws Exception {
        // given
        RecordingSubscriber subscriber = new RecordingSubscriber("s1");
        broadcaster.join(subscriber);

        // when
        broadcaster.handleInbound(subscriber, "{\"type\":\"ping\"}");
        broadcaster.handleInbound(subscriber, "{\"type\":\"subscribe\"}");
        broadcaster.handleInbound(subscriber, "not json");

        // then
        assertEquals(2, subscriber.frames.size());
        assertEquals("pong", objectMapper.readTree(subscriber.frames.get(1)).get("type").asText());
    }

    @Test
    @DisplayName("구독자가 떠나면 더 이상 받지 않는다")
    void leave_ShouldStopDelivery() {
        RecordingSubscriber subscriber = new RecordingSubscriber("s1");
        broadcaster.join(subscriber);

        broadcaster.leave(subscriber);

        assertEquals(0, broadcaster.broadcast(BroadcastMessage.HEALTH, Map.of()));
        assertEquals(1, subscriber.frames.size());
    }
}
