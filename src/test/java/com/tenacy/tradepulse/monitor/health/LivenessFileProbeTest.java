package com.tenacy.tradepulse.monitor.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class LivenessFileProbeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private Path healthFile;
    private LivenessFileProbe probe;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        healthFile = tempDir.resolve("bot_health.json");
        LivenessFileReader reader = new LivenessFileReader(healthFile, new ObjectMapper(), clock);
        probe = new LivenessFileProbe("tradingAgent", reader, 60, clock);
    }

    @Test
    @DisplayName("파일이 없으면 critical 이며 오류 설명을 남긴다")
    void check_ShouldBeCriticalWhenFileMissing() {
        ComponentHealthSnapshot snapshot = probe.check();

        assertEquals(HealthStatus.CRITICAL, snapshot.getStatus());
        assertEquals("Health file not found - agent may not be running", snapshot.getDetails().get("error"));
    }

    @Test
    @DisplayName("is_alive=false 이면 heartbeat 와 무관하게 critical")
    void check_ShouldBeCriticalWhenNotAlive() throws Exception {
        writeReport(false, NOW.minusSeconds(1).toString(), false);

        assertEquals(HealthStatus.CRITICAL, probe.check().getStatus());
    }

    @Test
    @DisplayName("heartbeat 나이에 따른 상태 분류")
    void check_ShouldClassifyByHeartbeatAge() throws Exception {
        writeReport(true, NOW.minusSeconds(10).toString(), false);
        assertEquals(HealthStatus.HEALTHY, probe.check().getStatus());

        writeReport(true, NOW.minusSeconds(60).toString(), false);
        assertEquals(HealthStatus.HEALTHY, probe.check().getStatus());

        writeReport(true, NOW.minusSeconds(90).toString(), false);
        ComponentHealthSnapshot warning = probe.check();
        assertEquals(HealthStatus.WARNING, warning.getStatus());
        assertEquals(90L, warning.getDetails().get("heartbeat_age"));

        writeReport(true, NOW.minusSeconds(120).toString(), false);
        assertEquals(HealthStatus.CRITICAL, probe.check().getStatus());
    }

    @Test
    @DisplayName("브레이커는 healthy 를 warning 으로만 올린다")
    void check_ShouldRaiseHealthyToWarningOnBreaker() throws Exception {
        writeReport(true, NOW.minusSeconds(5).toString(), true);
        assertEquals(HealthStatus.WARNING, probe.check().getStatus());

        writeReport(true, NOW.minusSeconds(200).toString(), true);
        assertEquals(HealthStatus.CRITICAL, probe.check().getStatus());
    }

    @Test
    @DisplayName("오프셋 없는 timestamp 와 epoch 초 모두 해석")
    void check_ShouldParseNaiveAndEpochHeartbeats() throws Exception {
        writeReport(true, "2026-03-01T11:59:50.123456", false);
        assertEquals(HealthStatus.HEALTHY, probe.check().getStatus());

        Files.writeString(healthFile, "{\"is_alive\": true, \"last_heartbeat\": "
                + (NOW.getEpochSecond() - 75) + ".5}");
        assertEquals(HealthStatus.WARNING, probe.check().getStatus());
    }

    @Test
    @DisplayName("손상된 파일은 critical")
    void check_ShouldBeCriticalOnMalformedFile() throws Exception {
        Files.writeString(healthFile, "{broken");

        ComponentHealthSnapshot snapshot = probe.check();

        assertEquals(HealthStatus.CRITICAL, snapshot.getStatus());
        assertNotNull(snapshot.getDetails().get("error"));
    }

    private void writeReport(boolean alive, String heartbeat, boolean breaker) throws Exception {
        Files.writeString(healthFile, String.format(
                "{\"is_alive\": %s, \"last_heartbeat\": \"%s\", \"circuit_breaker_active\": %s, "
                        + "\"signals_count\": 12, \"trades_count\": 3, \"errors_count\": 0}",
                alive, heartbeat, breaker));
    }
}
