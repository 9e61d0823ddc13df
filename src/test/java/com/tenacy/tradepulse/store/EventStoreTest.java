package com.tenacy.tradepulse.store;

import com.tenacy.tradepulse.config.MonitorProperties;
import com.tenacy.tradepulse.domain.LogLevel;
import com.tenacy.tradepulse.domain.SystemLogEntry;
import com.tenacy.tradepulse.domain.UptimeRecord;
import com.tenacy.tradepulse.util.MutableClock;
import com.tenacy.tradepulse.util.TestObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EventStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MonitorProperties properties;
    private EventStore eventStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        properties = new MonitorProperties();
        properties.getStore().setDirectory(tempDir.toString());
        properties.getStore().setSystemLogsMax(3);

        eventStore = new EventStore(properties, TestObjectMappers.json(), clock);
        eventStore.load();
    }

    @Test
    @DisplayName("컴포넌트당 가동 레코드는 하나만 유지")
    void updateComponentUptime_ShouldKeepOneRecordPerComponent() {
        // when
        eventStore.updateComponentUptime("backend", true);
        clock.advance(Duration.ofSeconds(30));
        eventStore.updateComponentUptime("backend", true);
        eventStore.updateComponentUptime("tradingAgent", false);

        // then
        List<UptimeRecord> stats = eventStore.uptimeStats();
        assertEquals(2, stats.size());

        UptimeRecord backend = stats.stream().filter(r -> "backend".equals(r.getComponent())).findFirst().orElseThrow();
        assertEquals(30, backend.getTotalUptimeSeconds());
        assertEquals(0, backend.getDowntimeCount());

        UptimeRecord agent = stats.stream().filter(r -> "tradingAgent".equals(r.getComponent())).findFirst().orElseThrow();
        assertEquals(1, agent.getDowntimeCount());
    }

    @Test
    @DisplayName("조회한 가동 레코드를 바꿔도 컴포넌트당 하나의 레코드가 유지된다")
    void uptimeStats_ShouldNotExposeStoredRecords() {
        // given
        eventStore.updateComponentUptime("backend", true);
        eventStore.updateComponentUptime("frontend", true);

        // when
        eventStore.uptimeStats().get(1).setComponent("backend");
        eventStore.updateComponentUptime("backend", false);

        // then
        List<UptimeRecord> stats = eventStore.uptimeStats();
        assertEquals(1, stats.stream().filter(r -> "backend".equals(r.getComponent())).count());
        assertEquals(1, stats.stream().filter(r -> "frontend".equals(r.getComponent())).count());
        UptimeRecord backend = stats.stream().filter(r -> "backend".equals(r.getComponent())).findFirst().orElseThrow();
        assertFalse(backend.getOnline());
    }

    @Test
    @DisplayName("시스템 로그는 보존 개수와 필터를 지킨다")
    void appendSystemLog_ShouldTrimAndFilter() {
        // given
        eventStore.appendSystemLog("tradingAgent", LogLevel.INFO, "started", Map.of());
        eventStore.appendSystemLog("tradingAgent", LogLevel.ERROR, "order failed", Map.of());
        eventStore.appendSystemLog("backend", LogLevel.ERROR, "db timeout", Map.of());
        eventStore.appendSystemLog("tradingAgent", LogLevel.WARNING, "slow feed", Map.of());

        // when
        List<SystemLogEntry> all = eventStore.recentLogs(null, null, 10);
        List<SystemLogEntry> errors = eventStore.recentLogs(null, LogLevel.ERROR, 10);
        List<SystemLogEntry> agentErrors = eventStore.recentLogs("tradingAgent", LogLevel.ERROR, 10);

        // then
        assertEquals(3, all.size());
        assertEquals("slow feed", all.get(0).getMessage());
        assertEquals(2, errors.size());
        assertEquals(1, agentErrors.size());
    }

    @Test
    @DisplayName("기간 정리는 가동 레코드를 건드리지 않는다")
    void purge_ShouldKeepUptimeRecords() {
        // given
        eventStore.appendMetric("system", "cpu_usage", 12.5, "percent");
        eventStore.appendSystemLog("backend", LogLevel.INFO, "ok", Map.of());
        eventStore.updateComponentUptime("backend", true);

        clock.advance(Duration.ofDays(31));

        // when
        int removed = eventStore.purge(Duration.ofDays(30));

        // then
        assertEquals(2, removed);
        assertTrue(eventStore.recentMetrics("system", null, 10).isEmpty());
        assertEquals(1, eventStore.uptimeStats().size());
    }

    @Test
    @DisplayName("재시작 후에도 저장된 스트림이 복원된다")
    void load_ShouldRestorePersistedStreams() {
        // given
        eventStore.appendMetric("backend", "api_latency", 120, "ms");

        // when
        EventStore restarted = new EventStore(properties, TestObjectMappers.json(), clock);
        restarted.load();

        // then
        assertEquals(1, restarted.recentMetrics("backend", "api_latency", 10).size());
    }
}
