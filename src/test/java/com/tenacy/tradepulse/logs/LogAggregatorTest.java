package com.tenacy.tradepulse.logs;

import com.tenacy.tradepulse.alert.AlertContext;
import com.tenacy.tradepulse.alert.rule.AlertRuleRegistry;
import com.tenacy.tradepulse.domain.LogLevel;
import com.tenacy.tradepulse.store.EventStore;
import com.tenacy.tradepulse.util.MutableClock;
import com.tenacy.tradepulse.util.TestObjectMappers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class LogAggregatorTest {

    @Mock
    private EventStore eventStore;

    private SimpleMeterRegistry meterRegistry;
    private LogAggregator logAggregator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        logAggregator = new LogAggregator(eventStore, meterRegistry, TestObjectMappers.json(), clock, "tradingAgent");
    }

    @Test
    @DisplayName("분류된 라인은 시스템 로그로 저장")
    void processLogLine_ShouldPersistClassifiedLine() {
        // when
        logAggregator.processLogLine("[2026-03-01 12:00:00] [INFO] Bot started");

        // then
        ArgumentCaptor<Map<String, Object>> contextCaptor = ArgumentCaptor.forClass(Map.class);
        verify(eventStore).appendSystemLog(eq("tradingAgent"), eq(LogLevel.INFO), eq("Bot started"),
                contextCaptor.capture());
        assertEquals("[2026-03-01 12:00:00] [INFO] Bot started", contextCaptor.getValue().get("raw"));
        assertEquals(1.0, meterRegistry.counter("tradepulse.logs.processed", "level", "info").count());
    }

    @Test
    @DisplayName("깨진 JSON 라인과 빈 라인은 조용히 버린다")
    void processLogLine_ShouldDropUnparseableLines() {
        // when
        logAggregator.processLogLine("{\"level\": \"error\", \"message\": ");
        logAggregator.processLogLine("");

        // then
        verifyNoInteractions(eventStore);
        assertEquals(0, logAggregator.getErrorCounts().getLast10Minutes());
    }

    @Test
    @DisplayName("10분 내 오류 6건은 high_error_rate 를 만족, 5건은 아니다")
    void errorCounts_ShouldDriveHighErrorRateRule() {
        // given
        AlertRuleRegistry registry = new AlertRuleRegistry();
        for (int i = 0; i < 5; i++) {
            logAggregator.processLogLine("order " + i + " failed");
        }

        // when
        ErrorCounts five = logAggregator.getErrorCounts();
        logAggregator.logEntry("backend", LogLevel.CRITICAL, "database unreachable", Map.of());
        ErrorCounts six = logAggregator.getErrorCounts();

        // then
        assertEquals(5, five.getLast10Minutes());
        assertFalse(registry.evaluate(AlertRuleRegistry.HIGH_ERROR_RATE, AlertContext.builder().errors(five).build()));
        assertEquals(6, six.getLast10Minutes());
        assertTrue(registry.evaluate(AlertRuleRegistry.HIGH_ERROR_RATE, AlertContext.builder().errors(six).build()));
    }

    @Test
    @DisplayName("info, warning 레벨은 오류로 세지 않는다")
    void logEntry_ShouldNotCountNonErrorLevels() {
        logAggregator.logEntry("backend", LogLevel.WARNING, "slow query", null);
        logAggregator.logEntry("backend", LogLevel.INFO, "ok", null);

        assertEquals(0, logAggregator.getErrorCounts().getLastHour());
        verify(eventStore, times(2)).appendSystemLog(eq("backend"), any(LogLevel.class), anyString(), isNull());
    }
}
