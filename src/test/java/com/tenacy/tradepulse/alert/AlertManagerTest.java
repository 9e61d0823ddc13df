package com.tenacy.tradepulse.alert;

import com.tenacy.tradepulse.alert.channel.AlertChannel;
import com.tenacy.tradepulse.alert.rule.AlertRuleRegistry;
import com.tenacy.tradepulse.domain.AlertEvent;
import com.tenacy.tradepulse.domain.AlertSeverity;
import com.tenacy.tradepulse.exception.AlertDeliveryException;
import com.tenacy.tradepulse.logs.ErrorCounts;
import com.tenacy.tradepulse.store.EventStore;
import com.tenacy.tradepulse.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class AlertManagerTest {

    @Mock
    private AlertConfigLoader configLoader;

    @Mock
    private EventStore eventStore;

    @Mock
    private AlertChannel slackChannel;

    @Mock
    private AlertChannel telegramChannel;

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        when(slackChannel.getName()).thenReturn("slack");
        when(telegramChannel.getName()).thenReturn("telegram");
    }

    private AlertManager newManager(AlertConfiguration configuration) {
        when(configLoader.load()).thenReturn(configuration);
        return new AlertManager(configLoader, new AlertRuleRegistry(), List.of(slackChannel, telegramChannel),
                eventStore, meterRegistry, Runnable::run, clock);
    }

    private static AlertConfiguration.ChannelSettings channel(boolean enabled, AlertSeverity... severities) {
        AlertConfiguration.ChannelSettings settings = new AlertConfiguration.ChannelSettings();
        settings.setEnabled(enabled);
        settings.setSeverity(List.of(severities));
        return settings;
    }

    private static AlertRule memoryRule(boolean enabled) {
        return AlertRule.builder()
                .id(AlertRuleRegistry.HIGH_MEMORY_USAGE)
                .name("High Memory Usage")
                .description("System memory usage is above 80%")
                .severity(AlertSeverity.WARNING)
                .enabled(enabled)
                .build();
    }

    private static AlertConfiguration configuration(AlertRule... rules) {
        AlertConfiguration configuration = AlertConfiguration.empty();
        configuration.getChannels().put("slack", channel(true, AlertSeverity.CRITICAL, AlertSeverity.WARNING));
        configuration.getChannels().put("telegram", channel(true, AlertSeverity.CRITICAL));
        configuration.setRules(List.of(rules));
        return configuration;
    }

    private AlertContext highMemory() {
        return AlertContext.builder()
                .performance(Map.of("memoryUsage", 85.0))
                .errors(ErrorCounts.none())
                .timestamp(clock.instant())
                .build();
    }

    @Test
    @DisplayName("메모리 85% 는 warning 알림 하나를 slack 으로만 보낸다")
    void evaluateRules_ShouldDispatchToChannelsForSeverity() {
        // given
        AlertManager alertManager = newManager(configuration(memoryRule(true)));

        // when
        List<AlertEvent> fired = alertManager.evaluateRules(highMemory());

        // then
        assertEquals(1, fired.size());
        AlertEvent event = fired.get(0);
        assertEquals(AlertSeverity.WARNING, event.getSeverity());
        assertEquals(List.of("slack"), event.getChannels());
        assertEquals("high_memory_usage_" + clock.instant().toEpochMilli(), event.getAlertId());
        assertEquals("system", event.getComponent());
        assertEquals("Memory usage: 85.0%", event.getContext().get("details"));

        ArgumentCaptor<AlertMessage> messageCaptor = ArgumentCaptor.forClass(AlertMessage.class);
        verify(slackChannel).send(messageCaptor.capture(), eq(AlertSeverity.WARNING));
        assertEquals("🟠 High Memory Usage", messageCaptor.getValue().getTitle());
        verify(telegramChannel, never()).send(any(), any());
        verify(eventStore).appendAlert(event);
        assertEquals(1.0, meterRegistry.counter("tradepulse.alerts.triggered",
                "severity", "warning", "rule", "high_memory_usage").count());
    }

    @Test
    @DisplayName("조건이 맞지 않으면 아무것도 보내지 않는다")
    void evaluateRules_ShouldStayQuietWhenNothingFires() {
        AlertManager alertManager = newManager(configuration(memoryRule(true)));

        List<AlertEvent> fired = alertManager.evaluateRules(AlertContext.builder()
                .performance(Map.of("memoryUsage", 40.0))
                .build());

        assertTrue(fired.isEmpty());
        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("비활성 규칙은 평가하지 않는다")
    void evaluateRules_ShouldSkipDisabledRules() {
        AlertManager alertManager = newManager(configuration(memoryRule(false)));

        assertTrue(alertManager.evaluateRules(highMemory()).isEmpty());
        verify(slackChannel, never()).send(any(), any());
    }

    @Test
    @DisplayName("윈도우 내 최대 건수를 넘으면 rate limit 으로 억제")
    void evaluateRules_ShouldRateLimitPerRule() {
        // given
        AlertConfiguration configuration = configuration(memoryRule(true));
        configuration.getRateLimiting().setEnabled(true);
        configuration.getRateLimiting().setWindowMinutes(15);
        configuration.getRateLimiting().setMaxAlertsPerWindow(2);
        AlertManager alertManager = newManager(configuration);

        // when
        int first = alertManager.evaluateRules(highMemory()).size();
        clock.advance(Duration.ofMinutes(1));
        int second = alertManager.evaluateRules(highMemory()).size();
        clock.advance(Duration.ofMinutes(1));
        int third = alertManager.evaluateRules(highMemory()).size();
        clock.advance(Duration.ofMinutes(14));
        int afterWindow = alertManager.evaluateRules(highMemory()).size();

        // then
        assertEquals(1, first);
        assertEquals(1, second);
        assertEquals(0, third);
        assertEquals(1, afterWindow);
        assertEquals(1.0, meterRegistry.counter("tradepulse.alerts.suppressed", "reason", "rate_limit").count());
    }

    @Test
    @DisplayName("중복 윈도우 안의 재발생은 억제되고 윈도우가 지나면 다시 보낸다")
    void evaluateRules_ShouldDeduplicateWithinWindow() {
        // given
        AlertConfiguration configuration = configuration(memoryRule(true));
        configuration.getDeduplication().setEnabled(true);
        configuration.getDeduplication().setWindowMinutes(5);
        AlertManager alertManager = newManager(configuration);

        // when
        int first = alertManager.evaluateRules(highMemory()).size();
        clock.advance(Duration.ofMinutes(4));
        int duplicate = alertManager.evaluateRules(highMemory()).size();
        clock.advance(Duration.ofMinutes(2));
        int afterWindow = alertManager.evaluateRules(highMemory()).size();

        // then
        assertEquals(1, first);
        assertEquals(0, duplicate);
        assertEquals(1, afterWindow);
        verify(slackChannel, times(2)).send(any(AlertMessage.class), eq(AlertSeverity.WARNING));
    }

    @Test
    @DisplayName("한 채널이 실패해도 다른 채널로는 전송되고 성공한 채널만 기록")
    void evaluateRules_ShouldRecordOnlySuccessfulChannels() {
        // given
        AlertRule critical = memoryRule(true);
        critical.setSeverity(AlertSeverity.CRITICAL);
        AlertManager alertManager = newManager(configuration(critical));
        doThrow(new AlertDeliveryException("Slack not configured"))
                .when(slackChannel).send(any(AlertMessage.class), any(AlertSeverity.class));

        // when
        List<AlertEvent> fired = alertManager.evaluateRules(highMemory());

        // then
        assertEquals(1, fired.size());
        assertEquals(List.of("telegram"), fired.get(0).getChannels());
        verify(telegramChannel).send(any(AlertMessage.class), eq(AlertSeverity.CRITICAL));
        assertEquals(1.0, meterRegistry.counter("tradepulse.alerts.channel.errors", "channel", "slack").count());
    }

    @Test
    @DisplayName("구현이 없는 채널은 활성화 목록에서 빠진다")
    void constructor_ShouldExcludeChannelsWithoutImplementation() {
        AlertConfiguration configuration = configuration(memoryRule(true));
        configuration.getChannels().put("email", channel(true, AlertSeverity.WARNING));

        AlertManager alertManager = newManager(configuration);

        assertEquals(List.of("slack", "telegram"), alertManager.getActiveChannels());
    }

    @Test
    @DisplayName("테스트 알림은 채널별 결과를 돌려준다")
    void testChannels_ShouldReportPerChannelResult() {
        // given
        AlertManager alertManager = newManager(configuration(memoryRule(true)));
        doThrow(new AlertDeliveryException("Telegram not configured"))
                .when(telegramChannel).send(any(AlertMessage.class), any(AlertSeverity.class));

        // when
        Map<String, String> results = alertManager.testChannels();

        // then
        assertEquals("success", results.get("slack"));
        assertEquals("failed: Telegram not configured", results.get("telegram"));
        verify(slackChannel).send(argThat(m -> "🧪 Test Alert".equals(m.getTitle())), eq(AlertSeverity.INFO));
    }

    @Test
    @DisplayName("재로드하면 규칙과 채널이 함께 교체된다")
    void reloadConfig_ShouldReplaceRulesAndChannels() {
        // given
        AlertManager alertManager = newManager(configuration(memoryRule(true)));
        when(configLoader.load()).thenReturn(AlertConfiguration.empty());

        // when
        AlertConfiguration reloaded = alertManager.reloadConfig();

        // then
        assertTrue(reloaded.getRules().isEmpty());
        assertTrue(alertManager.getActiveChannels().isEmpty());
        assertTrue(alertManager.evaluateRules(highMemory()).isEmpty());
    }

    @Test
    @DisplayName("알림 이력은 최신순")
    void getAlertHistory_ShouldReturnNewestFirst() {
        // given
        AlertRule tradeRule = AlertRule.builder()
                .id(AlertRuleRegistry.TRADE_EXECUTION_FAILURE)
                .name("Trade Execution Failure")
                .severity(AlertSeverity.CRITICAL)
                .enabled(true)
                .build();
        AlertManager alertManager = newManager(configuration(memoryRule(true), tradeRule));

        // when
        alertManager.evaluateRules(highMemory());
        clock.advance(Duration.ofMinutes(1));
        alertManager.evaluateRules(AlertContext.builder().tradeFailure(true).tradeFailureReason("timeout").build());

        // then
        List<AlertEvent> history = alertManager.getAlertHistory(10);
        assertEquals(2, history.size());
        assertEquals(AlertRuleRegistry.TRADE_EXECUTION_FAILURE, history.get(0).getRuleId());
        assertEquals("timeout", history.get(0).getContext().get("tradeFailureReason"));
        assertEquals(1, alertManager.getAlertHistory(1).size());
    }
}
