package com.tenacy.tradepulse.coordinator;

import com.tenacy.tradepulse.alert.AlertContext;
import com.tenacy.tradepulse.alert.AlertManager;
import com.tenacy.tradepulse.broadcast.BroadcastMessage;
import com.tenacy.tradepulse.broadcast.Broadcaster;
import com.tenacy.tradepulse.domain.AlertEvent;
import com.tenacy.tradepulse.logs.ErrorCounts;
import com.tenacy.tradepulse.logs.LogAggregator;
import com.tenacy.tradepulse.monitor.health.HealthMonitor;
import com.tenacy.tradepulse.monitor.health.HealthSummary;
import com.tenacy.tradepulse.monitor.performance.PerformanceMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic tick that reads the latest completed polls, pushes them to live
 * subscribers and evaluates alert rules. It never triggers a poll itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringCoordinator {

    static final String UNSPECIFIED_REASON = "unspecified";

    private final HealthMonitor healthMonitor;
    private final PerformanceMonitor performanceMonitor;
    private final LogAggregator logAggregator;
    private final AlertManager alertManager;
    private final Broadcaster broadcaster;
    private final Clock clock;

    private final AtomicReference<String> pendingTradeFailure = new AtomicReference<>();

    @Scheduled(fixedRateString = "${tradepulse.monitoring.coordinator-interval:30000}",
            initialDelayString = "${tradepulse.monitoring.coordinator-initial-delay:5000}")
    public List<AlertEvent> tick() {
        HealthSummary health = healthMonitor.getStatus();
        Map<String, Object> metrics = performanceMonitor.getMetrics();
        ErrorCounts errors = logAggregator.getErrorCounts();

        broadcaster.broadcast(BroadcastMessage.HEALTH, health);
        broadcaster.broadcast(BroadcastMessage.METRICS, metrics);

        String tradeFailureReason = pendingTradeFailure.getAndSet(null);

        AlertContext context = AlertContext.builder()
                .health(health)
                .performance(metrics)
                .errors(errors)
                .timestamp(clock.instant())
                .tradeFailure(tradeFailureReason != null)
                .tradeFailureReason(tradeFailureReason)
                .build();

        try {
            return alertManager.evaluateRules(context);
        } catch (RuntimeException e) {
            log.error("Alert evaluation failed: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    @Scheduled(fixedRateString = "${tradepulse.monitoring.metrics-broadcast-interval:10000}",
            initialDelayString = "${tradepulse.monitoring.coordinator-initial-delay:5000}")
    public void broadcastMetrics() {
        broadcaster.broadcast(BroadcastMessage.METRICS, performanceMonitor.getMetrics());
    }

    /**
     * Flags a failed trade execution; the flag is consumed by the next tick.
     */
    public void reportTradeFailure(String reason) {
        String normalized = StringUtils.hasText(reason) ? reason : UNSPECIFIED_REASON;
        pendingTradeFailure.set(normalized);
        log.warn("거래 실행 실패 보고: {}", normalized);
    }

    public boolean hasPendingTradeFailure() {
        return pendingTradeFailure.get() != null;
    }
}
