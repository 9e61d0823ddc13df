package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health of a process that reports through the liveness side-channel file.
 * <ul>
 *     <li>{@code critical}: not alive, heartbeat at least twice the max age, or file missing/unreadable</li>
 *     <li>{@code warning}: heartbeat older than the max age, or breaker active</li>
 *     <li>{@code healthy}: otherwise</li>
 * </ul>
 */
@Slf4j
public class LivenessFileProbe implements ComponentProbe {

    private final String componentId;
    private final LivenessFileReader reader;
    private final long maxHeartbeatAgeSeconds;
    private final Clock clock;

    public LivenessFileProbe(String componentId, LivenessFileReader reader, long maxHeartbeatAgeSeconds, Clock clock) {
        this.componentId = componentId;
        this.reader = reader;
        this.maxHeartbeatAgeSeconds = maxHeartbeatAgeSeconds;
        this.clock = clock;
    }

    @Override
    public String getComponentId() {
        return componentId;
    }

    @Override
    public ComponentHealthSnapshot check() {
        try {
            LivenessReport report = reader.read();
            Optional<Double> heartbeatAge = reader.heartbeatAgeSeconds(report);

            HealthStatus status = classify(report, heartbeatAge.orElse(Double.POSITIVE_INFINITY));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("is_alive", report.getAlive());
            details.put("heartbeat_age", heartbeatAge.map(Math::round).orElse(null));
            details.put("models_loaded", report.getModelsLoaded());
            details.put("circuit_breaker_active", report.getCircuitBreakerActive());
            details.put("signals_count", report.getSignalsCount());
            details.put("trades_count", report.getTradesCount());
            details.put("errors_count", report.getErrorsCount());
            details.put("last_signal", report.getLastSignal());
            details.put("last_trade", report.getLastTrade());

            return snapshot(status, details);
        } catch (IOException | RuntimeException e) {
            log.error("{} health check failed: {}", componentId, e.getMessage());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return snapshot(HealthStatus.CRITICAL, details);
        }
    }

    HealthStatus classify(LivenessReport report, double heartbeatAgeSeconds) {
        HealthStatus status = HealthStatus.HEALTHY;

        if (!Boolean.TRUE.equals(report.getAlive()) || heartbeatAgeSeconds >= maxHeartbeatAgeSeconds * 2.0) {
            status = HealthStatus.CRITICAL;
        } else if (heartbeatAgeSeconds > maxHeartbeatAgeSeconds) {
            status = HealthStatus.WARNING;
        }

        // 브레이커는 healthy -> warning 으로만 올린다
        if (Boolean.TRUE.equals(report.getCircuitBreakerActive()) && status == HealthStatus.HEALTHY) {
            status = HealthStatus.WARNING;
        }

        return status;
    }

    private ComponentHealthSnapshot snapshot(HealthStatus status, Map<String, Object> details) {
        return ComponentHealthSnapshot.builder()
                .component(componentId)
                .status(status)
                .responseTimeMs(0L)
                .details(details)
                .timestamp(clock.instant())
                .build();
    }
}
