package com.tenacy.tradepulse.config;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import com.tenacy.tradepulse.domain.UptimeRecord;
import com.tenacy.tradepulse.monitor.health.HealthMonitor;
import com.tenacy.tradepulse.monitor.performance.PerformanceMonitor;
import com.tenacy.tradepulse.store.EventStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gauges exposed on {@code /actuator/prometheus}.
 */
@Configuration
@Slf4j
public class MonitoringMetricsConfig {

    @Bean
    public MeterBinder componentHealthMetrics(HealthMonitor healthMonitor, EventStore eventStore) {
        return registry -> {
            for (String component : healthMonitor.getComponentIds()) {
                Gauge.builder("tradepulse.component.health", healthMonitor,
                                monitor -> statusOf(monitor, component).getGaugeValue())
                        .description("컴포넌트 상태 (0=critical, 1=warning, 2=healthy, -1=unknown)")
                        .tag("component", component)
                        .register(registry);

                Gauge.builder("tradepulse.component.response.time", healthMonitor,
                                monitor -> responseTimeOf(monitor, component))
                        .description("컴포넌트 응답 시간 (ms)")
                        .tag("component", component)
                        .baseUnit("milliseconds")
                        .register(registry);

                Gauge.builder("tradepulse.component.uptime.seconds", eventStore,
                                store -> uptimeOf(store, component))
                        .description("누적 가동 시간")
                        .tag("component", component)
                        .baseUnit("seconds")
                        .register(registry);
            }
            log.info("Component health metrics registered for {}", healthMonitor.getComponentIds());
        };
    }

    @Bean
    public MeterBinder systemResourceMetrics(PerformanceMonitor performanceMonitor) {
        return registry -> {
            Gauge.builder("tradepulse.system.cpu.usage", performanceMonitor,
                            monitor -> valueOrZero(monitor.getMetricValue("cpuUsage")))
                    .description("CPU 사용률 (%)")
                    .baseUnit("percent")
                    .register(registry);

            Gauge.builder("tradepulse.system.memory.usage", performanceMonitor,
                            monitor -> valueOrZero(monitor.getMetricValue("memoryUsage")))
                    .description("메모리 사용률 (%)")
                    .baseUnit("percent")
                    .register(registry);
        };
    }

    private static HealthStatus statusOf(HealthMonitor monitor, String component) {
        ComponentHealthSnapshot snapshot = monitor.getStatus().getComponents().get(component);
        return snapshot != null && snapshot.getStatus() != null ? snapshot.getStatus() : HealthStatus.UNKNOWN;
    }

    private static double responseTimeOf(HealthMonitor monitor, String component) {
        ComponentHealthSnapshot snapshot = monitor.getStatus().getComponents().get(component);
        return snapshot != null && snapshot.getResponseTimeMs() != null ? snapshot.getResponseTimeMs() : 0;
    }

    private static double uptimeOf(EventStore store, String component) {
        return store.uptimeStats().stream()
                .filter(record -> component.equals(record.getComponent()))
                .mapToDouble(UptimeRecord::getTotalUptimeSeconds)
                .findFirst()
                .orElse(0);
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0;
    }
}
