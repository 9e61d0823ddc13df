package com.tenacy.tradepulse.monitor.performance;

import com.tenacy.tradepulse.config.MonitorProperties;
import com.tenacy.tradepulse.monitor.health.LivenessFileReader;
import com.tenacy.tradepulse.monitor.health.LivenessReport;
import com.tenacy.tradepulse.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Collects host, backend and trading agent metrics on its own timer.
 * <p>
 * The three collection steps run independently; a failure in one is logged and
 * never aborts the others. Only the latest value per metric key is kept here,
 * history lives in the event store.
 */
@Service
@Slf4j
public class PerformanceMonitor {

    static final String SYSTEM = "system";
    static final String BACKEND = "backend";
    static final String TRADING_AGENT = "tradingAgent";

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE =
            new ParameterizedTypeReference<>() {};

    // backend 응답 키 -> (metric 이름, 단위)
    private static final Map<String, String[]> BACKEND_COUNTERS = Map.of(
            "uptime_seconds", new String[]{"uptime", "seconds"},
            "error_count", new String[]{"error_count", "count"});

    private static final Map<String, List<String>> COMPONENT_KEY_PREFIXES = Map.of(
            SYSTEM, List.of("cpu", "memory"),
            BACKEND, List.of("backend"),
            TRADING_AGENT, List.of("agent"));

    private final SystemResourceSampler resourceSampler;
    private final RestTemplate backendRestTemplate;
    private final LivenessFileReader livenessFileReader;
    private final EventStore eventStore;
    private final MonitorProperties properties;
    private final Executor probeExecutor;
    private final Clock clock;

    private final Map<String, Number> metrics = new ConcurrentHashMap<>();

    public PerformanceMonitor(SystemResourceSampler resourceSampler,
                              @Qualifier("backendRestTemplate") RestTemplate backendRestTemplate,
                              LivenessFileReader livenessFileReader,
                              EventStore eventStore,
                              MonitorProperties properties,
                              @Qualifier("probeExecutor") Executor probeExecutor,
                              Clock clock) {
        this.resourceSampler = resourceSampler;
        this.backendRestTemplate = backendRestTemplate;
        this.livenessFileReader = livenessFileReader;
        this.eventStore = eventStore;
        this.properties = properties;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${tradepulse.monitoring.performance-check-interval:60000}",
            initialDelayString = "${tradepulse.monitoring.initial-delay:0}")
    public void collect() {
        log.debug("Collecting performance metrics");

        CompletableFuture.allOf(
                CompletableFuture.runAsync(this::collectSystemMetrics, probeExecutor),
                CompletableFuture.runAsync(this::collectBackendMetrics, probeExecutor),
                CompletableFuture.runAsync(this::collectTradingAgentMetrics, probeExecutor)
        ).join();
    }

    void collectSystemMetrics() {
        try {
            ResourceUsage usage = resourceSampler.sample();

            metrics.put("cpuUsage", usage.getCpuUsagePercent());
            metrics.put("memoryUsage", usage.getMemoryUsagePercent());
            metrics.put("memoryTotal", usage.getMemoryTotalMb());
            metrics.put("memoryUsed", usage.getMemoryUsedMb());

            eventStore.appendMetric(SYSTEM, "cpu_usage", usage.getCpuUsagePercent(), "percent");
            eventStore.appendMetric(SYSTEM, "memory_usage", usage.getMemoryUsagePercent(), "percent");
            eventStore.appendMetric(SYSTEM, "memory_used", usage.getMemoryUsedMb(), "MB");
            eventStore.appendMetric(SYSTEM, "memory_total", usage.getMemoryTotalMb(), "MB");
            eventStore.appendMetric(SYSTEM, "memory_free", usage.getMemoryFreeMb(), "MB");

            log.debug("System metrics collected - cpu: {}%, memory: {}%",
                    String.format("%.2f", usage.getCpuUsagePercent()),
                    String.format("%.2f", usage.getMemoryUsagePercent()));
        } catch (Exception e) {
            log.error("System metrics collection failed: {}", e.getMessage());
        }
    }

    void collectBackendMetrics() {
        MonitorProperties.HttpComponent backend = properties.getComponents().getBackend();
        if (!backend.isEnabled() || backend.getUrl() == null || backend.getUrl().isBlank()) {
            return;
        }

        try {
            long startTime = clock.millis();
            Map<String, Object> body = backendRestTemplate
                    .exchange(backend.getUrl(), HttpMethod.GET, null, BODY_TYPE)
                    .getBody();
            long latency = clock.millis() - startTime;

            metrics.put("backendLatency", latency);
            eventStore.appendMetric(BACKEND, "api_latency", latency, "ms");

            if (body != null) {
                body.forEach((key, value) -> {
                    if (value instanceof Number number) {
                        String[] mapping = BACKEND_COUNTERS.getOrDefault(key, new String[]{key, "count"});
                        eventStore.appendMetric(BACKEND, mapping[0], number.doubleValue(), mapping[1]);
                    }
                });
            }

            log.debug("Backend metrics collected - latency: {}ms", latency);
        } catch (Exception e) {
            log.error("Backend metrics collection failed: {}", e.getMessage());
        }
    }

    void collectTradingAgentMetrics() {
        if (!properties.getComponents().getTradingAgent().isEnabled()) {
            return;
        }

        try {
            LivenessReport report = livenessFileReader.read();

            if (report.getUptimeSeconds() != null) {
                eventStore.appendMetric(TRADING_AGENT, "uptime", report.getUptimeSeconds(), "seconds");
            }
            if (report.getSignalsCount() != null) {
                eventStore.appendMetric(TRADING_AGENT, "signals_generated", report.getSignalsCount(), "count");
            }
            if (report.getTradesCount() != null) {
                eventStore.appendMetric(TRADING_AGENT, "trades_executed", report.getTradesCount(), "count");
            }
            if (report.getErrorsCount() != null) {
                eventStore.appendMetric(TRADING_AGENT, "error_count", report.getErrorsCount(), "count");
            }

            metrics.put("agentSignals", valueOrZero(report.getSignalsCount()));
            metrics.put("agentTrades", valueOrZero(report.getTradesCount()));
            metrics.put("agentErrors", valueOrZero(report.getErrorsCount()));

            log.debug("Trading agent metrics collected - signals: {}, trades: {}",
                    report.getSignalsCount(), report.getTradesCount());
        } catch (Exception e) {
            log.error("Trading agent metrics collection failed: {}", e.getMessage());
        }
    }

    /**
     * Latest value of every metric key plus the read timestamp.
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("timestamp", clock.instant());
        snapshot.putAll(metrics);
        return snapshot;
    }

    public Map<String, Object> getComponentMetrics(String component) {
        List<String> prefixes = COMPONENT_KEY_PREFIXES.getOrDefault(component, List.of(component));

        Map<String, Object> filtered = new LinkedHashMap<>();
        metrics.forEach((key, value) -> {
            String lowerKey = key.toLowerCase();
            if (prefixes.stream().anyMatch(prefix -> lowerKey.startsWith(prefix.toLowerCase()))) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }

    public Double getMetricValue(String key) {
        Number value = metrics.get(key);
        return value != null ? value.doubleValue() : null;
    }

    private static long valueOrZero(Long value) {
        return value != null ? value : 0L;
    }
}
