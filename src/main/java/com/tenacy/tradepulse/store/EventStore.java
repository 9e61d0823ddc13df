package com.tenacy.tradepulse.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.config.MonitorProperties;
import com.tenacy.tradepulse.domain.AlertEvent;
import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.LogLevel;
import com.tenacy.tradepulse.domain.PerformanceMetricPoint;
import com.tenacy.tradepulse.domain.SystemLogEntry;
import com.tenacy.tradepulse.domain.UptimeRecord;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * File backed persistence for the five monitoring streams.
 */
@Service
@Slf4j
public class EventStore {

    private final Clock clock;

    private final JsonFileStream<ComponentHealthSnapshot> healthSnapshots;
    private final JsonFileStream<PerformanceMetricPoint> performanceMetrics;
    private final JsonFileStream<AlertEvent> alertsLog;
    private final JsonFileStream<SystemLogEntry> systemLogs;
    private final JsonFileStream<UptimeRecord> componentUptime;

    public EventStore(MonitorProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.clock = clock;

        MonitorProperties.Store store = properties.getStore();
        Path dir = Paths.get(store.getDirectory());

        this.healthSnapshots = new JsonFileStream<>("health_snapshots", dir.resolve("health_snapshots.json"),
                ComponentHealthSnapshot.class, store.getHealthSnapshotsMax(), objectMapper);
        this.performanceMetrics = new JsonFileStream<>("performance_metrics", dir.resolve("performance_metrics.json"),
                PerformanceMetricPoint.class, store.getPerformanceMetricsMax(), objectMapper);
        this.alertsLog = new JsonFileStream<>("alerts_log", dir.resolve("alerts_log.json"),
                AlertEvent.class, store.getAlertsLogMax(), objectMapper);
        this.systemLogs = new JsonFileStream<>("system_logs", dir.resolve("system_logs.json"),
                SystemLogEntry.class, store.getSystemLogsMax(), objectMapper);
        this.componentUptime = new JsonFileStream<>("component_uptime", dir.resolve("component_uptime.json"),
                UptimeRecord.class, 0, objectMapper);
    }

    @PostConstruct
    public void load() {
        healthSnapshots.load();
        performanceMetrics.load();
        alertsLog.load();
        systemLogs.load();
        componentUptime.load();
        log.info("Event store loaded - health: {}, metrics: {}, alerts: {}, logs: {}, uptime: {}",
                healthSnapshots.size(), performanceMetrics.size(), alertsLog.size(),
                systemLogs.size(), componentUptime.size());
    }

    public ComponentHealthSnapshot appendHealthSnapshot(ComponentHealthSnapshot snapshot) {
        return healthSnapshots.append(snapshot);
    }

    public PerformanceMetricPoint appendMetric(String component, String metricName, double value, String unit) {
        return performanceMetrics.append(PerformanceMetricPoint.builder()
                .component(component)
                .metricName(metricName)
                .value(value)
                .unit(unit)
                .timestamp(clock.instant())
                .build());
    }

    public AlertEvent appendAlert(AlertEvent event) {
        return alertsLog.append(event);
    }

    public SystemLogEntry appendSystemLog(String component, LogLevel level, String message, Map<String, Object> context) {
        return systemLogs.append(SystemLogEntry.builder()
                .component(component)
                .level(level)
                .message(message)
                .context(context)
                .timestamp(clock.instant())
                .build());
    }

    public UptimeRecord updateComponentUptime(String component, boolean online) {
        Instant now = clock.instant();
        return componentUptime.upsert(
                r -> component.equals(r.getComponent()),
                r -> r.recordPoll(online, now),
                () -> UptimeRecord.firstSeen(component, online, now));
    }

    public List<ComponentHealthSnapshot> recentHealthSnapshots(String component, int limit) {
        return healthSnapshots.query(r -> component == null || component.equals(r.getComponent()), limit);
    }

    public List<PerformanceMetricPoint> recentMetrics(String component, String metricName, int limit) {
        return performanceMetrics.query(r ->
                (component == null || component.equals(r.getComponent()))
                        && (metricName == null || metricName.equals(r.getMetricName())), limit);
    }

    public List<AlertEvent> recentAlerts(int limit) {
        return alertsLog.query(r -> true, limit);
    }

    public List<SystemLogEntry> recentLogs(String component, LogLevel level, int limit) {
        return systemLogs.query(r ->
                (component == null || component.equals(r.getComponent()))
                        && (level == null || level == r.getLevel()), limit);
    }

    public List<UptimeRecord> uptimeStats() {
        return componentUptime.findAll();
    }

    /**
     * Drops records older than the retention window from every stream except uptime.
     *
     * @return number of records removed
     */
    public int purge(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);

        int removed = healthSnapshots.purgeOlderThan(cutoff)
                + performanceMetrics.purgeOlderThan(cutoff)
                + alertsLog.purgeOlderThan(cutoff)
                + systemLogs.purgeOlderThan(cutoff);

        log.info("Purged {} records older than {}", removed, cutoff);
        return removed;
    }
}
