package com.tenacy.tradepulse.logs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.domain.LogLevel;
import com.tenacy.tradepulse.domain.SystemLogEntry;
import com.tenacy.tradepulse.store.EventStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consumes tailed log lines, persists them as system log entries and keeps the
 * rolling error counters used by alert evaluation.
 */
@Service
@Slf4j
public class LogAggregator {

    private final EventStore eventStore;
    private final MeterRegistry meterRegistry;
    private final LogLineParser parser;
    private final ErrorRateTracker errorRateTracker;

    public LogAggregator(EventStore eventStore,
                         MeterRegistry meterRegistry,
                         ObjectMapper objectMapper,
                         Clock clock,
                         @Value("${tradepulse.logs.default-component:tradingAgent}") String defaultComponent) {
        this.eventStore = eventStore;
        this.meterRegistry = meterRegistry;
        this.parser = new LogLineParser(objectMapper, defaultComponent);
        this.errorRateTracker = new ErrorRateTracker(clock);
    }

    /**
     * Handles one tailed line. Lines that fail to parse are dropped without a record.
     */
    public void processLogLine(String line) {
        Optional<ClassifiedLogLine> classified;
        try {
            classified = parser.parse(line);
        } catch (Exception e) {
            log.debug("Dropping unparseable log line: {}", e.getMessage());
            return;
        }

        classified.ifPresent(record ->
                logEntry(record.getComponent(), record.getLevel(), record.getMessage(), record.getContext()));
    }

    /**
     * Injection point for externally reported events. Counts towards the error rate
     * exactly like a tailed line.
     */
    public SystemLogEntry logEntry(String component, LogLevel level, String message, Map<String, Object> context) {
        SystemLogEntry entry = eventStore.appendSystemLog(component, level, message, context);

        meterRegistry.counter("tradepulse.logs.processed", "level", level.getCode()).increment();

        if (level.isError()) {
            errorRateTracker.recordError();
            log.warn("Error log detected - component: {}, message: {}", component, message);
        }
        return entry;
    }

    @Scheduled(fixedRate = 60000)
    public void cleanupErrorCounts() {
        ErrorCounts counts = errorRateTracker.cleanup();
        log.debug("Error counts refreshed - last hour: {}, last 10 minutes: {}",
                counts.getLastHour(), counts.getLast10Minutes());
    }

    /**
     * Runs a cleanup pass before answering so the counts are never staler than that pass.
     */
    public ErrorCounts getErrorCounts() {
        return errorRateTracker.cleanup();
    }

    public List<SystemLogEntry> getRecentLogs(String component, LogLevel level, int limit) {
        return eventStore.recentLogs(component, level, limit);
    }
}
