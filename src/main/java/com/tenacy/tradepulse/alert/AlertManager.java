package com.tenacy.tradepulse.alert;

import com.tenacy.tradepulse.alert.channel.AlertChannel;
import com.tenacy.tradepulse.alert.rule.AlertRuleRegistry;
import com.tenacy.tradepulse.domain.AlertEvent;
import com.tenacy.tradepulse.domain.AlertSeverity;
import com.tenacy.tradepulse.store.EventStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Evaluates the configured rules against a monitoring snapshot and dispatches alerts.
 * <p>
 * A firing rule goes through rate limiting, then deduplication, then delivery to every
 * channel routed for its severity. Channels are attempted independently; the resulting
 * {@link AlertEvent} records only the channels that accepted the message.
 */
@Service
@Slf4j
public class AlertManager {

    static final int HISTORY_LIMIT = 100;

    private final AlertConfigLoader configLoader;
    private final AlertRuleRegistry ruleRegistry;
    private final Map<String, AlertChannel> channelBeans;
    private final EventStore eventStore;
    private final MeterRegistry meterRegistry;
    private final Executor alertExecutor;
    private final Clock clock;

    // 설정과 활성 채널은 항상 함께 교체된다
    private volatile ActiveConfiguration active;

    private final Map<String, Deque<Instant>> rateLimitWindows = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final Deque<AlertEvent> history = new ArrayDeque<>();

    @Autowired
    public AlertManager(AlertConfigLoader configLoader,
                        AlertRuleRegistry ruleRegistry,
                        ObjectProvider<AlertChannel> channels,
                        EventStore eventStore,
                        MeterRegistry meterRegistry,
                        @Qualifier("alertExecutor") Executor alertExecutor,
                        Clock clock) {
        this(configLoader, ruleRegistry, channels.orderedStream().collect(Collectors.toList()),
                eventStore, meterRegistry, alertExecutor, clock);
    }

    public AlertManager(AlertConfigLoader configLoader,
                        AlertRuleRegistry ruleRegistry,
                        List<AlertChannel> channels,
                        EventStore eventStore,
                        MeterRegistry meterRegistry,
                        Executor alertExecutor,
                        Clock clock) {
        this.configLoader = configLoader;
        this.ruleRegistry = ruleRegistry;
        this.eventStore = eventStore;
        this.meterRegistry = meterRegistry;
        this.alertExecutor = alertExecutor;
        this.clock = clock;

        Map<String, AlertChannel> byName = new LinkedHashMap<>();
        for (AlertChannel channel : channels) {
            byName.put(channel.getName(), channel);
        }
        this.channelBeans = Collections.unmodifiableMap(byName);

        this.active = activate(configLoader.load());
    }

    /**
     * Replaces rules and channels in one step from the configuration source.
     */
    public AlertConfiguration reloadConfig() {
        AlertConfiguration configuration = configLoader.load();
        this.active = activate(configuration);
        log.info("Alert configuration reloaded - rules: {}, channels: {}",
                configuration.getRules().size(), active.getChannels().keySet());
        return configuration;
    }

    /**
     * @return the alerts dispatched during this evaluation
     */
    public List<AlertEvent> evaluateRules(AlertContext context) {
        ActiveConfiguration current = this.active;
        List<AlertEvent> fired = new ArrayList<>();

        for (AlertRule rule : current.getConfiguration().getRules()) {
            if (!rule.isEnabled()) {
                continue;
            }

            try {
                if (ruleRegistry.evaluate(rule.getId(), context)) {
                    triggerAlert(rule, context, current).ifPresent(fired::add);
                }
            } catch (RuntimeException e) {
                log.error("Error evaluating rule {}: {}", rule.getName(), e.getMessage(), e);
            }
        }
        return fired;
    }

    private Optional<AlertEvent> triggerAlert(AlertRule rule, AlertContext context, ActiveConfiguration current) {
        AlertConfiguration configuration = current.getConfiguration();
        Instant now = clock.instant();

        if (configuration.getRateLimiting().isEnabled() && isRateLimited(rule.getId(), now, configuration)) {
            log.debug("Alert rate limited: {}", rule.getName());
            meterRegistry.counter("tradepulse.alerts.suppressed", "reason", "rate_limit").increment();
            return Optional.empty();
        }

        if (configuration.getDeduplication().isEnabled() && isDuplicate(rule.getId(), now, configuration)) {
            log.debug("Duplicate alert suppressed: {}", rule.getName());
            meterRegistry.counter("tradepulse.alerts.suppressed", "reason", "duplicate").increment();
            return Optional.empty();
        }

        AlertSeverity severity = rule.getSeverity() != null ? rule.getSeverity() : AlertSeverity.INFO;
        AlertMessage message = buildAlertMessage(rule, severity, context);

        List<String> targets = configuration.channelsFor(severity).stream()
                .filter(current.getChannels()::containsKey)
                .collect(Collectors.toList());
        List<String> sentChannels = dispatch(message, severity, targets, current.getChannels());

        AlertEvent event = AlertEvent.builder()
                .alertId(rule.getId() + "_" + now.toEpochMilli())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(severity)
                .message(message.getText() != null ? message.getText() : message.getTitle())
                .component("system")
                .context(contextSnapshot(context, message))
                .channels(sentChannels)
                .timestamp(now)
                .build();
        eventStore.appendAlert(event);

        recordFiring(rule.getId(), now);
        addToHistory(event);

        meterRegistry.counter("tradepulse.alerts.triggered",
                "severity", severity.getCode(), "rule", rule.getId()).increment();
        log.warn("알림 발생 - 규칙: {}, 심각도: {}, 전송 채널: {}", rule.getName(), severity.getCode(), sentChannels);

        return Optional.of(event);
    }

    private List<String> dispatch(AlertMessage message, AlertSeverity severity,
                                  List<String> targets, Map<String, AlertChannel> channels) {
        Map<String, CompletableFuture<Boolean>> attempts = new LinkedHashMap<>();

        for (String name : targets) {
            AlertChannel channel = channels.get(name);
            attempts.put(name, CompletableFuture
                    .supplyAsync(() -> {
                        channel.send(message, severity);
                        return true;
                    }, alertExecutor)
                    .exceptionally(ex -> {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause() : ex;
                        log.error("Failed to send alert via {}: {}", name, cause.getMessage());
                        meterRegistry.counter("tradepulse.alerts.channel.errors", "channel", name).increment();
                        return false;
                    }));
        }

        return attempts.entrySet().stream()
                .filter(e -> e.getValue().join())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    AlertMessage buildAlertMessage(AlertRule rule, AlertSeverity severity, AlertContext context) {
        return AlertMessage.builder()
                .title(severity.getEmoji() + " " + rule.getName())
                .text(rule.getDescription())
                .details(ruleRegistry.details(rule.getId(), context))
                .severity(severity)
                .timestamp(context.getTimestamp() != null ? context.getTimestamp() : clock.instant())
                .build();
    }

    private Map<String, Object> contextSnapshot(AlertContext context, AlertMessage message) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        if (context.getHealth() != null) {
            snapshot.put("overall", context.getHealth().getOverall());
        }
        snapshot.put("performance", context.getPerformance());
        snapshot.put("errors", context.getErrors());
        snapshot.put("details", message.getDetails());
        if (context.isTradeFailure()) {
            snapshot.put("tradeFailureReason", context.getTradeFailureReason());
        }
        return snapshot;
    }

    private boolean isRateLimited(String ruleId, Instant now, AlertConfiguration configuration) {
        Deque<Instant> window = rateLimitWindows.get(ruleId);
        if (window == null) {
            return false;
        }

        Duration length = Duration.ofMinutes(configuration.getRateLimiting().getWindowMinutes());
        synchronized (window) {
            window.removeIf(ts -> Duration.between(ts, now).compareTo(length) >= 0);
            return window.size() >= configuration.getRateLimiting().getMaxAlertsPerWindow();
        }
    }

    private boolean isDuplicate(String ruleId, Instant now, AlertConfiguration configuration) {
        Instant previous = lastFired.get(ruleId);
        if (previous == null) {
            return false;
        }

        Duration length = Duration.ofMinutes(configuration.getDeduplication().getWindowMinutes());
        return Duration.between(previous, now).compareTo(length) < 0;
    }

    private void recordFiring(String ruleId, Instant now) {
        Deque<Instant> window = rateLimitWindows.computeIfAbsent(ruleId, id -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(now);
        }
        lastFired.put(ruleId, now);
    }

    private synchronized void addToHistory(AlertEvent event) {
        history.addLast(event);
        while (history.size() > HISTORY_LIMIT) {
            history.pollFirst();
        }
    }

    /**
     * Most recent alerts first.
     */
    public synchronized List<AlertEvent> getAlertHistory(int limit) {
        List<AlertEvent> result = new ArrayList<>();
        Iterator<AlertEvent> newestFirst = history.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return result;
    }

    /**
     * Sends a synthetic info message to every active channel.
     *
     * @return channel name to {@code success} or {@code failed: <reason>}
     */
    public Map<String, String> testChannels() {
        AlertMessage message = AlertMessage.builder()
                .title("🧪 Test Alert")
                .text("This is a test alert from the diagnostic system")
                .severity(AlertSeverity.INFO)
                .timestamp(clock.instant())
                .build();

        Map<String, String> results = new LinkedHashMap<>();
        for (Map.Entry<String, AlertChannel> entry : active.getChannels().entrySet()) {
            try {
                entry.getValue().send(message, AlertSeverity.INFO);
                results.put(entry.getKey(), "success");
            } catch (RuntimeException e) {
                results.put(entry.getKey(), "failed: " + e.getMessage());
            }
        }
        return results;
    }

    public AlertConfiguration getConfiguration() {
        return active.getConfiguration();
    }

    public List<String> getActiveChannels() {
        return new ArrayList<>(active.getChannels().keySet());
    }

    private ActiveConfiguration activate(AlertConfiguration configuration) {
        Map<String, AlertChannel> channels = new LinkedHashMap<>();
        for (String name : configuration.enabledChannels()) {
            AlertChannel channel = channelBeans.get(name);
            if (channel != null) {
                channels.put(name, channel);
            } else {
                log.warn("Alert channel '{}' is enabled but no implementation is available", name);
            }
        }

        long unknownRules = configuration.getRules().stream()
                .filter(rule -> !ruleRegistry.isRegistered(rule.getId()))
                .count();
        if (unknownRules > 0) {
            log.warn("{} alert rules have no registered condition and will never fire", unknownRules);
        }

        log.info("Alert channels initialized: {}", String.join(", ", channels.keySet()));
        return new ActiveConfiguration(configuration, Collections.unmodifiableMap(channels));
    }

    private static final class ActiveConfiguration {
        private final AlertConfiguration configuration;
        private final Map<String, AlertChannel> channels;

        private ActiveConfiguration(AlertConfiguration configuration, Map<String, AlertChannel> channels) {
            this.configuration = configuration;
            this.channels = channels;
        }

        AlertConfiguration getConfiguration() {
            return configuration;
        }

        Map<String, AlertChannel> getChannels() {
            return channels;
        }
    }
}
