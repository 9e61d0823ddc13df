package com.tenacy.tradepulse.alert.rule;

import com.tenacy.tradepulse.alert.AlertContext;
import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Fixed table of rule conditions keyed by rule id.
 * <p>
 * Configuration decides which rules are active and how severe they are; the
 * condition and the detail line of each rule live here. Unknown ids never fire.
 */
@Component
@Slf4j
public class AlertRuleRegistry {

    public static final String COMPONENT_DOWNTIME = "component_downtime";
    public static final String API_LATENCY_SPIKE = "api_latency_spike";
    public static final String HIGH_ERROR_RATE = "high_error_rate";
    public static final String CIRCUIT_BREAKER_TRIGGERED = "circuit_breaker_triggered";
    public static final String HIGH_MEMORY_USAGE = "high_memory_usage";
    public static final String TRADE_EXECUTION_FAILURE = "trade_execution_failure";

    static final double HEARTBEAT_AGE_LIMIT_SECONDS = 120;
    static final double LATENCY_LIMIT_MS = 2000;
    static final int ERROR_RATE_LIMIT = 5;
    static final double MEMORY_LIMIT_PERCENT = 80;

    private static final List<String> BREAKER_COMPONENTS = List.of("backend", "tradingAgent");

    private final Map<String, Predicate<AlertContext>> conditions = new ConcurrentHashMap<>();
    private final Map<String, Function<AlertContext, String>> detailWriters = new ConcurrentHashMap<>();

    public AlertRuleRegistry() {
        register(COMPONENT_DOWNTIME, AlertRuleRegistry::anyComponentDown,
                ctx -> "Components down: " + String.join(", ", criticalComponents(ctx)));

        register(API_LATENCY_SPIKE, ctx -> ctx.performanceValue("backendLatency") > LATENCY_LIMIT_MS,
                ctx -> "Backend latency: " + Math.round(ctx.performanceValue("backendLatency")) + "ms");

        register(HIGH_ERROR_RATE, ctx -> ctx.errorsLast10Minutes() > ERROR_RATE_LIMIT,
                ctx -> "Errors in last 10 minutes: " + ctx.errorsLast10Minutes());

        register(CIRCUIT_BREAKER_TRIGGERED, ctx -> !breakerComponents(ctx).isEmpty(),
                ctx -> "Circuit breaker active: " + String.join(", ", breakerComponents(ctx)));

        register(HIGH_MEMORY_USAGE, ctx -> ctx.performanceValue("memoryUsage") > MEMORY_LIMIT_PERCENT,
                ctx -> String.format(Locale.ROOT, "Memory usage: %.1f%%", ctx.performanceValue("memoryUsage")));

        register(TRADE_EXECUTION_FAILURE, AlertContext::isTradeFailure,
                ctx -> ctx.getTradeFailureReason() != null
                        ? "Reason: " + ctx.getTradeFailureReason()
                        : "Trade execution failed");

        log.info("Initialized AlertRuleRegistry with {} rules", conditions.size());
    }

    /**
     * Adds or replaces the condition of a rule id.
     */
    public void register(String ruleId, Predicate<AlertContext> condition, Function<AlertContext, String> details) {
        conditions.put(ruleId, condition);
        detailWriters.put(ruleId, details);
    }

    public boolean isRegistered(String ruleId) {
        return ruleId != null && conditions.containsKey(ruleId);
    }

    public Set<String> getRuleIds() {
        return Collections.unmodifiableSet(conditions.keySet());
    }

    public boolean evaluate(String ruleId, AlertContext context) {
        if (!isRegistered(ruleId)) {
            return false;
        }
        return conditions.get(ruleId).test(context);
    }

    public String details(String ruleId, AlertContext context) {
        if (!isRegistered(ruleId)) {
            return "";
        }
        return detailWriters.get(ruleId).apply(context);
    }

    private static boolean anyComponentDown(AlertContext context) {
        return components(context).values().stream().anyMatch(snapshot ->
                snapshot.getStatus() == HealthStatus.CRITICAL
                        || heartbeatAge(snapshot) > HEARTBEAT_AGE_LIMIT_SECONDS);
    }

    private static List<String> criticalComponents(AlertContext context) {
        return components(context).entrySet().stream()
                .filter(e -> e.getValue().getStatus() == HealthStatus.CRITICAL)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static List<String> breakerComponents(AlertContext context) {
        Map<String, ComponentHealthSnapshot> components = components(context);
        return BREAKER_COMPONENTS.stream()
                .filter(name -> components.containsKey(name) && isBreakerActive(components.get(name)))
                .collect(Collectors.toList());
    }

    private static boolean isBreakerActive(ComponentHealthSnapshot snapshot) {
        Map<String, Object> details = snapshot.getDetails();
        return details != null && Boolean.TRUE.equals(details.get("circuit_breaker_active"));
    }

    private static double heartbeatAge(ComponentHealthSnapshot snapshot) {
        Map<String, Object> details = snapshot.getDetails();
        if (details == null) {
            return 0;
        }
        Object age = details.get("heartbeat_age");
        return age instanceof Number ? ((Number) age).doubleValue() : 0;
    }

    private static Map<String, ComponentHealthSnapshot> components(AlertContext context) {
        if (context.getHealth() == null || context.getHealth().getComponents() == null) {
            return Collections.emptyMap();
        }
        return context.getHealth().getComponents();
    }
}
