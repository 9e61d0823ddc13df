package com.tenacy.tradepulse.alert;

import com.tenacy.tradepulse.logs.ErrorCounts;
import com.tenacy.tradepulse.monitor.health.HealthSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Snapshot of monitoring state a rule set is evaluated against.
 * Health and metrics may come from different polls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertContext {
    private HealthSummary health;
    private Map<String, Object> performance;
    private ErrorCounts errors;
    private Instant timestamp;
    private boolean tradeFailure;
    private String tradeFailureReason;

    /**
     * Numeric performance value, 0 when absent or not a number.
     */
    public double performanceValue(String key) {
        Map<String, Object> source = performance != null ? performance : Collections.emptyMap();
        Object value = source.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : 0;
    }

    public int errorsLast10Minutes() {
        return errors != null ? errors.getLast10Minutes() : 0;
    }
}
