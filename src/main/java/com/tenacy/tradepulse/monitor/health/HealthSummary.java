package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Aggregate result of one health tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSummary {
    private Instant timestamp;
    private HealthStatus overall;
    private Map<String, ComponentHealthSnapshot> components;

    public static HealthSummary unknown(Instant now) {
        return HealthSummary.builder()
                .timestamp(now)
                .overall(HealthStatus.UNKNOWN)
                .components(Collections.emptyMap())
                .build();
    }
}
