package com.tenacy.tradepulse.api.dto;

import com.tenacy.tradepulse.domain.UptimeRecord;
import com.tenacy.tradepulse.logs.ErrorCounts;
import com.tenacy.tradepulse.monitor.health.HealthSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusSummaryResponse {
    private HealthSummary health;
    private Map<String, Object> metrics;
    private ErrorCounts errorCounts;
    private List<UptimeRecord> uptime;
    private Instant timestamp;
}
