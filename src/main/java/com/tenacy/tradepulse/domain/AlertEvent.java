package com.tenacy.tradepulse.domain;

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
public class AlertEvent implements StoredRecord {
    private Long id;
    private String alertId;
    private String ruleId;
    private String ruleName;
    private AlertSeverity severity;
    private String message;
    private String component;
    private Map<String, Object> context;
    private List<String> channels;
    private Instant timestamp;
}
