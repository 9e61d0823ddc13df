package com.tenacy.tradepulse.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentHealthSnapshot implements StoredRecord {
    private Long id;
    private String component;
    private HealthStatus status;
    private Long responseTimeMs;
    private Map<String, Object> details;
    private Instant timestamp;
}
