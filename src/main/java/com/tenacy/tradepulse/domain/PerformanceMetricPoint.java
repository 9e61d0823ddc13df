package com.tenacy.tradepulse.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetricPoint implements StoredRecord {
    private Long id;
    private String component;
    private String metricName;
    private double value;
    private String unit;
    private Instant timestamp;
}
