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
public class SystemLogEntry implements StoredRecord {
    private Long id;
    private String component;
    private LogLevel level;
    private String message;
    private Map<String, Object> context;
    private Instant timestamp;
}
