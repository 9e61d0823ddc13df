package com.tenacy.tradepulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEntryRequest {
    private String component;
    private String level;
    private String message;
    private Map<String, Object> context;
}
