package com.tenacy.tradepulse.logs;

import com.tenacy.tradepulse.domain.LogLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedLogLine {
    private LogLevel level;
    private String message;
    private String component;
    private Map<String, Object> context;
}
