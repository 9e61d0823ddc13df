package com.tenacy.tradepulse.api;

import com.tenacy.tradepulse.api.dto.ApiResponse;
import com.tenacy.tradepulse.api.dto.LogEntryRequest;
import com.tenacy.tradepulse.domain.LogLevel;
import com.tenacy.tradepulse.domain.SystemLogEntry;
import com.tenacy.tradepulse.logs.LogAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/logs")
@RequiredArgsConstructor
public class LogController {

    private final LogAggregator logAggregator;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SystemLogEntry>>> getRecentLogs(
            @RequestParam(required = false) String component,
            @RequestParam(required = false) String level,
            @RequestParam(defaultValue = "100") int limit) {
        LogLevel logLevel = StringUtils.hasText(level) ? requireLevel(level) : null;
        return ResponseEntity.ok(ApiResponse.success(logAggregator.getRecentLogs(component, logLevel, limit)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SystemLogEntry>> createLog(@RequestBody LogEntryRequest request) {
        if (!StringUtils.hasText(request.getMessage())) {
            throw new IllegalArgumentException("message is required");
        }

        LogLevel level = StringUtils.hasText(request.getLevel()) ? requireLevel(request.getLevel()) : LogLevel.INFO;
        String component = StringUtils.hasText(request.getComponent()) ? request.getComponent() : "external";

        SystemLogEntry entry = logAggregator.logEntry(component, level, request.getMessage(), request.getContext());
        return ResponseEntity.ok(ApiResponse.success(entry));
    }

    private static LogLevel requireLevel(String level) {
        return LogLevel.parse(level)
                .orElseThrow(() -> new IllegalArgumentException("Unknown log level: " + level));
    }
}
