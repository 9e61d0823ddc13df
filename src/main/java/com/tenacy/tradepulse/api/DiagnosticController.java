package com.tenacy.tradepulse.api;

import com.tenacy.tradepulse.api.dto.ApiResponse;
import com.tenacy.tradepulse.api.dto.StatusSummaryResponse;
import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.PerformanceMetricPoint;
import com.tenacy.tradepulse.domain.UptimeRecord;
import com.tenacy.tradepulse.logs.LogAggregator;
import com.tenacy.tradepulse.monitor.health.HealthMonitor;
import com.tenacy.tradepulse.monitor.health.HealthSummary;
import com.tenacy.tradepulse.monitor.performance.PerformanceMonitor;
import com.tenacy.tradepulse.store.EventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DiagnosticController {

    private final HealthMonitor healthMonitor;
    private final PerformanceMonitor performanceMonitor;
    private final LogAggregator logAggregator;
    private final EventStore eventStore;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthSummary>> getHealth() {
        return ResponseEntity.ok(ApiResponse.success(healthMonitor.getStatus()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getMetrics() {
        return ResponseEntity.ok(ApiResponse.success(performanceMonitor.getMetrics()));
    }

    // 저장된 메트릭 이력
    @GetMapping("/metrics/{component}")
    public ResponseEntity<ApiResponse<List<PerformanceMetricPoint>>> getComponentMetricHistory(
            @PathVariable String component,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(ApiResponse.success(eventStore.recentMetrics(component, null, limit)));
    }

    @GetMapping("/metrics/{component}/current")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getComponentMetrics(@PathVariable String component) {
        return ResponseEntity.ok(ApiResponse.success(performanceMonitor.getComponentMetrics(component)));
    }

    @GetMapping("/history/health/{component}")
    public ResponseEntity<ApiResponse<List<ComponentHealthSnapshot>>> getHealthHistory(
            @PathVariable String component,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(ApiResponse.success(eventStore.recentHealthSnapshots(component, limit)));
    }

    @GetMapping("/uptime")
    public ResponseEntity<ApiResponse<List<UptimeRecord>>> getUptime() {
        return ResponseEntity.ok(ApiResponse.success(eventStore.uptimeStats()));
    }

    @GetMapping("/status/summary")
    public ResponseEntity<ApiResponse<StatusSummaryResponse>> getStatusSummary() {
        StatusSummaryResponse summary = StatusSummaryResponse.builder()
                .health(healthMonitor.getStatus())
                .metrics(performanceMonitor.getMetrics())
                .errorCounts(logAggregator.getErrorCounts())
                .uptime(eventStore.uptimeStats())
                .timestamp(clock.instant())
                .build();
        return ResponseEntity.ok(ApiResponse.success(summary));
    }
}
