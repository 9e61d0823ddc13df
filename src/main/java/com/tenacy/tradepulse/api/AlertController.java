package com.tenacy.tradepulse.api;

import com.tenacy.tradepulse.alert.AlertConfiguration;
import com.tenacy.tradepulse.alert.AlertManager;
import com.tenacy.tradepulse.api.dto.ApiResponse;
import com.tenacy.tradepulse.api.dto.TradeFailureRequest;
import com.tenacy.tradepulse.coordinator.MonitoringCoordinator;
import com.tenacy.tradepulse.domain.AlertEvent;
import com.tenacy.tradepulse.store.EventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertManager alertManager;
    private final MonitoringCoordinator monitoringCoordinator;
    private final EventStore eventStore;

    @GetMapping
    public ResponseEntity<ApiResponse<List<AlertEvent>>> getRecentAlerts(
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(ApiResponse.success(alertManager.getAlertHistory(limit)));
    }

    @GetMapping("/history")
    public ResponseEntity<ApiResponse<List<AlertEvent>>> getStoredAlerts(
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(ApiResponse.success(eventStore.recentAlerts(limit)));
    }

    @PostMapping("/test")
    public ResponseEntity<ApiResponse<Map<String, String>>> testChannels() {
        return ResponseEntity.ok(ApiResponse.success(alertManager.testChannels()));
    }

    @PostMapping("/reload")
    public ResponseEntity<ApiResponse<Void>> reloadConfig() {
        AlertConfiguration configuration = alertManager.reloadConfig();
        return ResponseEntity.ok(ApiResponse.message(
                "Alert rules reloaded: " + configuration.getRules().size() + " rules"));
    }

    @PostMapping("/trade-failure")
    public ResponseEntity<ApiResponse<Void>> reportTradeFailure(@RequestBody(required = false) TradeFailureRequest request) {
        monitoringCoordinator.reportTradeFailure(request != null ? request.getReason() : null);
        return ResponseEntity.ok(ApiResponse.message("Trade failure recorded"));
    }
}
