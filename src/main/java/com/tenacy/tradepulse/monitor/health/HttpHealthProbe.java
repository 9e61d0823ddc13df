package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probes a component that exposes a JSON health endpoint.
 * <p>
 * A 2xx answer is classified by response time and the reported breaker flag.
 * Timeouts, refused connections and non-2xx answers are {@code critical}.
 */
@Slf4j
public class HttpHealthProbe implements ComponentProbe {

    static final String BREAKER_KEY = "circuit_breaker_active";

    private static final List<String> REPORTED_KEYS = List.of(
            "uptime_seconds", "models_loaded", BREAKER_KEY, "last_signal", "last_trade", "error_count");

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE =
            new ParameterizedTypeReference<>() {};

    private final String componentId;
    private final String url;
    private final RestTemplate restTemplate;
    private final long warningThresholdMs;
    private final long criticalThresholdMs;
    private final Clock clock;

    public HttpHealthProbe(String componentId, String url, RestTemplate restTemplate,
                           long warningThresholdMs, long criticalThresholdMs, Clock clock) {
        this.componentId = componentId;
        this.url = url;
        this.restTemplate = restTemplate;
        this.warningThresholdMs = warningThresholdMs;
        this.criticalThresholdMs = criticalThresholdMs;
        this.clock = clock;
    }

    @Override
    public String getComponentId() {
        return componentId;
    }

    @Override
    public ComponentHealthSnapshot check() {
        long startTime = clock.millis();

        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(url, HttpMethod.GET, null, BODY_TYPE);
            long responseTime = clock.millis() - startTime;

            Map<String, Object> body = response.getBody() != null ? response.getBody() : Map.of();
            boolean breakerActive = Boolean.TRUE.equals(body.get(BREAKER_KEY));

            Map<String, Object> details = new LinkedHashMap<>();
            for (String key : REPORTED_KEYS) {
                details.put(key, body.get(key));
            }

            return snapshot(classify(responseTime, breakerActive), responseTime, details);
        } catch (RestClientException e) {
            log.error("{} health check failed: {}", componentId, e.getMessage());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage());
            return snapshot(HealthStatus.CRITICAL, clock.millis() - startTime, details);
        }
    }

    HealthStatus classify(long responseTimeMs, boolean breakerActive) {
        if (responseTimeMs > criticalThresholdMs) {
            return HealthStatus.CRITICAL;
        }
        if (breakerActive || responseTimeMs > warningThresholdMs) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    private ComponentHealthSnapshot snapshot(HealthStatus status, long responseTime, Map<String, Object> details) {
        return ComponentHealthSnapshot.builder()
                .component(componentId)
                .status(status)
                .responseTimeMs(responseTime)
                .details(details)
                .timestamp(clock.instant())
                .build();
    }
}
