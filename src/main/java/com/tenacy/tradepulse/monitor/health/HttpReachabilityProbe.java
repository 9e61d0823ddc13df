package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain reachability check for components without a health document, such as the web frontend.
 */
@Slf4j
public class HttpReachabilityProbe implements ComponentProbe {

    private final String componentId;
    private final String url;
    private final RestTemplate restTemplate;
    private final Clock clock;

    public HttpReachabilityProbe(String componentId, String url, RestTemplate restTemplate, Clock clock) {
        this.componentId = componentId;
        this.url = url;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public String getComponentId() {
        return componentId;
    }

    @Override
    public ComponentHealthSnapshot check() {
        long startTime = clock.millis();
        Map<String, Object> details = new LinkedHashMap<>();
        HealthStatus status;

        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            int statusCode = response.getStatusCode().value();

            status = statusCode == 200 ? HealthStatus.HEALTHY : HealthStatus.WARNING;
            details.put("statusCode", statusCode);
        } catch (RestClientException e) {
            log.error("{} health check failed: {}", componentId, e.getMessage());
            status = HealthStatus.CRITICAL;
            details.put("error", e.getMessage());
        }

        return ComponentHealthSnapshot.builder()
                .component(componentId)
                .status(status)
                .responseTimeMs(clock.millis() - startTime)
                .details(details)
                .timestamp(clock.instant())
                .build();
    }
}
