package com.tenacy.tradepulse.monitor.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.config.MonitorProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Registers one probe per configured component.
 */
@Configuration
public class HealthProbeConfig {

    public static final String BACKEND = "backend";
    public static final String FRONTEND = "frontend";
    public static final String TRADING_AGENT = "tradingAgent";

    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, MonitorProperties properties) {
        return timeoutTemplate(builder, properties.getComponents().getBackend());
    }

    @Bean
    public LivenessFileReader livenessFileReader(MonitorProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new LivenessFileReader(
                Paths.get(properties.getComponents().getTradingAgent().getHealthFile()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnExpression("${tradepulse.components.backend.enabled:true} && '${tradepulse.components.backend.url:}' != ''")
    public ComponentProbe backendProbe(MonitorProperties properties, RestTemplate backendRestTemplate, Clock clock) {
        MonitorProperties.Thresholds thresholds = properties.getThresholds();
        return new HttpHealthProbe(BACKEND, properties.getComponents().getBackend().getUrl(), backendRestTemplate,
                thresholds.getResponseTimeWarningMs(), thresholds.getResponseTimeCriticalMs(), clock);
    }

    @Bean
    @ConditionalOnExpression("${tradepulse.components.frontend.enabled:true} && '${tradepulse.components.frontend.url:}' != ''")
    public ComponentProbe frontendProbe(MonitorProperties properties, RestTemplateBuilder builder, Clock clock) {
        MonitorProperties.HttpComponent frontend = properties.getComponents().getFrontend();
        return new HttpReachabilityProbe(FRONTEND, frontend.getUrl(), timeoutTemplate(builder, frontend), clock);
    }

    @Bean
    @ConditionalOnExpression("${tradepulse.components.trading-agent.enabled:true}")
    public ComponentProbe tradingAgentProbe(MonitorProperties properties, LivenessFileReader livenessFileReader,
                                            Clock clock) {
        return new LivenessFileProbe(TRADING_AGENT, livenessFileReader,
                properties.getComponents().getTradingAgent().getMaxHeartbeatAge(), clock);
    }

    private RestTemplate timeoutTemplate(RestTemplateBuilder builder, MonitorProperties.HttpComponent component) {
        Duration timeout = Duration.ofMillis(component.getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
