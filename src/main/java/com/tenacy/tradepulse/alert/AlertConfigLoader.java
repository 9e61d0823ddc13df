package com.tenacy.tradepulse.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the alert document from {@code tradepulse.alerts.config-path}.
 * Any failure yields {@link AlertConfiguration#empty()}.
 */
@Component
@Slf4j
public class AlertConfigLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String configPath;

    public AlertConfigLoader(ResourceLoader resourceLoader,
                             ObjectMapper objectMapper,
                             @Value("${tradepulse.alerts.config-path:classpath:alerts.json}") String configPath) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.configPath = configPath;
    }

    public AlertConfiguration load() {
        Resource resource = resourceLoader.getResource(configPath);

        try (InputStream in = resource.getInputStream()) {
            AlertConfiguration configuration = objectMapper.readValue(in, AlertConfiguration.class);
            if (configuration == null) {
                log.error("알림 설정이 비어 있습니다: {}", configPath);
                return AlertConfiguration.empty();
            }
            configuration.normalize();
            return configuration;
        } catch (IOException | RuntimeException e) {
            log.error("알림 설정 로드 실패 ({}): {}", configPath, e.getMessage());
            return AlertConfiguration.empty();
        }
    }

    public String getConfigPath() {
        return configPath;
    }
}
