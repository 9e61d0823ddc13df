package com.tenacy.tradepulse.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tenacy.tradepulse.domain.AlertSeverity;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Externally loaded alert document: rules, channel routing, rate limiting and deduplication.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertConfiguration {

    private Map<String, ChannelSettings> channels = new LinkedHashMap<>();
    private List<AlertRule> rules = new ArrayList<>();
    private RateLimiting rateLimiting = new RateLimiting();
    private Deduplication deduplication = new Deduplication();

    /**
     * No rules, no channels, both suppression mechanisms off.
     */
    public static AlertConfiguration empty() {
        return new AlertConfiguration();
    }

    /**
     * Names of the channels the document enables for the given severity, in document order.
     */
    public List<String> channelsFor(AlertSeverity severity) {
        return channels.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().accepts(severity))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public List<String> enabledChannels() {
        return channels.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().isEnabled())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    void normalize() {
        if (channels == null) {
            channels = new LinkedHashMap<>();
        }
        if (rules == null) {
            rules = new ArrayList<>();
        }
        if (rateLimiting == null) {
            rateLimiting = new RateLimiting();
        }
        if (deduplication == null) {
            deduplication = new Deduplication();
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChannelSettings {
        private boolean enabled;
        private List<AlertSeverity> severity = new ArrayList<>();

        public boolean accepts(AlertSeverity level) {
            return enabled && severity != null && severity.contains(level);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimiting {
        private boolean enabled;
        private long windowMinutes = 15;
        private int maxAlertsPerWindow = 3;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Deduplication {
        private boolean enabled;
        private long windowMinutes = 5;
    }
}
