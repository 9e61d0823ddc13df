package com.tenacy.tradepulse.alert.channel;

import com.tenacy.tradepulse.alert.AlertMessage;
import com.tenacy.tradepulse.domain.AlertSeverity;
import com.tenacy.tradepulse.exception.AlertDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class SlackChannel implements AlertChannel {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final Clock clock;

    public SlackChannel(@Qualifier("alertRestTemplate") RestTemplate restTemplate,
                        @Value("${tradepulse.alert.slack.webhook-url:}") String webhookUrl,
                        Clock clock) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
        this.clock = clock;

        if (!StringUtils.hasText(webhookUrl)) {
            log.warn("Slack webhook URL not configured");
        }
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public void send(AlertMessage message, AlertSeverity severity) {
        if (!StringUtils.hasText(webhookUrl)) {
            throw new AlertDeliveryException("Slack not configured");
        }

        try {
            restTemplate.postForEntity(webhookUrl, buildPayload(message, severity), String.class);
            log.debug("Slack alert sent: {}", message.getTitle());
        } catch (RestClientException e) {
            log.error("Slack 알림 전송 실패: {}", e.getMessage());
            throw new AlertDeliveryException("Slack delivery failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> buildPayload(AlertMessage message, AlertSeverity severity) {
        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.instant();
        String details = StringUtils.hasText(message.getDetails()) ? message.getDetails() : "N/A";

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", severity.getColor());
        attachment.put("title", message.getTitle());
        attachment.put("text", message.getText());
        attachment.put("fields", List.of(
                field("Details", details, false),
                field("Severity", severity.name(), true),
                field("Timestamp", TIMESTAMP_FORMAT.format(timestamp.atZone(clock.getZone())), true)));
        attachment.put("footer", "Trading Diagnostic System");
        attachment.put("ts", timestamp.getEpochSecond());

        return Map.of("attachments", List.of(attachment));
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
        return field;
    }
}
