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
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bot API transport. Messages are sent as HTML.
 */
@Component
@Slf4j
public class TelegramChannel implements AlertChannel {

    private final RestTemplate restTemplate;
    private final String apiBaseUrl;
    private final String botToken;
    private final String chatId;
    private final Clock clock;

    public TelegramChannel(@Qualifier("alertRestTemplate") RestTemplate restTemplate,
                           @Value("${tradepulse.alert.telegram.api-url:https://api.telegram.org}") String apiBaseUrl,
                           @Value("${tradepulse.alert.telegram.bot-token:}") String botToken,
                           @Value("${tradepulse.alert.telegram.chat-id:}") String chatId,
                           Clock clock) {
        this.restTemplate = restTemplate;
        this.apiBaseUrl = apiBaseUrl;
        this.botToken = botToken;
        this.chatId = chatId;
        this.clock = clock;

        if (!isConfigured()) {
            log.warn("Telegram credentials not configured");
        }
    }

    @Override
    public String getName() {
        return "telegram";
    }

    @Override
    public void send(AlertMessage message, AlertSeverity severity) {
        if (!isConfigured()) {
            throw new AlertDeliveryException("Telegram not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", formatMessage(message, severity));
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);

        try {
            restTemplate.postForEntity(apiBaseUrl + "/bot" + botToken + "/sendMessage", body, String.class);
            log.debug("Telegram alert sent: {}", message.getTitle());
        } catch (RestClientException e) {
            log.error("Telegram 알림 전송 실패: {}", e.getMessage());
            throw new AlertDeliveryException("Telegram delivery failed: " + e.getMessage(), e);
        }
    }

    String formatMessage(AlertMessage message, AlertSeverity severity) {
        StringBuilder text = new StringBuilder();
        text.append(severity.getEmoji()).append(" <b>").append(escape(message.getTitle())).append("</b>\n\n");

        if (StringUtils.hasText(message.getText())) {
            text.append(escape(message.getText())).append("\n\n");
        }
        if (StringUtils.hasText(message.getDetails())) {
            text.append("<i>").append(escape(message.getDetails())).append("</i>\n\n");
        }

        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.instant();
        text.append("⏰ ").append(SlackChannel.TIMESTAMP_FORMAT.format(timestamp.atZone(clock.getZone())));
        return text.toString();
    }

    // parse_mode=HTML 에서는 <, >, & 가 그대로 있으면 전송이 거부된다
    private static String escape(String value) {
        return value != null ? HtmlUtils.htmlEscape(value, StandardCharsets.UTF_8.name()) : "";
    }

    private boolean isConfigured() {
        return StringUtils.hasText(botToken) && StringUtils.hasText(chatId);
    }
}
