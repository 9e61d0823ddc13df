package com.tenacy.tradepulse.alert.channel;

import com.tenacy.tradepulse.alert.AlertMessage;
import com.tenacy.tradepulse.domain.AlertSeverity;
import com.tenacy.tradepulse.exception.AlertDeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

@Component
@Slf4j
public class EmailChannel implements AlertChannel {

    private final JavaMailSender mailSender;
    private final String sender;
    private final String recipients;
    private final Clock clock;

    public EmailChannel(ObjectProvider<JavaMailSender> mailSender,
                        @Value("${tradepulse.alert.email.sender:}") String sender,
                        @Value("${tradepulse.alert.email.recipients:}") String recipients,
                        Clock clock) {
        this.mailSender = mailSender.getIfAvailable();
        this.sender = sender;
        this.recipients = recipients;
        this.clock = clock;

        if (!isConfigured()) {
            log.warn("Email credentials not configured");
        }
    }

    @Override
    public String getName() {
        return "email";
    }

    @Override
    public void send(AlertMessage message, AlertSeverity severity) {
        if (!isConfigured()) {
            throw new AlertDeliveryException("Email not configured");
        }

        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, StandardCharsets.UTF_8.name());
            helper.setFrom(sender);
            helper.setTo(recipients.split(","));
            helper.setSubject("[" + severity.name() + "] " + message.getTitle());
            helper.setText(buildHtmlContent(message, severity), true);

            mailSender.send(mimeMessage);
            log.info("알림 이메일이 성공적으로 전송되었습니다: {}", message.getTitle());
        } catch (MessagingException | MailException e) {
            log.error("알림 이메일 전송 실패: {}", e.getMessage());
            throw new AlertDeliveryException("Email delivery failed: " + e.getMessage(), e);
        }
    }

    String buildHtmlContent(AlertMessage message, AlertSeverity severity) {
        String color = severity.getColor();
        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.instant();

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><style>")
                .append("body { font-family: Arial, sans-serif; line-height: 1.6; }")
                .append(".container { max-width: 600px; margin: 0 auto; padding: 20px; }")
                .append(".header { background: ").append(color)
                .append("; color: white; padding: 20px; border-radius: 5px 5px 0 0; }")
                .append(".content { background: #f9f9f9; padding: 20px; border: 1px solid #ddd; border-top: none; }")
                .append(".details { background: white; padding: 15px; margin: 10px 0; border-left: 4px solid ")
                .append(color).append("; }")
                .append(".footer { text-align: center; color: #666; font-size: 12px; margin-top: 20px; }")
                .append("</style></head><body><div class=\"container\">")
                .append("<div class=\"header\"><h2>").append(escape(message.getTitle())).append("</h2></div>")
                .append("<div class=\"content\">")
                .append("<p><strong>Severity:</strong> ").append(severity.name()).append("</p>")
                .append("<p>").append(escape(message.getText())).append("</p>");

        if (StringUtils.hasText(message.getDetails())) {
            html.append("<div class=\"details\"><strong>Details:</strong><br>")
                    .append(escape(message.getDetails()))
                    .append("</div>");
        }

        html.append("<p><strong>Timestamp:</strong> ")
                .append(SlackChannel.TIMESTAMP_FORMAT.format(timestamp.atZone(clock.getZone())))
                .append("</p></div>")
                .append("<div class=\"footer\"><p>Trading System Diagnostic Alert</p></div>")
                .append("</div></body></html>");
        return html.toString();
    }

    private static String escape(String value) {
        return value != null ? HtmlUtils.htmlEscape(value, StandardCharsets.UTF_8.name()) : "";
    }

    private boolean isConfigured() {
        return mailSender != null && StringUtils.hasText(sender) && StringUtils.hasText(recipients);
    }
}
