package com.tenacy.tradepulse.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.domain.LogLevel;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw log line into a structured record. First match wins:
 * <ol>
 *     <li>JSON object line</li>
 *     <li>{@code [timestamp] [LEVEL] message}</li>
 *     <li>keyword classification of the whole line</li>
 * </ol>
 */
public class LogLineParser {

    private static final Pattern BRACKET_PATTERN = Pattern.compile("\\[(.*?)]\\s*\\[(.*?)]\\s*(.*)");

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private static final List<String> ERROR_KEYWORDS = List.of("error", "exception", "failed", "failure", "critical");
    private static final List<String> WARNING_KEYWORDS = List.of("warning", "warn", "deprecated");

    private final ObjectMapper objectMapper;
    private final String defaultComponent;

    public LogLineParser(ObjectMapper objectMapper, String defaultComponent) {
        this.objectMapper = objectMapper;
        this.defaultComponent = defaultComponent;
    }

    /**
     * @return empty for blank lines
     * @throws JsonProcessingException when a line looks like JSON but is not
     */
    public Optional<ClassifiedLogLine> parse(String line) throws JsonProcessingException {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        String trimmed = line.trim();
        if (trimmed.startsWith("{")) {
            return Optional.of(parseStructured(line, trimmed));
        }

        Matcher matcher = BRACKET_PATTERN.matcher(line);
        if (matcher.find()) {
            Optional<LogLevel> level = LogLevel.parse(matcher.group(2));
            if (level.isPresent()) {
                return Optional.of(ClassifiedLogLine.builder()
                        .level(level.get())
                        .message(matcher.group(3))
                        .component(defaultComponent)
                        .context(Map.of("raw", line))
                        .build());
            }
        }

        return Optional.of(ClassifiedLogLine.builder()
                .level(classifyByKeyword(line))
                .message(line)
                .component(defaultComponent)
                .context(Map.of("raw", line))
                .build());
    }

    private ClassifiedLogLine parseStructured(String line, String trimmed) throws JsonProcessingException {
        Map<String, Object> parsed = objectMapper.readValue(trimmed, OBJECT_TYPE);

        LogLevel level = LogLevel.parse(firstText(parsed, "level", "levelname")).orElse(LogLevel.INFO);
        String message = firstText(parsed, "message", "msg");
        String component = firstText(parsed, "component", "logger");

        return ClassifiedLogLine.builder()
                .level(level)
                .message(message != null ? message : line)
                .component(component != null ? component : defaultComponent)
                .context(parsed)
                .build();
    }

    LogLevel classifyByKeyword(String line) {
        String lowerLine = line.toLowerCase(Locale.ROOT);

        if (ERROR_KEYWORDS.stream().anyMatch(lowerLine::contains)) {
            return LogLevel.ERROR;
        }
        if (WARNING_KEYWORDS.stream().anyMatch(lowerLine::contains)) {
            return LogLevel.WARNING;
        }
        return LogLevel.INFO;
    }

    private static String firstText(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }
}
