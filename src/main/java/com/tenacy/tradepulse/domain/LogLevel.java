package com.tenacy.tradepulse.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isError() {
        return this == ERROR || this == CRITICAL;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    /**
     * Resolves a level token as written by the monitored processes.
     * {@code warn} and {@code fatal} are accepted as aliases.
     */
    public static Optional<LogLevel> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        return switch (token.trim().toUpperCase()) {
            case "DEBUG", "TRACE" -> Optional.of(DEBUG);
            case "INFO" -> Optional.of(INFO);
            case "WARN", "WARNING" -> Optional.of(WARNING);
            case "ERROR" -> Optional.of(ERROR);
            case "CRITICAL", "FATAL" -> Optional.of(CRITICAL);
            default -> Optional.empty();
        };
    }

    @JsonCreator
    public static LogLevel fromCode(String code) {
        return parse(code).orElse(INFO);
    }
}
