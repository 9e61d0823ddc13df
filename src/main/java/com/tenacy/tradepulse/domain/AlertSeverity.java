package com.tenacy.tradepulse.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    INFO("ℹ️", "#0099ff"),
    WARNING("🟠", "#ff9900"),
    CRITICAL("🔴", "#ff0000");

    private final String emoji;
    private final String color;

    AlertSeverity(String emoji, String color) {
        this.emoji = emoji;
        this.color = color;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getColor() {
        return color;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AlertSeverity fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Alert severity is required");
        }
        return AlertSeverity.valueOf(code.trim().toUpperCase());
    }
}
