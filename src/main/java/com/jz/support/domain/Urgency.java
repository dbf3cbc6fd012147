package com.jz.support.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Urgency {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 无法识别时按 MEDIUM 处理 */
    public static Urgency parseOrMedium(String raw) {
        if (raw == null) return MEDIUM;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high" -> HIGH;
            case "critical" -> CRITICAL;
            default -> MEDIUM;
        };
    }
}
