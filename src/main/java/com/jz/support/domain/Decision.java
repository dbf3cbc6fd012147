package com.jz.support.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 终态决策。REFINE 只允许作为团队模式第一轮的中间值出现，不会返回给调用方。
 */
public enum Decision {
    SEND, DRAFT, ESCALATE, REFINE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Decision> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "send" -> Optional.of(SEND);
            case "draft" -> Optional.of(DRAFT);
            case "escalate" -> Optional.of(ESCALATE);
            case "refine" -> Optional.of(REFINE);
            default -> Optional.empty();
        };
    }
}
