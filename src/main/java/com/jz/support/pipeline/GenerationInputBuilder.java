package com.jz.support.pipeline;

import com.jz.support.domain.HistoryTurn;

import java.util.ArrayList;
import java.util.List;

/**
 * 拼生成输入：客户标签 + 最近历史（每条截断） + 原消息。纯本地计算。
 */
public final class GenerationInputBuilder {
    private GenerationInputBuilder() {}

    public static String build(String customerName, String customerEmail,
                               List<HistoryTurn> history, String message, int turnCharCap) {
        List<String> parts = new ArrayList<>();
        parts.add("[Customer Name: " + customerName + "]");
        if (customerEmail != null && !customerEmail.isBlank()) {
            parts.add("[Customer Email: " + customerEmail + "]");
        }
        if (history != null && !history.isEmpty()) {
            parts.add("");
            parts.add("[Conversation History]");
            for (HistoryTurn t : history) {
                String role = t.isCustomer() ? "Customer" : "Agent";
                parts.add(role + ": " + cap(t.getContent(), turnCharCap));
            }
            parts.add("[End History]");
        }
        parts.add("");
        parts.add(message);
        return String.join("\n", parts);
    }

    public static String withFeedback(String input, String feedback) {
        return input + "\n\n"
                + "[QA FEEDBACK - please revise your response]\n"
                + (feedback == null ? "" : feedback) + "\n"
                + "[End QA Feedback]";
    }

    static String cap(String s, int max) {
        if (s == null) return "";
        if (max <= 0 || s.length() <= max) return s;
        return s.substring(0, max) + "...";
    }
}
