package com.jz.support.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 工单分类（路由器只允许输出这 10 个值）。
 * openerGroup 决定拼装时用哪组开场白；tools 只是告诉评估方"生成方能调用哪些工具"。
 */
public enum Category {

    SHIPPING_OR_DELIVERY_QUESTION("shipping_or_delivery_question", "shipping", Specialist.SHIPPING, 2,
            List.of("get_subscription", "track_package")),
    PAYMENT_QUESTION("payment_question", "payment", Specialist.BILLING, 3,
            List.of("get_subscription", "get_payment_history")),
    FREQUENCY_CHANGE_REQUEST("frequency_change_request", "subscription", Specialist.BILLING, 2,
            List.of("get_subscription", "change_frequency")),
    SKIP_OR_PAUSE_REQUEST("skip_or_pause_request", "subscription", Specialist.BILLING, 2,
            List.of("get_subscription", "skip_month", "pause_subscription")),
    RECIPIENT_OR_ADDRESS_CHANGE("recipient_or_address_change", "subscription", Specialist.SHIPPING, 2,
            List.of("get_subscription", "change_address")),
    CUSTOMIZATION_REQUEST("customization_request", "subscription", Specialist.QUALITY, 2,
            List.of("get_subscription", "get_box_contents")),
    DAMAGED_OR_LEAKING_ITEM_REPORT("damaged_or_leaking_item_report", "damage", Specialist.QUALITY, 3,
            List.of("get_subscription", "create_damage_claim", "request_photos")),
    GRATITUDE("gratitude", "gratitude", Specialist.QUALITY, 1,
            List.of()),
    RETENTION_PRIMARY_REQUEST("retention_primary_request", "retention", Specialist.RETENTION, 4,
            List.of("get_subscription", "generate_cancel_link", "get_customer_history")),
    RETENTION_REPEATED_REQUEST("retention_repeated_request", "retention", Specialist.RETENTION, 4,
            List.of("get_subscription", "generate_cancel_link"));

    /** 路由器输出越界/解析失败时的兜底分类 */
    public static final Category SAFE_DEFAULT = SHIPPING_OR_DELIVERY_QUESTION;

    private final String code;
    private final String openerGroup;
    private final Specialist specialist;
    private final int autoSendPhase;
    private final List<String> tools;

    Category(String code, String openerGroup, Specialist specialist, int autoSendPhase, List<String> tools) {
        this.code = code;
        this.openerGroup = openerGroup;
        this.specialist = specialist;
        this.autoSendPhase = autoSendPhase;
        this.tools = tools;
    }

    @JsonValue
    public String code() { return code; }

    public String openerGroup() { return openerGroup; }

    public Specialist specialist() { return specialist; }

    public List<String> tools() { return tools; }

    public boolean isRetention() {
        return this == RETENTION_PRIMARY_REQUEST || this == RETENTION_REPEATED_REQUEST;
    }

    /** 只有第一阶段开放的分类才允许自动发送 */
    public boolean autoSendEnabled() { return autoSendPhase <= 1; }

    public static Optional<Category> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String norm = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.code.equals(norm)).findFirst();
    }

    public static String allCodes() {
        return String.join(", ", Arrays.stream(values()).map(Category::code).toList());
    }
}
