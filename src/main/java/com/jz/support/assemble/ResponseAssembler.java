package com.jz.support.assemble;

import com.jz.support.domain.Category;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 确定性拼装：问候 + 开场白 + 正文 + 结束语 + 落款，不调用模型。
 * 同一 sessionId 始终选中同一组开场白/结束语，不同会话之间有变化。
 */
@Component
public class ResponseAssembler {

    static final String SIGN_OFF = "Warm regards,<br>Lev Haolam Support Team";

    private static final Map<String, List<String>> OPENERS = Map.of(
            "shipping", List.of(
                    "I'd be happy to help you with your shipment!",
                    "Let me look into your delivery for you.",
                    "I understand how important it is to receive your package on time."),
            "payment", List.of(
                    "I'd be happy to help with your payment question.",
                    "Let me look into your billing details.",
                    "I understand you have a question about your payment."),
            "subscription", List.of(
                    "I'd be happy to help with your subscription.",
                    "Let me assist you with that change.",
                    "I can help you with your subscription request."),
            "damage", List.of(
                    "I'm sorry to hear about the issue with your package.",
                    "I apologize for the inconvenience. Let me help resolve this.",
                    "I'm sorry that happened. Let me help make it right."),
            "retention", List.of(
                    "I'm sorry to hear you're considering leaving us.",
                    "I understand, and I appreciate you reaching out before making a decision.",
                    "Thank you for letting us know. I'd love the opportunity to help."),
            "gratitude", List.of(
                    "What a wonderful message, thank you so much!",
                    "That truly means a lot to our team!",
                    "Thank you for your kind words!"),
            "general", List.of(
                    "Thank you for reaching out to us.",
                    "I'd be happy to help you with that.",
                    "Thank you for contacting Lev Haolam support."));

    private static final List<String> CLOSERS = List.of(
            "If you have any other questions, please don't hesitate to reach out.",
            "Please let me know if there's anything else I can help with.",
            "Feel free to contact us again if you need further assistance.",
            "Don't hesitate to reach out if you need anything else.",
            "I'm here if you need any further help.",
            "Please let me know if you have any other questions or concerns.",
            "We're always here to help, just reach out anytime.",
            "Is there anything else I can assist you with today?");

    /** 系统/升级话术：不包装，原样返回 */
    private static final List<String> SYSTEM_PHRASES = List.of(
            "connecting you with a support agent",
            "connect you with a human",
            "having trouble processing",
            "let me connect you");

    private static final Pattern GENERIC_GREETING =
            Pattern.compile("^(Dear Customer|Dear Client|Hello|Hi there|Hi|Hey)(?:[,!]\\s*|\\s*\\n|\\s*$)", Pattern.CASE_INSENSITIVE);

    /**
     * @param rawReply     模型生成的正文（已做取消链接替换）
     * @param customerName 客户名，缺省为 Client
     * @param categoryCode 分类编码；未知分类使用通用开场白
     * @param sessionId    用于确定性选择
     */
    public String assemble(String rawReply, String customerName, String categoryCode, String sessionId) {
        String raw = rawReply == null ? "" : rawReply;
        if (isSystemResponse(raw)) return raw;

        BigInteger idx = stableHash(sessionId);
        String group = Category.fromCode(categoryCode).map(Category::openerGroup).orElse("general");
        List<String> openers = OPENERS.getOrDefault(group, OPENERS.get("general"));

        String greeting = "Dear " + customerName + ",";
        String opener = openers.get(pick(idx, openers.size()));
        String body = ReplySanitizer.sanitize(stripExistingGreeting(raw, customerName));
        String closer = CLOSERS.get(pick(idx, CLOSERS.size()));

        return String.join("\n",
                div(greeting),
                div(opener),
                div(body),
                div(closer),
                div(SIGN_OFF));
    }

    static boolean isSystemResponse(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String p : SYSTEM_PHRASES) if (lower.contains(p)) return true;
        return false;
    }

    /** 去掉模型自己加的问候（"Dear Sarah," / "Hi Sarah!" / "Dear Customer," / "Hello," 等） */
    static String stripExistingGreeting(String text, String customerName) {
        String s = text;
        if (customerName != null && !customerName.isBlank()) {
            Pattern named = Pattern.compile(
                    "^(Dear|Hi|Hello|Hey)\\s+" + Pattern.quote(customerName) + "[,!]?\\s*\\n?",
                    Pattern.CASE_INSENSITIVE);
            s = named.matcher(s).replaceFirst("").strip();
        }
        return GENERIC_GREETING.matcher(s).replaceFirst("").strip();
    }

    static BigInteger stableHash(String sessionId) {
        byte[] md5 = DigestUtils.md5Digest((sessionId == null ? "" : sessionId).getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, md5);
    }

    private static int pick(BigInteger idx, int n) {
        return idx.mod(BigInteger.valueOf(n)).intValue();
    }

    private static String div(String s) {
        return "<div>" + s + "</div>";
    }
}
