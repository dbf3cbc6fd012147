package com.jz.support.assemble;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 回复正文的确定性清洗：
 * 1) 把"承诺具体补救"的句式改写成不承诺的说法（补发/换货/退款需要人工批准）；
 * 2) 含内部字段名/模板占位的句子整体替换成"请补充信息"。
 * 对同一输入多次调用结果不变。
 */
public final class ReplySanitizer {
    private ReplySanitizer() {}

    static final String MORE_INFO_FALLBACK =
            "Could you please provide more information so I can look into this for you?";

    private static final String REMEDY = "(?:free\\s+)?(?:reshipment|re-shipment|replacement|refund|credit|reimbursement)";

    /** 承诺句式 → 中性句式；替换结果不能再命中任何一条 */
    private static final Map<Pattern, String> COMMITMENTS = new LinkedHashMap<>();
    static {
        COMMITMENTS.put(Pattern.compile(
                        "\\b(?:I|we)\\s*(?:will|'ll|am going to|are going to)\\s+(?:arrange|send|ship|issue|process|provide)\\s+(?:you\\s+)?(?:a|an|your)?\\s*" + REMEDY + "(?:\\s+for\\s+you)?",
                        Pattern.CASE_INSENSITIVE),
                "our team will review your case and follow up with the next steps");
        COMMITMENTS.put(Pattern.compile(
                        "\\bwill\\s+arrange\\s+(?:a|an|your)?\\s*" + REMEDY,
                        Pattern.CASE_INSENSITIVE),
                "will review your case and follow up with the next steps");
        COMMITMENTS.put(Pattern.compile(
                        "\\byou\\s+will\\s+(?:receive|get)\\s+(?:a|an|your)?\\s*(?:full\\s+)?" + REMEDY,
                        Pattern.CASE_INSENSITIVE),
                "our team will review the best way to resolve this for you");
        COMMITMENTS.put(Pattern.compile(
                        "\\ba\\s+" + REMEDY + "\\s+(?:is|has been)\\s+on\\s+(?:its|the)\\s+way",
                        Pattern.CASE_INSENSITIVE),
                "your case has been passed to our team for review");
    }

    private static final String FIELD_NAMES =
            "customer_email|customer_id|customer_name|subscription_id|request_subtype|request_sub_subtype"
                    + "|order_id|tracking_number|next_charge_date|payment_status|box_contents|ticket_id|session_id";

    /** 内部字段名、{{占位}}、{占位}、[占位] 出现在哪一句，就替换哪一句 */
    private static final Pattern LEAKY_SENTENCE = Pattern.compile(
            "[^.!?\\n]*(?:\\b(?:" + FIELD_NAMES + ")\\b|\\{\\{?\\s*[A-Za-z_]+\\s*}}?|\\[[A-Z][A-Z_]{2,}])[^.!?\\n]*[.!?]?");

    private static final Pattern REPEATED_FALLBACK = Pattern.compile(
            "(" + Pattern.quote(MORE_INFO_FALLBACK) + ")(?:\\s*" + Pattern.quote(MORE_INFO_FALLBACK) + ")+");

    public static String sanitize(String body) {
        if (body == null || body.isBlank()) return body;
        String s = body;
        for (Map.Entry<Pattern, String> e : COMMITMENTS.entrySet()) {
            s = e.getKey().matcher(s).replaceAll(Matcher.quoteReplacement(e.getValue()));
        }
        s = replaceLeakySentences(s);
        return REPEATED_FALLBACK.matcher(s).replaceAll("$1");
    }

    private static String replaceLeakySentences(String s) {
        Matcher m = LEAKY_SENTENCE.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String hit = m.group();
            // 保留句首的空白，避免和上一句粘在一起
            int lead = 0;
            while (lead < hit.length() && Character.isWhitespace(hit.charAt(lead))) lead++;
            m.appendReplacement(sb, Matcher.quoteReplacement(hit.substring(0, lead) + MORE_INFO_FALLBACK));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
