package com.jz.support.guard;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 红线检查：威胁、法律/银行争议、自伤。命中后直接升级人工，不再生成回复。
 * 纯本地正则，不调用模型，不抛异常。
 */
@Component
public class SafetyGuard {

    // 顺序即优先级
    private static final Map<String, Pattern> RED_LINES = new LinkedHashMap<>();
    static {
        RED_LINES.put("death_threat", Pattern.compile("\\b(kill|murder|die|death threat)\\b"));
        RED_LINES.put("legal_threat", Pattern.compile("\\b(sue|lawsuit|lawyer|legal action|court)\\b"));
        RED_LINES.put("bank_dispute", Pattern.compile("\\b(bank dispute|chargeback|dispute the charge)\\b"));
        RED_LINES.put("self_harm", Pattern.compile("\\b(suicide|end my life|harm myself)\\b"));
        RED_LINES.put("violence_threat", Pattern.compile("\\b(bomb|weapon|attack)\\b"));
    }

    public RedLineVerdict check(String message) {
        if (message == null || message.isBlank()) return RedLineVerdict.clean();
        String s = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> e : RED_LINES.entrySet()) {
            if (e.getValue().matcher(s).find()) return RedLineVerdict.flagged(e.getKey());
        }
        return RedLineVerdict.clean();
    }
}
