package com.jz.support.eval;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 第一层：确定性正则扫描。回复里出现"已取消/已暂停/已退款"这类不可逆操作的确认句式时直接拦下。
 */
public final class ForbiddenPhraseScanner {

    private static final Map<Pattern, String> CORE = new LinkedHashMap<>();
    static {
        CORE.put(Pattern.compile("(cancelled|canceled) your subscription"), "confirmed_cancellation");
        CORE.put(Pattern.compile("subscription (has been|is now) (cancelled|canceled)"), "confirmed_cancellation");
        CORE.put(Pattern.compile("(paused|suspended) your subscription"), "confirmed_pause");
        CORE.put(Pattern.compile("subscription (has been|is now) (paused|suspended)"), "confirmed_pause");
        CORE.put(Pattern.compile("(processed|issued|approved) (a |your )?(refund|reimbursement)"), "confirmed_refund");
        CORE.put(Pattern.compile("refund (has been|is now|was) (processed|issued|approved)"), "confirmed_refund");
    }

    /** 团队模式 QA 额外检查：损坏件不得承诺具体处理结果 */
    private static final Map<Pattern, String> DAMAGE = new LinkedHashMap<>();
    static {
        DAMAGE.put(Pattern.compile("(replacement|reshipment|new box) (has been|is being|was) (sent|shipped|arranged|approved)"),
                "confirmed_damage_resolution");
        DAMAGE.put(Pattern.compile("(arranged|approved|shipped) (a |your )?(free )?(replacement|reshipment)"),
                "confirmed_damage_resolution");
        DAMAGE.put(Pattern.compile("(issued|applied|added) (a |your )?(store )?credit"),
                "confirmed_damage_resolution");
    }

    public static final ForbiddenPhraseScanner STANDARD = new ForbiddenPhraseScanner(false);
    public static final ForbiddenPhraseScanner QA = new ForbiddenPhraseScanner(true);

    private final Map<Pattern, String> table = new LinkedHashMap<>();

    private ForbiddenPhraseScanner(boolean includeDamage) {
        table.putAll(CORE);
        if (includeDamage) table.putAll(DAMAGE);
    }

    /** @return 第一个命中的违规名；未命中返回 empty */
    public Optional<String> firstViolation(String reply) {
        if (reply == null || reply.isEmpty()) return Optional.empty();
        String s = reply.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> e : table.entrySet()) {
            if (e.getKey().matcher(s).find()) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }
}
