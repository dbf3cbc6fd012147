package com.jz.support.pipeline;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把退订链接放进回复：优先替换占位符；没有占位符就把第一处"cancellation page"之类的说法换成超链接。
 */
public final class CancelLinkSplicer {
    private CancelLinkSplicer() {}

    private static final Pattern GENERIC_MENTION =
            Pattern.compile("(cancellation page|cancel page|cancellation link|cancel link)", Pattern.CASE_INSENSITIVE);

    public static String splice(String reply, String cancelUrl) {
        if (reply == null || cancelUrl == null || cancelUrl.isBlank()) return reply;
        // 先替换双花括号，避免被单花括号规则吃掉一半
        String out = reply.replace("{{cancel_link}}", cancelUrl)
                .replace("{cancel_link}", cancelUrl)
                .replace("[CANCEL_LINK]", cancelUrl);
        if (out.contains(cancelUrl)) return out;

        Matcher m = GENERIC_MENTION.matcher(out);
        if (!m.find()) return out;
        String link = "<a href=\"" + cancelUrl + "\">cancellation page</a>";
        return out.substring(0, m.start()) + link + out.substring(m.end());
    }
}
