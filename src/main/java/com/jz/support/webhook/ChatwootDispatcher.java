package com.jz.support.webhook;

import com.jz.support.config.ChatwootProperties;
import com.jz.support.pipeline.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 按最终决策回写工作台：
 * send 直接公开回复；draft 写内部备注等人审；escalate 写内部备注、打高优标签、可选指派。
 * 回写失败只记日志，不重试。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatwootDispatcher {

    private static final Pattern BREAKS = Pattern.compile("<br\\s*/?>|</div>|</p>|</li>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private final MessagingClient client;
    private final ChatwootProperties props;

    public void dispatch(long conversationId, PipelineResult result, String channel) {
        // 邮件原生支持 HTML，聊天窗口只显示纯文本
        String text = "email".equalsIgnoreCase(channel) ? result.getResponse() : stripHtml(result.getResponse());
        try {
            switch (result.getDecision()) {
                case SEND -> client.sendMessage(conversationId, text, false);
                case DRAFT -> {
                    String note = "**AI Draft (needs review)**\n\n"
                            + "Category: " + result.getCategory() + "\n"
                            + "Confidence: " + result.getConfidence().value() + "\n\n"
                            + "---\n\n" + text;
                    client.sendMessage(conversationId, note, true);
                    client.setStatus(conversationId, "open");
                    client.addLabels(conversationId, List.of("ai_draft", result.getCategory()));
                }
                case ESCALATE -> {
                    String note = "**AI Escalation**\n\n"
                            + "Category: " + result.getCategory() + "\n"
                            + "Reason: " + escalationReason(result) + "\n\n"
                            + "---\n\nAI draft:\n" + text;
                    client.sendMessage(conversationId, note, true);
                    client.setStatus(conversationId, "open");
                    client.addLabels(conversationId, List.of("ai_escalation", result.getCategory(), "high_priority"));
                    if (props.getEscalationAssigneeId() != null) {
                        client.assign(conversationId, props.getEscalationAssigneeId());
                    }
                }
                default -> log.warn("unexpected decision for dispatch. conversationId={}, decision={}",
                        conversationId, result.getDecision());
            }
        } catch (Exception e) {
            log.error("chatwoot dispatch failed. conversationId={}, decision={}, err={}",
                    conversationId, result.getDecision().value(), e.getMessage(), e);
        }
    }

    static String escalationReason(PipelineResult result) {
        Object reason = result.getMetadata() == null ? null : result.getMetadata().get("escalation_reason");
        if (reason == null && result.getMetadata() != null) reason = result.getMetadata().get("error");
        return reason == null ? "eval_gate" : reason.toString();
    }

    static String stripHtml(String html) {
        if (html == null) return "";
        String s = BREAKS.matcher(html).replaceAll("\n");
        s = TAGS.matcher(s).replaceAll("");
        s = BLANK_LINES.matcher(s).replaceAll("\n\n");
        return s.strip();
    }
}
