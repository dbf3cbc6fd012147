package com.jz.support.pipeline;

import com.jz.support.agent.GeneratedReply;
import com.jz.support.domain.Category;
import com.jz.support.domain.Classification;
import com.jz.support.domain.OutstandingResult;
import com.jz.support.eval.EvalOutcome;
import lombok.Getter;
import lombok.Setter;

import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 单次请求的可变上下文，只在编排器内部流转，请求结束即丢弃。
 * attempt 单调递增，最多 2（首轮 + 一次重试）。
 */
@Getter
@Setter
public class RequestContext {

    public static final int MAX_ATTEMPTS = 2;

    private final long startNanos = System.nanoTime();
    private final String turnId = UUID.randomUUID().toString();

    private final String message;
    private final String sessionId;
    private final String conversationId;
    private final String contactEmail;
    private final String contactName;
    private final String channel;
    private final boolean teamMode;

    private Classification classification;
    private String customerName;
    private String customerEmail;
    private String generationInput;

    private GeneratedReply generated;
    private OutstandingResult outstanding = OutstandingResult.none();
    private String assembledReply;
    private EvalOutcome outcome;

    @Setter(lombok.AccessLevel.NONE)
    private int attempt = 1;

    RequestContext(PipelineRequest req, boolean defaultTeamMode, String defaultChannel) {
        this.message = req.getMessage() == null ? "" : req.getMessage();
        this.sessionId = isBlank(req.getSessionId()) ? newSessionId() : req.getSessionId();
        this.conversationId = req.getConversationId();
        this.contactEmail = isBlank(req.getContactEmail()) ? null : req.getContactEmail().trim();
        this.contactName = req.getContactName();
        this.channel = isBlank(req.getChannel()) ? defaultChannel : req.getChannel();
        this.teamMode = req.getTeamMode() != null ? req.getTeamMode() : defaultTeamMode;
    }

    public Category category() {
        return classification == null ? null : classification.getPrimary();
    }

    public boolean canRetry() {
        return attempt < MAX_ATTEMPTS;
    }

    /** 进入重试轮：把 QA 反馈附到生成输入末尾 */
    public void beginRetry(String feedback) {
        if (!canRetry()) {
            throw new IllegalStateException("retry bound reached, attempt=" + attempt);
        }
        attempt++;
        generationInput = GenerationInputBuilder.withFeedback(generationInput, feedback);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    static String newSessionId() {
        byte[] b = new byte[6];
        ThreadLocalRandom.current().nextBytes(b);
        return "sess_" + HexFormat.of().formatHex(b);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
