package com.jz.support.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 落库用的只读快照：结果定下来之后才生成，后续写库失败不会反过来影响结果。
 */
@Value
@Builder
public class PersistSnapshot {
    String sessionId;
    String turnId;
    String conversationId;
    String channel;
    String customerEmail;
    String customerName;

    String message;
    String reply;

    Category primary;
    Category secondary;
    Urgency urgency;

    Decision decision;
    Confidence confidence;
    String overrideReason;
    List<Check> checks;

    boolean outstanding;
    String outstandingTrigger;

    String modelUsed;
    long processingTimeMs;
    int attempts;
}
