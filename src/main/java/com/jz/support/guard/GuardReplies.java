package com.jz.support.guard;

/**
 * 对客户可见的固定兜底话术，只有这两条。
 * 拼装器会识别它们并原样返回。
 */
public final class GuardReplies {
    private GuardReplies() {}

    /** 红线命中 */
    public static final String SAFETY_DEFLECTION =
            "I'm connecting you with a support agent who can better assist you.";

    /** 流水线失败（生成失败或内部异常） */
    public static final String PIPELINE_FAILURE =
            "I apologize, but I'm having trouble processing your request. "
                    + "Let me connect you with a support agent.";
}
