package com.jz.support.agent;

/**
 * 关键路径：失败必须抛 {@link ReplyGenerationException}，由流水线转人工。
 */
public interface ReplyGenerator {
    GeneratedReply generate(GenerationRequest request);
}
