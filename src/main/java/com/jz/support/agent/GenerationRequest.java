package com.jz.support.agent;

import com.jz.support.domain.Category;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GenerationRequest {
    Category category;
    String customerEmail;
    /** 拼好的生成输入：客户标签 + 历史 + 原消息（重试时附带 QA 反馈） */
    String input;
    /** 团队模式走专员人设 */
    boolean teamMode;
}
