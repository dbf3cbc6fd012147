package com.jz.support.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PipelineRequest {
    String message;
    /** 为空时生成 sess_xxxxxxxxxxxx */
    String sessionId;
    String conversationId;
    String contactEmail;
    String contactName;
    String channel;
    /** 为空时取配置默认值 */
    Boolean teamMode;
}
