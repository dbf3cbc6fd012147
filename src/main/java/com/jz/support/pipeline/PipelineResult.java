package com.jz.support.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PipelineResult {
    String response;
    @JsonProperty("session_id")
    String sessionId;
    /** 分类 code；红线命中时为 "unknown" */
    String category;
    Decision decision;
    Confidence confidence;
    Map<String, Object> metadata;
}
