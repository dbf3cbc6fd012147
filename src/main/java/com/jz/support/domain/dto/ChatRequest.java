package com.jz.support.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {
    @NotBlank
    private String message;
    @JsonProperty("session_id")
    private String sessionId;
    @JsonProperty("conversation_id")
    private String conversationId;
    private ContactInfo contact;
    /** 目前只读 channel */
    private Map<String, Object> metadata;
    @JsonProperty("team_mode")
    private Boolean teamMode;
}
