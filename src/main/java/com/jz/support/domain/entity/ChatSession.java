package com.jz.support.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("chat_sessions")
public class ChatSession {

    @TableId(type = IdType.INPUT)
    private String sessionId;               // "sess_xxx" / "cw_{conversationId}"

    private String conversationId;
    private String channel;                 // widget / email / api ...
    private String customerEmail;
    private String customerName;

    private String primaryCategory;
    private String secondaryCategory;
    private String urgency;
    private String status;                  // active
    private String evalDecision;            // send / draft / escalate
    private Long firstResponseTimeMs;

    private Boolean isOutstanding;
    private String outstandingTrigger;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
