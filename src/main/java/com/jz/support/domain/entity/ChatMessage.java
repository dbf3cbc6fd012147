package com.jz.support.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("chat_messages")
public class ChatMessage {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String sessionId;
    private String turnId;                   // 一次流水线请求一个 turnId，(turn_id, role) 唯一
    private String role;                     // user / assistant
    private String content;

    private String modelUsed;                // assistant 使用的模型名
    private Long processingTimeMs;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
