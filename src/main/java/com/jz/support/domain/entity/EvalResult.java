package com.jz.support.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("eval_results")
public class EvalResult {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String ticketId;                 // = sessionId
    private String turnId;                   // 唯一键
    private String requestSubtype;           // 主分类
    private String requestSubSubtype;        // 次分类
    private String decision;
    private String draftReason;              // override 原因
    private String confidence;
    private String checks;                   // JSON 数组
    private Boolean isOutstanding;
    private String outstandingTrigger;
    private Boolean autoSendEnabled;
    private Integer attempts;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
