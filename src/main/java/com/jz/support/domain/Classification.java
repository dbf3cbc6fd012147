package com.jz.support.domain;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class Classification {
    private Category primary;
    private Category secondary;      // 多意图时才有
    private Urgency urgency;
    private String email;            // 消息里提到的邮箱
    private String sentiment;        // positive / neutral / negative / frustrated
    private boolean escalationSignal;

    /** 路由器不可用时的兜底结果 */
    public static Classification fallback() {
        return Classification.builder()
                .primary(Category.SAFE_DEFAULT)
                .urgency(Urgency.MEDIUM)
                .sentiment("neutral")
                .build();
    }
}
