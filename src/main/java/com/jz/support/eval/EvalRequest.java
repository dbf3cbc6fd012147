package com.jz.support.eval;

import lombok.*;

import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class EvalRequest {
    private String customerMessage;
    private String reply;               // 拼装后的完整回复
    private String category;
    private boolean outstanding;
    private List<String> toolsAvailable;

    // 仅 QA 模式使用
    @Builder.Default
    private int attempt = 1;
    private String previousFeedback;
}
