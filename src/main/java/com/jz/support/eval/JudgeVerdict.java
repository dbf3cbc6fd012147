package com.jz.support.eval;

import com.jz.support.domain.Check;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import lombok.*;

import java.util.List;

/**
 * 语义评审的返回值。模型输出可能解析失败，用 kind 区分，调用方必须处理 UNPARSEABLE 分支。
 */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class JudgeVerdict {
    public enum Kind { PARSED, UNPARSEABLE }

    private Kind kind;
    private Decision decision;
    private Confidence confidence;
    private List<Check> checks;
    private String feedback;         // 仅 refine 时有
    private String parseError;       // 仅 UNPARSEABLE 时有

    public static JudgeVerdict parsed(Decision decision, Confidence confidence, List<Check> checks, String feedback) {
        return JudgeVerdict.builder()
                .kind(Kind.PARSED)
                .decision(decision)
                .confidence(confidence)
                .checks(checks == null ? List.of() : List.copyOf(checks))
                .feedback(feedback)
                .build();
    }

    public static JudgeVerdict unparseable(String why) {
        return JudgeVerdict.builder().kind(Kind.UNPARSEABLE).checks(List.of()).parseError(why).build();
    }

    public boolean isParsed() {
        return kind == Kind.PARSED;
    }
}
