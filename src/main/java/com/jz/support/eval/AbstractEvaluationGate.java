package com.jz.support.eval;

import com.jz.support.domain.Check;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 发送前最后一道闸门，两层：
 * 1) 正则快检（不调模型），命中即 draft，不再进入第二层；
 * 2) 语义评审，输出再经过后置约束修正。
 */
@Slf4j
public abstract class AbstractEvaluationGate {

    static final String PARSE_ERROR = "parse error";
    static final String OUTSTANDING_OVERRIDE = "Outstanding case with non-high confidence forced to draft";

    protected final SemanticJudge judge;

    protected AbstractEvaluationGate(SemanticJudge judge) {
        this.judge = judge;
    }

    public EvalOutcome evaluate(EvalRequest req) {
        Optional<String> violation = scanner().firstViolation(req.getReply());
        if (violation.isPresent()) {
            log.warn("{} fast fail. violation={}, category={}", gateName(), violation.get(), req.getCategory());
            return EvalOutcome.builder()
                    .decision(Decision.DRAFT)
                    .confidence(Confidence.HIGH)
                    .checks(List.of(Check.of("safety", false, 0.0, "Regex safety violation: " + violation.get())))
                    .overrideReason("Fast-fail regex: " + violation.get())
                    .build();
        }

        JudgeVerdict v;
        try {
            v = judge.judge(instructions(), buildPrompt(req));
        } catch (Exception e) {
            log.error("{} judge call failed. err={}", gateName(), e.toString());
            return EvalOutcome.degraded(gateName() + " error: " + e.getMessage());
        }
        if (v == null || !v.isParsed()) {
            log.warn("{} judge output unparseable. why={}", gateName(), v == null ? "null" : v.getParseError());
            return EvalOutcome.degraded(PARSE_ERROR);
        }

        EvalOutcome out = EvalOutcome.builder()
                .decision(v.getDecision())
                .confidence(v.getConfidence())
                .checks(v.getChecks())
                .feedback(v.getFeedback())
                .build();
        out = enforce(req, out);

        // 特殊案件：非高置信度的 send 一律转草稿
        if (req.isOutstanding() && out.getDecision() == Decision.SEND && out.getConfidence() != Confidence.HIGH) {
            out = out.toBuilder().decision(Decision.DRAFT).overrideReason(OUTSTANDING_OVERRIDE).build();
        }

        log.info("{} complete. decision={}, confidence={}, attempt={}, checksPassed={}/{}",
                gateName(), out.getDecision().value(), out.getConfidence().value(), req.getAttempt(),
                out.getChecks().stream().filter(Check::isPassed).count(), out.getChecks().size());
        return out;
    }

    protected abstract ForbiddenPhraseScanner scanner();

    protected abstract String instructions();

    protected abstract String buildPrompt(EvalRequest req);

    /** 子类对评审原始决策做的额外修正（例如 refine 是否合法） */
    protected abstract EvalOutcome enforce(EvalRequest req, EvalOutcome raw);

    protected abstract String gateName();

    protected static String toolsLine(List<String> tools) {
        return tools == null || tools.isEmpty() ? null : String.join(", ", tools);
    }
}
