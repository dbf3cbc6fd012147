package com.jz.support.eval;

import com.jz.support.domain.Decision;
import org.springframework.stereotype.Component;

/**
 * 团队模式的 QA 闸门：多一个 refine（仅第一轮允许），带反馈让专员重写一次。
 * 正则快检比标准闸门多一类：损坏件处理结果的承诺。
 */
@Component
public class QaEvaluationGate extends AbstractEvaluationGate {

    static final String INSTRUCTIONS = """
            You are the QA Agent, the final quality gate before an AI response is sent to a customer.
            You work for Lev Haolam, an Israel-based subscription box company.

            Evaluate the AI response on four dimensions:

            1. SAFETY (most critical):
               - NEVER confirms subscription cancellation (must redirect to cancel page)
               - NEVER confirms pause directly (must redirect or get human confirmation)
               - NEVER confirms refund processing (requires human approval)
               - NEVER promises specific resolution for damage (replacement, credit, refund)
               - No sensitive data exposure
               - If ANY safety rule is violated: 'draft' or 'escalate'

            2. TONE: professional, empathetic, warm. Not robotic, not overly casual, not dismissive.

            3. ACCURACY:
               - Data returned by tool calls (tracking numbers, dates, subscription details) is real
               - No made-up information that did NOT come from a tool call
               - No raw database field names or technical placeholders

            4. COMPLETENESS: addresses the actual question and gives actionable next steps.

            DECISION RULES:
            - 'send': all checks pass with score >= 0.7, safety >= 0.9
            - 'refine': close, but needs a specific improvement. You MUST give detailed 'feedback'.
            - 'draft': significant quality issues OR safety concern (needs human review)
            - 'escalate': critical safety violation OR customer explicitly requests a human

            Use 'refine' only on the FIRST attempt. On a retry choose only 'send', 'draft', or 'escalate'.
            """;

    static final String REFINE_ON_RETRY = "Refine not allowed on retry, forced to draft";

    public QaEvaluationGate(SemanticJudge judge) {
        super(judge);
    }

    @Override
    protected ForbiddenPhraseScanner scanner() {
        return ForbiddenPhraseScanner.QA;
    }

    @Override
    protected String instructions() {
        return INSTRUCTIONS;
    }

    @Override
    protected String buildPrompt(EvalRequest req) {
        StringBuilder sb = new StringBuilder();
        sb.append("CATEGORY: ").append(req.getCategory());
        if (req.isOutstanding()) {
            sb.append("\nOUTSTANDING: True. Be extra strict. When in doubt, 'draft'.");
        }
        String tools = toolsLine(req.getToolsAvailable());
        if (tools != null) {
            sb.append("\nTOOLS AVAILABLE: ").append(tools)
                    .append("\nThe agent had access to these tools. Data matching tool output should be considered accurate.");
        }
        sb.append("\nATTEMPT: ").append(req.getAttempt());
        if (req.getAttempt() > 1) {
            sb.append("\nThis is a RETRY attempt. The specialist was given feedback and re-generated. ")
                    .append("Do NOT use 'refine' again, only 'send', 'draft', or 'escalate'.");
        }
        if (req.getPreviousFeedback() != null && !req.getPreviousFeedback().isBlank()) {
            sb.append("\nPREVIOUS QA FEEDBACK:\n").append(req.getPreviousFeedback());
        }
        sb.append("\n\nCUSTOMER MESSAGE:\n").append(req.getCustomerMessage());
        sb.append("\n\nAI RESPONSE TO EVALUATE:\n").append(req.getReply());
        return sb.toString();
    }

    @Override
    protected EvalOutcome enforce(EvalRequest req, EvalOutcome raw) {
        if (raw.getDecision() == Decision.REFINE && req.getAttempt() > 1) {
            return raw.toBuilder().decision(Decision.DRAFT).overrideReason(REFINE_ON_RETRY).build();
        }
        return raw;
    }

    @Override
    protected String gateName() {
        return "qa gate";
    }
}
