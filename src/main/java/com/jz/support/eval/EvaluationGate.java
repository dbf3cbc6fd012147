package com.jz.support.eval;

import com.jz.support.domain.Decision;
import org.springframework.stereotype.Component;

/** 标准模式的评估闸门：send / draft / escalate */
@Component
public class EvaluationGate extends AbstractEvaluationGate {

    static final String INSTRUCTIONS = """
            You are the Eval Gate, the final quality check before an AI response is sent to a customer.
            You work for Lev Haolam, an Israel-based subscription box company.

            Evaluate the AI response on four dimensions:

            1. SAFETY (most critical):
               - NEVER confirms subscription cancellation (must redirect to cancel page)
               - NEVER confirms pause directly (must redirect or get human confirmation)
               - NEVER confirms refund processing (requires human approval)
               - No sensitive data exposure
               - If ANY safety rule is violated: decision MUST be 'draft' or 'escalate'

            2. TONE: professional, empathetic, warm. Not robotic, not overly casual, not dismissive.

            3. ACCURACY:
               - Information is factually plausible
               - Data returned by tool calls (tracking numbers, dates, subscription details, claim IDs) is real
               - No made-up information that did NOT come from a tool call

            4. COMPLETENESS: addresses the actual question and gives actionable next steps.

            DECISION RULES:
            - 'send': all checks pass with score >= 0.7, safety >= 0.9
            - 'draft': any check fails (score < 0.7) OR safety < 0.9
            - 'escalate': critical safety violation OR customer needs human handoff
            """;

    public EvaluationGate(SemanticJudge judge) {
        super(judge);
    }

    @Override
    protected ForbiddenPhraseScanner scanner() {
        return ForbiddenPhraseScanner.STANDARD;
    }

    @Override
    protected String instructions() {
        return INSTRUCTIONS;
    }

    @Override
    protected String buildPrompt(EvalRequest req) {
        StringBuilder sb = new StringBuilder();
        sb.append("CATEGORY: ").append(req.getCategory()).append('\n');
        sb.append("OUTSTANDING: ").append(req.isOutstanding() ? "True" : "False").append('\n');
        if (req.isOutstanding()) {
            sb.append("**OUTSTANDING CASE: be extra strict. When in doubt, 'draft'.**\n");
        }
        String tools = toolsLine(req.getToolsAvailable());
        if (tools != null) {
            sb.append("\nTOOLS AVAILABLE TO AGENT: ").append(tools).append('\n')
                    .append("The agent had access to these tools and may have called them. ")
                    .append("Any data in the response that matches tool output (tracking numbers, ")
                    .append("dates, subscription details, claim IDs) should be considered accurate.\n");
        }
        sb.append("\nCUSTOMER MESSAGE:\n").append(req.getCustomerMessage()).append("\n\n");
        sb.append("AI RESPONSE TO EVALUATE:\n").append(req.getReply());
        return sb.toString();
    }

    /** 标准闸门不支持 refine，评审越权输出时按草稿处理 */
    @Override
    protected EvalOutcome enforce(EvalRequest req, EvalOutcome raw) {
        if (raw.getDecision() == Decision.REFINE) {
            return raw.toBuilder()
                    .decision(Decision.DRAFT)
                    .feedback(null)
                    .overrideReason("Refine is not available outside team mode, forced to draft")
                    .build();
        }
        return raw;
    }

    @Override
    protected String gateName() {
        return "eval gate";
    }
}
