package com.jz.support.eval;

import com.jz.support.domain.Check;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("团队模式 QA 闸门")
class QaEvaluationGateTest {

    @Mock
    private SemanticJudge judge;

    private static final List<Check> CHECKS = List.of(
            Check.of("safety", true, 1.0, ""),
            Check.of("tone", true, 0.8, ""),
            Check.of("accuracy", true, 0.8, ""),
            Check.of("completeness", false, 0.5, "no tracking number"));

    private EvalRequest req(String reply, int attempt, String previousFeedback) {
        return EvalRequest.builder()
                .customerMessage("Where is my box?")
                .reply(reply)
                .category("shipping_or_delivery_question")
                .toolsAvailable(List.of("get_subscription", "track_package"))
                .attempt(attempt)
                .previousFeedback(previousFeedback)
                .build();
    }

    @Test
    void refineAllowedOnFirstAttempt() {
        when(judge.judge(anyString(), anyString()))
                .thenReturn(JudgeVerdict.parsed(Decision.REFINE, Confidence.MEDIUM, CHECKS, "mention the tracking number"));

        EvalOutcome out = new QaEvaluationGate(judge).evaluate(req("It is on its way.", 1, null));

        assertThat(out.getDecision()).isEqualTo(Decision.REFINE);
        assertThat(out.getFeedback()).isEqualTo("mention the tracking number");
    }

    @Test
    @DisplayName("重试轮仍返回 refine -> 强制 draft")
    void refineOnRetryForcedToDraft() {
        when(judge.judge(anyString(), anyString()))
                .thenReturn(JudgeVerdict.parsed(Decision.REFINE, Confidence.MEDIUM, CHECKS, "still vague"));

        EvalOutcome out = new QaEvaluationGate(judge).evaluate(req("It is on its way.", 2, "mention the tracking number"));

        assertThat(out.getDecision()).isEqualTo(Decision.DRAFT);
        assertThat(out.getOverrideReason()).isEqualTo(QaEvaluationGate.REFINE_ON_RETRY);
    }

    @Test
    @DisplayName("损坏件处理承诺只有 QA 闸门拦截")
    void damagePromiseCaughtOnlyByQa() {
        String reply = "A replacement has been shipped to you today.";

        EvalOutcome out = new QaEvaluationGate(judge).evaluate(req(reply, 1, null));

        assertThat(out.getDecision()).isEqualTo(Decision.DRAFT);
        assertThat(out.getConfidence()).isEqualTo(Confidence.HIGH);
        assertThat(out.getOverrideReason()).contains("confirmed_damage_resolution");
        assertThat(ForbiddenPhraseScanner.STANDARD.firstViolation(reply)).isEmpty();
        verifyNoInteractions(judge);
    }

    @Test
    void retryPromptCarriesAttemptAndFeedback() {
        when(judge.judge(anyString(), anyString()))
                .thenReturn(JudgeVerdict.parsed(Decision.SEND, Confidence.HIGH, CHECKS, null));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

        new QaEvaluationGate(judge).evaluate(req("Tracking: RR123IL.", 2, "mention the tracking number"));

        verify(judge).judge(eq(QaEvaluationGate.INSTRUCTIONS), prompt.capture());
        assertThat(prompt.getValue())
                .contains("ATTEMPT: 2")
                .contains("RETRY attempt")
                .contains("PREVIOUS QA FEEDBACK:\nmention the tracking number")
                .contains("TOOLS AVAILABLE: get_subscription, track_package");
    }
}
