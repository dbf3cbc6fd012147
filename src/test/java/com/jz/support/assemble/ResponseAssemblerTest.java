package com.jz.support.assemble;

import com.jz.support.guard.GuardReplies;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAssemblerTest {

    private final ResponseAssembler assembler = new ResponseAssembler();

    @Test
    @DisplayName("兜底话术原样返回")
    void systemPhrasesPassThrough() {
        assertThat(assembler.assemble(GuardReplies.SAFETY_DEFLECTION, "Sarah", "gratitude", "s1"))
                .isEqualTo(GuardReplies.SAFETY_DEFLECTION);
        assertThat(assembler.assemble(GuardReplies.PIPELINE_FAILURE, "Sarah", "gratitude", "s1"))
                .isEqualTo(GuardReplies.PIPELINE_FAILURE);
    }

    @Test
    void fiveSlotsInOrder() {
        String out = assembler.assemble("Your box shipped yesterday.", "Sarah", "shipping_or_delivery_question", "sess_1");
        String[] lines = out.split("\n");
        assertThat(lines).hasSize(5);
        assertThat(lines[0]).isEqualTo("<div>Dear Sarah,</div>");
        assertThat(lines[2]).isEqualTo("<div>Your box shipped yesterday.</div>");
        assertThat(lines[4]).isEqualTo("<div>" + ResponseAssembler.SIGN_OFF + "</div>");
    }

    @Test
    @DisplayName("同一 sessionId 结果相同")
    void deterministicPerSession() {
        String a = assembler.assemble("Body.", "Dan", "payment_question", "sess_abc");
        String b = assembler.assemble("Body.", "Dan", "payment_question", "sess_abc");
        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("不同会话之间有变化")
    void variesAcrossSessions() {
        Set<String> outs = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            outs.add(assembler.assemble("Body.", "Dan", "payment_question", "sess_" + i));
        }
        assertThat(outs.size()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void stripsGreetingTheModelAlreadyWrote() {
        String out = assembler.assemble("Hi Sarah,\nYour box shipped.", "Sarah", "gratitude", "s2");
        assertThat(out.split("\n")[2]).isEqualTo("<div>Your box shipped.</div>");

        String generic = assembler.assemble("Dear Customer,\nThanks for writing!", "Sarah", "gratitude", "s2");
        assertThat(generic.split("\n")[2]).isEqualTo("<div>Thanks for writing!</div>");
    }

    @Test
    void keepsSentencesStartingWithHiddenGreetingWords() {
        assertThat(ResponseAssembler.stripExistingGreeting("Hidden fees are never charged.", "Sarah"))
                .isEqualTo("Hidden fees are never charged.");
    }

    @Test
    void unknownCategoryFallsBackToGeneralOpeners() {
        String opener = assembler.assemble("Body.", "Dan", "no_such_category", "s3").split("\n")[1];
        assertThat(opener).isIn(
                "<div>Thank you for reaching out to us.</div>",
                "<div>I'd be happy to help you with that.</div>",
                "<div>Thank you for contacting Lev Haolam support.</div>");
    }

    @Test
    void bodyIsSanitized() {
        String out = assembler.assemble("We will send you a refund.", "Dan", "payment_question", "s4");
        assertThat(out).doesNotContain("send you a refund");
    }
}
