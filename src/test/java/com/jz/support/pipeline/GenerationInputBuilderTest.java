package com.jz.support.pipeline;

import com.jz.support.domain.HistoryTurn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationInputBuilderTest {

    @Test
    void noHistoryNoEmail() {
        String in = GenerationInputBuilder.build("Client", null, List.of(), "Where is my box?", 500);
        assertThat(in).isEqualTo("[Customer Name: Client]\n\nWhere is my box?");
    }

    @Test
    void historyTurnsAreLabelledAndCapped() {
        List<HistoryTurn> history = List.of(
                HistoryTurn.builder().role("user").content("x".repeat(12)).build(),
                HistoryTurn.builder().role("assistant").content("short").build());

        String in = GenerationInputBuilder.build("Sarah", "sarah@example.com", history, "And now?", 10);

        assertThat(in).isEqualTo("""
                [Customer Name: Sarah]
                [Customer Email: sarah@example.com]

                [Conversation History]
                Customer: xxxxxxxxxx...
                Agent: short
                [End History]

                And now?""");
    }

    @Test
    void feedbackIsAppended() {
        String out = GenerationInputBuilder.withFeedback("base", "add the date");
        assertThat(out).isEqualTo("base\n\n[QA FEEDBACK - please revise your response]\nadd the date\n[End QA Feedback]");
    }

    @Test
    void capLeavesShortTextAlone() {
        assertThat(GenerationInputBuilder.cap("abc", 3)).isEqualTo("abc");
        assertThat(GenerationInputBuilder.cap(null, 3)).isEmpty();
    }
}
