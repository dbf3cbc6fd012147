package com.jz.support.webhook;

import com.jz.support.config.ChatwootProperties;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import com.jz.support.pipeline.PipelineResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("按决策回写工作台")
class ChatwootDispatcherTest {

    private static final String HTML = "Dear Sarah,<br><br>Hi";

    @Mock
    private MessagingClient client;

    private final ChatwootProperties props = new ChatwootProperties();

    private PipelineResult result(Decision decision, Map<String, Object> metadata) {
        return PipelineResult.builder()
                .response(HTML)
                .sessionId("cw_42")
                .category("shipping_or_delivery_question")
                .decision(decision)
                .confidence(Confidence.MEDIUM)
                .metadata(metadata)
                .build();
    }

    @Test
    @DisplayName("聊天窗口渠道去掉 HTML 后公开发送")
    void sendOnWidgetStripsHtml() {
        new ChatwootDispatcher(client, props).dispatch(42L, result(Decision.SEND, Map.of()), "web");

        verify(client).sendMessage(42L, "Dear Sarah,\n\nHi", false);
        verifyNoMoreInteractions(client);
    }

    @Test
    void sendOnEmailKeepsHtml() {
        new ChatwootDispatcher(client, props).dispatch(42L, result(Decision.SEND, Map.of()), "email");

        verify(client).sendMessage(42L, HTML, false);
    }

    @Test
    void draftBecomesPrivateNoteAndOpensConversation() {
        ArgumentCaptor<String> note = ArgumentCaptor.forClass(String.class);

        new ChatwootDispatcher(client, props).dispatch(42L, result(Decision.DRAFT, Map.of()), "web");

        verify(client).sendMessage(eq(42L), note.capture(), eq(true));
        verify(client).setStatus(42L, "open");
        verify(client).addLabels(42L, List.of("ai_draft", "shipping_or_delivery_question"));
        assertThat(note.getValue())
                .startsWith("**AI Draft (needs review)**")
                .contains("Confidence: medium")
                .endsWith("Dear Sarah,\n\nHi");
    }

    @Test
    void escalateWithoutAssigneeDoesNotAssign() {
        ArgumentCaptor<String> note = ArgumentCaptor.forClass(String.class);

        new ChatwootDispatcher(client, props)
                .dispatch(42L, result(Decision.ESCALATE, Map.of("escalation_reason", "death_threat")), "web");

        verify(client).sendMessage(eq(42L), note.capture(), eq(true));
        verify(client).setStatus(42L, "open");
        verify(client).addLabels(42L, List.of("ai_escalation", "shipping_or_delivery_question", "high_priority"));
        verify(client, never()).assign(anyLong(), anyLong());
        assertThat(note.getValue()).contains("Reason: death_threat");
    }

    @Test
    void escalateAssignsWhenConfigured() {
        props.setEscalationAssigneeId(7L);

        new ChatwootDispatcher(client, props).dispatch(42L, result(Decision.ESCALATE, Map.of()), "web");

        verify(client).assign(42L, 7L);
    }

    @Test
    void escalationReasonFallsBackToErrorThenGate() {
        assertThat(ChatwootDispatcher.escalationReason(result(Decision.ESCALATE, Map.of("error", "timeout"))))
                .isEqualTo("timeout");
        assertThat(ChatwootDispatcher.escalationReason(result(Decision.ESCALATE, Map.of())))
                .isEqualTo("eval_gate");
        assertThat(ChatwootDispatcher.escalationReason(result(Decision.ESCALATE, null)))
                .isEqualTo("eval_gate");
    }

    @Test
    @DisplayName("回写失败只记日志，不向上抛")
    void clientFailureIsLogged() {
        doThrow(new IllegalStateException("503")).when(client).sendMessage(anyLong(), anyString(), anyBoolean());

        assertThatCode(() -> new ChatwootDispatcher(client, props)
                .dispatch(42L, result(Decision.DRAFT, Map.of()), "web"))
                .doesNotThrowAnyException();
        verify(client, never()).setStatus(anyLong(), anyString());
    }

    @Test
    void stripHtmlCollapsesBlankLines() {
        assertThat(ChatwootDispatcher.stripHtml("<p>One</p><p></p><p></p><p>Two</p>")).isEqualTo("One\n\nTwo");
        assertThat(ChatwootDispatcher.stripHtml(null)).isEmpty();
    }
}
