package com.jz.support.controller;

import com.jz.support.common.Result;
import com.jz.support.config.WebhookProperties;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import com.jz.support.domain.dto.ChatwootWebhookPayload;
import com.jz.support.pipeline.PipelineOrchestrator;
import com.jz.support.pipeline.PipelineRequest;
import com.jz.support.pipeline.PipelineResult;
import com.jz.support.webhook.ChatwootDispatcher;
import com.jz.support.webhook.WebhookDedupCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Chatwoot webhook 入口")
class ChatwootWebhookControllerTest {

    @Mock
    private PipelineOrchestrator orchestrator;
    @Mock
    private ChatwootDispatcher dispatcher;

    private SimpleMeterRegistry registry;
    private ChatwootWebhookController controller;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        controller = new ChatwootWebhookController(orchestrator, dispatcher,
                new WebhookDedupCache(clock, new WebhookProperties()), registry);
    }

    private static ChatwootWebhookPayload incoming(long messageId, String content) {
        return ChatwootWebhookPayload.builder()
                .event("message_created")
                .id(messageId)
                .content(content)
                .messageType("incoming")
                .sender(ChatwootWebhookPayload.Sender.builder().name("Sarah").email("sarah@example.com").build())
                .conversation(ChatwootWebhookPayload.Conversation.builder().id(42L).build())
                .build();
    }

    private static PipelineResult sent() {
        return PipelineResult.builder()
                .response("Dear Sarah,\n\nHi")
                .sessionId("cw_42")
                .category("shipping_or_delivery_question")
                .decision(Decision.SEND)
                .confidence(Confidence.HIGH)
                .metadata(Map.of())
                .build();
    }

    @Test
    @DisplayName("同一消息重复投递：只处理一次")
    void duplicateDeliveryProcessedOnce() {
        when(orchestrator.process(any())).thenReturn(sent());

        Result<Map<String, Object>> first = controller.onEvent(incoming(1001L, "Where is my box?"));
        Result<Map<String, Object>> second = controller.onEvent(incoming(1001L, "Where is my box?"));

        assertThat(first.getData()).containsEntry("status", "processed").containsEntry("decision", "send");
        assertThat(second.getData()).containsEntry("status", "duplicate").containsEntry("message_id", 1001L);
        verify(orchestrator, times(1)).process(any());
        verify(dispatcher, times(1)).dispatch(eq(42L), any(), anyString());
        assertThat(registry.counter("support.webhook.duplicate").count()).isEqualTo(1.0);
    }

    @Test
    void buildsPipelineRequestFromPayload() {
        when(orchestrator.process(any())).thenReturn(sent());
        ArgumentCaptor<PipelineRequest> req = ArgumentCaptor.forClass(PipelineRequest.class);

        controller.onEvent(incoming(1001L, "Where is my box?"));

        verify(orchestrator).process(req.capture());
        assertThat(req.getValue().getSessionId()).isEqualTo("cw_42");
        assertThat(req.getValue().getConversationId()).isEqualTo("42");
        assertThat(req.getValue().getContactEmail()).isEqualTo("sarah@example.com");
        assertThat(req.getValue().getContactName()).isEqualTo("Sarah");
        assertThat(req.getValue().getChannel()).isEqualTo("web");
        verify(dispatcher).dispatch(eq(42L), any(), eq("web"));
    }

    @Test
    void ignoresOtherEvents() {
        ChatwootWebhookPayload p = incoming(1001L, "Where is my box?");
        p.setEvent("message_updated");

        Result<Map<String, Object>> r = controller.onEvent(p);

        assertThat(r.getData()).containsEntry("status", "ignored");
        verifyNoInteractions(orchestrator, dispatcher);
    }

    @Test
    void ignoresOutgoingEmptyAndPrivateMessages() {
        ChatwootWebhookPayload outgoing = incoming(1L, "Hi");
        outgoing.setMessageType("outgoing");
        ChatwootWebhookPayload empty = incoming(2L, "   ");
        ChatwootWebhookPayload note = incoming(3L, "internal");
        note.setPrivateNote(true);

        assertThat(controller.onEvent(outgoing).getData()).containsEntry("reason", "not incoming message");
        assertThat(controller.onEvent(empty).getData()).containsEntry("reason", "empty content");
        assertThat(controller.onEvent(note).getData()).containsEntry("reason", "private note");
        verifyNoInteractions(orchestrator, dispatcher);
    }

    @Test
    void ignoresMissingConversation() {
        ChatwootWebhookPayload p = incoming(1001L, "Where is my box?");
        p.setConversation(null);

        assertThat(controller.onEvent(p).getData()).containsEntry("reason", "no conversation_id");
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("缺会话的事件不占用去重名额")
    void missingConversationDoesNotConsumeDedupSlot() {
        when(orchestrator.process(any())).thenReturn(sent());
        ChatwootWebhookPayload broken = incoming(1001L, "Where is my box?");
        broken.setConversation(null);

        controller.onEvent(broken);
        Result<Map<String, Object>> retry = controller.onEvent(incoming(1001L, "Where is my box?"));

        assertThat(retry.getData()).containsEntry("status", "processed");
        verify(orchestrator, times(1)).process(any());
        assertThat(registry.counter("support.webhook.duplicate").count()).isEqualTo(0.0);
    }
}
