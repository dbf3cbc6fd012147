package com.jz.support.controller;

import com.jz.support.common.Result;
import com.jz.support.domain.dto.ChatwootWebhookPayload;
import com.jz.support.pipeline.PipelineOrchestrator;
import com.jz.support.pipeline.PipelineRequest;
import com.jz.support.pipeline.PipelineResult;
import com.jz.support.webhook.ChatwootDispatcher;
import com.jz.support.webhook.WebhookDedupCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chatwoot 桥接：过滤 -> 去重 -> 流水线 -> 按决策回写。
 * 非目标事件一律确认后丢弃，始终返回 200，避免上游重投。
 */
@Slf4j
@RestController
@RequestMapping("api/webhook")
@RequiredArgsConstructor
public class ChatwootWebhookController {

    private final PipelineOrchestrator orchestrator;
    private final ChatwootDispatcher dispatcher;
    private final WebhookDedupCache dedupCache;
    private final MeterRegistry meterRegistry;

    @PostMapping("/chatwoot")
    public Result<Map<String, Object>> onEvent(@RequestBody ChatwootWebhookPayload payload) {
        if (!"message_created".equals(payload.getEvent())) {
            return ignored("event=" + payload.getEvent());
        }
        if (!"incoming".equals(payload.getMessageType())) {
            return ignored("not incoming message");
        }
        if (payload.getContent() == null || payload.getContent().isBlank()) {
            return ignored("empty content");
        }
        if (payload.isPrivateNote()) {
            return ignored("private note");
        }
        ChatwootWebhookPayload.Conversation conv = payload.getConversation();
        if (conv == null || conv.getId() == null) {
            return ignored("no conversation_id");
        }
        if (payload.getId() != null && dedupCache.seen(payload.getId())) {
            log.info("duplicate webhook. messageId={}", payload.getId());
            Counter.builder("support.webhook.duplicate").register(meterRegistry).increment();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "duplicate");
            body.put("message_id", payload.getId());
            return Result.success(body);
        }

        long conversationId = conv.getId();
        ChatwootWebhookPayload.Sender sender = payload.getSender();
        String channel = conv.getChannel() == null ? "web" : conv.getChannel();
        log.info("chatwoot webhook processing. conversationId={}, messageId={}", conversationId, payload.getId());

        PipelineResult result = orchestrator.process(PipelineRequest.builder()
                .message(payload.getContent())
                .sessionId("cw_" + conversationId)
                .conversationId(String.valueOf(conversationId))
                .contactEmail(sender == null ? null : sender.getEmail())
                .contactName(sender == null ? null : sender.getName())
                .channel(channel)
                .build());

        dispatcher.dispatch(conversationId, result, channel);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "processed");
        body.put("decision", result.getDecision().value());
        return Result.success(body);
    }

    private static Result<Map<String, Object>> ignored(String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ignored");
        body.put("reason", reason);
        return Result.success(body);
    }
}
