package com.jz.support.controller;

import com.jz.support.common.Result;
import com.jz.support.domain.dto.ChatRequest;
import com.jz.support.mapper.ChatSessionMapper;
import com.jz.support.pipeline.PipelineOrchestrator;
import com.jz.support.pipeline.PipelineRequest;
import com.jz.support.pipeline.PipelineResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("api")
@RequiredArgsConstructor
public class ChatController {

    private final PipelineOrchestrator orchestrator;
    private final ChatSessionMapper chatSessionMapper;

    @PostMapping("/chat")
    public Result<PipelineResult> chat(@Valid @RequestBody ChatRequest req) {
        Object channel = req.getMetadata() == null ? null : req.getMetadata().get("channel");
        PipelineRequest pr = PipelineRequest.builder()
                .message(req.getMessage())
                .sessionId(req.getSessionId())
                .conversationId(req.getConversationId())
                .contactEmail(req.getContact() == null ? null : req.getContact().getEmail())
                .contactName(req.getContact() == null ? null : req.getContact().getName())
                .channel(channel == null ? null : channel.toString())
                .teamMode(req.getTeamMode())
                .build();
        return Result.success(orchestrator.process(pr));
    }

    @GetMapping("/health")
    public Result<Map<String, Object>> health() {
        String db = "connected";
        try {
            chatSessionMapper.ping();
        } catch (Exception e) {
            log.warn("health db ping failed: {}", e.getMessage());
            db = "disconnected";
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "connected".equals(db) ? "healthy" : "degraded");
        body.put("services", Map.of("database", db));
        return Result.success(body);
    }
}
