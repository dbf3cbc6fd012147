package com.jz.support.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.domain.Category;
import com.jz.support.domain.PersistSnapshot;
import com.jz.support.domain.entity.ChatMessage;
import com.jz.support.domain.entity.ChatSession;
import com.jz.support.domain.entity.EvalResult;
import com.jz.support.mapper.ChatMessageMapper;
import com.jz.support.mapper.ChatSessionMapper;
import com.jz.support.mapper.EvalResultMapper;
import com.jz.support.service.SupportLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SupportLogServiceImpl implements SupportLogService {

    private final ChatSessionMapper sessionMapper;
    private final ChatMessageMapper messageMapper;
    private final EvalResultMapper evalResultMapper;
    private final ObjectMapper mapper;

    @Async("persistExecutor")
    @Override
    public void persistAsync(PersistSnapshot s) {
        // session 与 outstanding 更新有先后依赖，放在同一步里顺序执行
        isolated("session", s, () -> {
            saveSession(s);
            updateOutstanding(s);
        });
        isolated("messages", s, () -> saveMessages(s));
        isolated("eval", s, () -> saveEvalResult(s));
    }

    @Override
    public void saveSession(PersistSnapshot s) {
        ChatSession row = ChatSession.builder()
                .sessionId(s.getSessionId())
                .conversationId(s.getConversationId())
                .channel(s.getChannel())
                .customerEmail(s.getCustomerEmail())
                .customerName(s.getCustomerName())
                .primaryCategory(code(s.getPrimary()))
                .secondaryCategory(code(s.getSecondary()))
                .urgency(s.getUrgency() == null ? null : s.getUrgency().value())
                .status("active")
                .evalDecision(s.getDecision().value())
                .firstResponseTimeMs(s.getProcessingTimeMs())
                .build();
        sessionMapper.upsert(row);
    }

    @Override
    public void updateOutstanding(PersistSnapshot s) {
        sessionMapper.updateOutstanding(s.getSessionId(), s.isOutstanding(),
                s.getOutstandingTrigger(), s.getDecision().value());
    }

    @Override
    public void saveMessages(PersistSnapshot s) {
        messageMapper.upsert(ChatMessage.builder()
                .sessionId(s.getSessionId()).turnId(s.getTurnId())
                .role("user").content(s.getMessage())
                .build());
        messageMapper.upsert(ChatMessage.builder()
                .sessionId(s.getSessionId()).turnId(s.getTurnId())
                .role("assistant").content(s.getReply())
                .modelUsed(s.getModelUsed()).processingTimeMs(s.getProcessingTimeMs())
                .build());
    }

    @Override
    public void saveEvalResult(PersistSnapshot s) {
        EvalResult row = EvalResult.builder()
                .ticketId(s.getSessionId())
                .turnId(s.getTurnId())
                .requestSubtype(code(s.getPrimary()))
                .requestSubSubtype(code(s.getSecondary()))
                .decision(s.getDecision().value())
                .draftReason(s.getOverrideReason())
                .confidence(s.getConfidence() == null ? null : s.getConfidence().value())
                .checks(toJson(s.getChecks()))
                .isOutstanding(s.isOutstanding())
                .outstandingTrigger(s.getOutstandingTrigger())
                .autoSendEnabled(s.getPrimary() != null && s.getPrimary().autoSendEnabled())
                .attempts(s.getAttempts())
                .build();
        evalResultMapper.upsert(row);
    }

    private void isolated(String what, PersistSnapshot s, Runnable write) {
        try {
            write.run();
        } catch (Exception e) {
            log.error("persist failed. what={}, sessionId={}, turnId={}, err={}",
                    what, s.getSessionId(), s.getTurnId(), e.getMessage(), e);
        }
    }

    private String toJson(List<?> checks) {
        try {
            return mapper.writeValueAsString(checks == null ? List.of() : checks);
        } catch (JsonProcessingException e) {
            log.warn("checks serialize failed: {}", e.getMessage());
            return "[]";
        }
    }

    private static String code(Category c) {
        return c == null ? null : c.code();
    }
}
