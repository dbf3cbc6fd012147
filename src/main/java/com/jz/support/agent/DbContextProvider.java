package com.jz.support.agent;

import com.jz.support.domain.CustomerProfile;
import com.jz.support.domain.HistoryTurn;
import com.jz.support.domain.entity.ChatMessage;
import com.jz.support.mapper.ChatMessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DbContextProvider implements ContextProvider {

    private final ChatMessageMapper chatMessageMapper;
    private final CustomerProfileCache profileCache;

    @Override
    public List<HistoryTurn> history(String sessionId, int limit) {
        if (sessionId == null || limit <= 0) return List.of();
        try {
            List<ChatMessage> rows = chatMessageMapper.selectRecentBySessionId(sessionId, limit);
            List<HistoryTurn> out = new ArrayList<>(rows.size());
            for (ChatMessage m : rows) {
                out.add(HistoryTurn.builder()
                        .role(m.getRole())
                        .content(m.getContent())
                        .timestamp(m.getCreatedAt())
                        .build());
            }
            Collections.reverse(out); // DB 倒序取，翻回正序
            return out;
        } catch (Exception e) {
            log.warn("history load failed, continue without history. sessionId={}, err={}", sessionId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<CustomerProfile> profile(String email) {
        try {
            return profileCache.getOrLoad(email);
        } catch (Exception e) {
            log.warn("profile load failed. email={}, err={}", email, e.getMessage());
            return Optional.empty();
        }
    }
}
