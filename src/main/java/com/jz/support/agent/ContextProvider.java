package com.jz.support.agent;

import com.jz.support.domain.CustomerProfile;
import com.jz.support.domain.HistoryTurn;

import java.util.List;
import java.util.Optional;

public interface ContextProvider {

    /** 最近 limit 条，按时间正序（最新的在最后） */
    List<HistoryTurn> history(String sessionId, int limit);

    Optional<CustomerProfile> profile(String email);
}
