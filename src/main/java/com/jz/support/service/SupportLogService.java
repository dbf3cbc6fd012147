package com.jz.support.service;

import com.jz.support.domain.PersistSnapshot;

/**
 * 会话/消息/评估记录落库。每个写操作都是幂等 upsert，失败只记日志。
 */
public interface SupportLogService {

    /** 异步落一整轮；各写操作互相独立，一个失败不影响其它 */
    void persistAsync(PersistSnapshot snapshot);

    void saveSession(PersistSnapshot s);

    void updateOutstanding(PersistSnapshot s);

    void saveMessages(PersistSnapshot s);

    void saveEvalResult(PersistSnapshot s);
}
