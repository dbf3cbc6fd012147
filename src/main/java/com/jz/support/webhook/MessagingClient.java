package com.jz.support.webhook;

import java.util.List;

/** 回写客服工作台（会话消息、状态、标签、指派） */
public interface MessagingClient {

    void sendMessage(long conversationId, String content, boolean privateNote);

    void setStatus(long conversationId, String status);

    void addLabels(long conversationId, List<String> labels);

    void assign(long conversationId, long agentId);
}
