package com.jz.support.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.support.domain.entity.ChatSession;
import org.apache.ibatis.annotations.*;

@Mapper
public interface ChatSessionMapper extends BaseMapper<ChatSession> {

    @Insert("""
        INSERT INTO chat_sessions (
            session_id, conversation_id, channel, customer_email, customer_name,
            primary_category, secondary_category, urgency, status, eval_decision,
            first_response_time_ms, created_at, updated_at
        ) VALUES (
            #{sessionId}, #{conversationId}, #{channel}, #{customerEmail}, #{customerName},
            #{primaryCategory}, #{secondaryCategory}, #{urgency}, #{status}, #{evalDecision},
            #{firstResponseTimeMs}, #{createdAt}, #{updatedAt}
        )
        ON CONFLICT (session_id) DO UPDATE SET
            primary_category = EXCLUDED.primary_category,
            secondary_category = EXCLUDED.secondary_category,
            urgency = EXCLUDED.urgency,
            eval_decision = EXCLUDED.eval_decision,
            first_response_time_ms = EXCLUDED.first_response_time_ms,
            customer_name = COALESCE(EXCLUDED.customer_name, chat_sessions.customer_name),
            customer_email = COALESCE(EXCLUDED.customer_email, chat_sessions.customer_email),
            updated_at = NOW()
    """)
    int upsert(ChatSession session);

    @Update("""
        UPDATE chat_sessions
           SET is_outstanding = #{outstanding},
               outstanding_trigger = #{trigger},
               eval_decision = #{decision},
               updated_at = NOW()
         WHERE session_id = #{sessionId}
    """)
    int updateOutstanding(@Param("sessionId") String sessionId,
                          @Param("outstanding") boolean outstanding,
                          @Param("trigger") String trigger,
                          @Param("decision") String decision);

    // 健康检查
    @Select("SELECT 1")
    Integer ping();
}
