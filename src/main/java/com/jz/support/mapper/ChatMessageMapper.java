package com.jz.support.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.support.domain.entity.ChatMessage;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface ChatMessageMapper extends BaseMapper<ChatMessage> {

    @Insert("""
        INSERT INTO chat_messages (
            session_id, turn_id, role, content, model_used, processing_time_ms, created_at
        ) VALUES (
            #{sessionId}, #{turnId}, #{role}, #{content}, #{modelUsed}, #{processingTimeMs}, #{createdAt}
        )
        ON CONFLICT (turn_id, role) DO NOTHING
    """)
    int upsert(ChatMessage message);

    /** 最近 N 条（倒序），调用方自己翻回正序 */
    @Select("""
        SELECT * FROM chat_messages
          WHERE session_id = #{sessionId}
          ORDER BY created_at DESC, id DESC
          LIMIT #{limit}
    """)
    List<ChatMessage> selectRecentBySessionId(@Param("sessionId") String sessionId, @Param("limit") int limit);
}
