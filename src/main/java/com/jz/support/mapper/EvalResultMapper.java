package com.jz.support.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.support.domain.entity.EvalResult;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface EvalResultMapper extends BaseMapper<EvalResult> {

    @Insert("""
        INSERT INTO eval_results (
            ticket_id, turn_id, request_subtype, request_sub_subtype, decision, draft_reason,
            confidence, checks, is_outstanding, outstanding_trigger, auto_send_enabled, attempts, created_at
        ) VALUES (
            #{ticketId}, #{turnId}, #{requestSubtype}, #{requestSubSubtype}, #{decision}, #{draftReason},
            #{confidence}, CAST(#{checks} AS JSONB), #{isOutstanding}, #{outstandingTrigger},
            #{autoSendEnabled}, #{attempts}, #{createdAt}
        )
        ON CONFLICT (turn_id) DO UPDATE SET
            decision = EXCLUDED.decision,
            draft_reason = EXCLUDED.draft_reason,
            confidence = EXCLUDED.confidence,
            checks = EXCLUDED.checks,
            attempts = EXCLUDED.attempts
    """)
    int upsert(EvalResult result);
}
