package com.jz.support.eval;

/**
 * 第二层：语义评审。解析失败返回 UNPARSEABLE；调用本身失败（网络、超时）直接抛出，由评估闸门兜底。
 */
public interface SemanticJudge {
    JudgeVerdict judge(String instructions, String prompt);
}
