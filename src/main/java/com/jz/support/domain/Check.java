package com.jz.support.domain;

import lombok.*;

/** 单项评估结果：safety / tone / accuracy / completeness */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class Check {
    private String name;
    private boolean passed;
    private double score;    // 0~1
    private String detail;

    public static Check of(String name, boolean passed, double score, String detail) {
        return Check.builder()
                .name(name)
                .passed(passed)
                .score(clamp(score))
                .detail(detail == null ? "" : detail)
                .build();
    }

    static double clamp(double s) {
        if (Double.isNaN(s)) return 0.0;
        return Math.max(0.0, Math.min(1.0, s));
    }
}
