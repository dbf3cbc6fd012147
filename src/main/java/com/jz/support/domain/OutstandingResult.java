package com.jz.support.domain;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class OutstandingResult {
    private boolean outstanding;
    private String trigger;          // 未命中为 "none"
    private Confidence confidence;

    public static OutstandingResult none() {
        return OutstandingResult.builder().outstanding(false).trigger("none").confidence(Confidence.HIGH).build();
    }

    public static OutstandingResult detectionError() {
        return OutstandingResult.builder().outstanding(false).trigger("detection_error").confidence(Confidence.LOW).build();
    }
}
