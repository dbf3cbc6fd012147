package com.jz.support.eval;

import com.jz.support.domain.Check;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import lombok.*;

import java.util.List;

@Data @Builder(toBuilder = true) @NoArgsConstructor @AllArgsConstructor
public class EvalOutcome {
    private Decision decision;
    private Confidence confidence;
    @Builder.Default
    private List<Check> checks = List.of();
    private String overrideReason;
    private String feedback;

    public static EvalOutcome degraded(String reason) {
        return EvalOutcome.builder()
                .decision(Decision.DRAFT)
                .confidence(Confidence.LOW)
                .overrideReason(reason)
                .build();
    }
}
