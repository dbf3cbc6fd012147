package com.jz.support.guard;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RedLineVerdict {
    private boolean flagged;
    /** death_threat / legal_threat / bank_dispute / self_harm / violence_threat */
    private String trigger;

    public static RedLineVerdict clean() {
        return RedLineVerdict.builder().flagged(false).build();
    }

    public static RedLineVerdict flagged(String trigger) {
        return RedLineVerdict.builder().flagged(true).trigger(trigger).build();
    }
}
