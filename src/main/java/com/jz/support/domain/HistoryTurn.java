package com.jz.support.domain;

import lombok.*;

import java.time.LocalDateTime;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class HistoryTurn {
    private String role;             // user / assistant
    private String content;
    private LocalDateTime timestamp;

    public boolean isCustomer() {
        return "user".equals(role);
    }
}
