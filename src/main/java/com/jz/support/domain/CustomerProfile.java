package com.jz.support.domain;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/** 客户画像（来自 customers 表，Redis 缓存） */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class CustomerProfile {
    private String email;
    private String name;
    private String subscriptionId;
    private String subscriptionStatus;
    private String frequency;
    private LocalDate joinDate;
    private LocalDate nextChargeDate;
    private Integer totalOrders;
    private BigDecimal ltv;
}
