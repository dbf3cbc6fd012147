package com.jz.support.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/** 只读：由外部导入任务维护 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("customers")
public class Customer {

    @TableId(type = IdType.INPUT)
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
