package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "support.retention")
public class RetentionProperties {
    /** 退订链接加密口令；为空则不生成链接 */
    private String password;
    private String cancelBaseUrl = "https://levhaolam.com/pay/subscriptions/cancel";
}
