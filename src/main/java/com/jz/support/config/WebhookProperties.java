package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "support.webhook")
public class WebhookProperties {
    /** 同一 message id 在该时间窗内只处理一次 */
    private Duration dedupTtl = Duration.ofSeconds(300);
}
