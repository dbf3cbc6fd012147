package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "support.chatwoot")
public class ChatwootProperties {
    private String url = "http://localhost:3000";
    private String apiToken;
    private long accountId = 1;
    /** 升级工单自动指派的客服 id；不配则不指派 */
    private Long escalationAssigneeId;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(15);
}
