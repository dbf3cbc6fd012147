package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "support.profile")
public class ProfileProperties {
    private boolean cacheEnabled = true;
    private String redisKeyPrefix = "support:profile:e:";
    /** 0/负值表示不过期 */
    private Duration cacheTtl = Duration.ofMinutes(30);
}
