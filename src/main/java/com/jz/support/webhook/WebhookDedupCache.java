package com.jz.support.webhook;

import com.jz.support.config.WebhookProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Webhook 幂等：按上游 message id 去重，TTL 内重复投递只处理一次。
 * 纯内存，重启即丢；漏判的代价是重复回复一次。
 */
@Component
public class WebhookDedupCache {

    private final Clock clock;
    private final Duration ttl;
    private final Map<Long, Long> seenAt = new HashMap<>();

    public WebhookDedupCache(Clock clock, WebhookProperties props) {
        this.clock = clock;
        this.ttl = props.getDedupTtl();
    }

    /** 先清过期，再查；没见过则登记并返回 false */
    public synchronized boolean seen(long eventId) {
        long now = clock.millis();
        long ttlMs = ttl.toMillis();
        seenAt.values().removeIf(ts -> now - ts > ttlMs);
        if (seenAt.containsKey(eventId)) return true;
        seenAt.put(eventId, now);
        return false;
    }

    public synchronized int size() {
        return seenAt.size();
    }
}
