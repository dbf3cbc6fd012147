package com.jz.support.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ProfileProperties;
import com.jz.support.domain.CustomerProfile;
import com.jz.support.domain.entity.Customer;
import com.jz.support.mapper.CustomerMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * 客户画像缓存（优先 Redis；miss 则 DB -> Redis）。
 * Redis 出错直接回源数据库。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerProfileCache {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final CustomerMapper customerMapper;
    private final ProfileProperties props;

    private String k(String email) {
        return props.getRedisKeyPrefix() + email;
    }

    public Optional<CustomerProfile> getOrLoad(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        String norm = email.trim().toLowerCase(Locale.ROOT);

        if (props.isCacheEnabled()) {
            try {
                String js = redis.opsForValue().get(k(norm));
                if (js != null) return Optional.of(mapper.readValue(js, CustomerProfile.class));
            } catch (Exception e) {
                log.warn("profile cache read failed, fallback to db. email={}, err={}", norm, e.getMessage());
            }
        }

        Customer row = customerMapper.selectByEmail(norm);
        if (row == null) return Optional.empty();
        CustomerProfile p = toProfile(row);
        put(norm, p);
        return Optional.of(p);
    }

    /** 写回 Redis（带 TTL 或不过期） */
    public void put(String email, CustomerProfile profile) {
        if (!props.isCacheEnabled()) return;
        try {
            String js = mapper.writeValueAsString(profile);
            Duration ttl = props.getCacheTtl();
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(k(email), js);
            } else {
                redis.opsForValue().set(k(email), js, ttl);
            }
        } catch (Exception e) {
            log.warn("profile cache put failed: {}", e.getMessage());
        }
    }

    static CustomerProfile toProfile(Customer c) {
        return CustomerProfile.builder()
                .email(c.getEmail())
                .name(c.getName())
                .subscriptionId(c.getSubscriptionId())
                .subscriptionStatus(c.getSubscriptionStatus())
                .frequency(c.getFrequency())
                .joinDate(c.getJoinDate())
                .nextChargeDate(c.getNextChargeDate())
                .totalOrders(c.getTotalOrders())
                .ltv(c.getLtv())
                .build();
    }
}
