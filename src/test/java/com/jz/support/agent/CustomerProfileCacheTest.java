package com.jz.support.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ProfileProperties;
import com.jz.support.domain.CustomerProfile;
import com.jz.support.domain.entity.Customer;
import com.jz.support.mapper.CustomerMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("客户画像缓存")
class CustomerProfileCacheTest {

    private static final String KEY = "support:profile:e:sarah@example.com";

    @Mock private StringRedisTemplate redis;
    @Mock private ValueOperations<String, String> ops;
    @Mock private CustomerMapper customerMapper;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final ProfileProperties props = new ProfileProperties();
    private CustomerProfileCache cache;

    @BeforeEach
    void setUp() {
        cache = new CustomerProfileCache(redis, mapper, customerMapper, props);
    }

    private static Customer row() {
        return Customer.builder()
                .email("sarah@example.com")
                .name("Sarah")
                .subscriptionId("sub_123")
                .subscriptionStatus("active")
                .nextChargeDate(LocalDate.of(2025, 4, 1))
                .totalOrders(14)
                .build();
    }

    @Test
    void cacheHitSkipsDatabase() throws Exception {
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn(mapper.writeValueAsString(CustomerProfile.builder()
                .email("sarah@example.com").subscriptionId("sub_123").build()));

        Optional<CustomerProfile> p = cache.getOrLoad("  Sarah@Example.com ");

        assertThat(p).map(CustomerProfile::getSubscriptionId).contains("sub_123");
        verifyNoInteractions(customerMapper);
    }

    @Test
    @DisplayName("未命中：查库并写回，带 TTL")
    void missLoadsFromDbAndWritesBack() {
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn(null);
        when(customerMapper.selectByEmail("sarah@example.com")).thenReturn(row());

        Optional<CustomerProfile> p = cache.getOrLoad("sarah@example.com");

        assertThat(p).isPresent();
        assertThat(p.get().getNextChargeDate()).isEqualTo(LocalDate.of(2025, 4, 1));
        verify(ops).set(eq(KEY), anyString(), eq(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("邮箱大小写/空白归一后查库，缓存键也用小写")
    void mixedCaseEmailIsNormalized() {
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn(null);
        when(customerMapper.selectByEmail("sarah@example.com")).thenReturn(row());

        assertThat(cache.getOrLoad("  Sarah@Example.COM ")).map(CustomerProfile::getName).contains("Sarah");
        verify(ops).set(eq(KEY), anyString(), eq(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("Redis 故障时回源数据库")
    void redisFailureFallsBackToDb() {
        when(redis.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
        when(customerMapper.selectByEmail("sarah@example.com")).thenReturn(row());

        assertThat(cache.getOrLoad("sarah@example.com")).map(CustomerProfile::getName).contains("Sarah");
    }

    @Test
    void unknownCustomerIsEmpty() {
        props.setCacheEnabled(false);
        when(customerMapper.selectByEmail("nobody@example.com")).thenReturn(null);

        assertThat(cache.getOrLoad("nobody@example.com")).isEmpty();
        assertThat(cache.getOrLoad(" ")).isEmpty();
        verifyNoInteractions(redis);
    }
}
