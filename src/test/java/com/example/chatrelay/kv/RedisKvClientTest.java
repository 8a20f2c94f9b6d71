package com.example.chatrelay.kv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisKvClientTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> ops;

    private RedisKvClient kvClient;

    @BeforeEach
    void setUp() {
        when(redis.opsForValue()).thenReturn(ops);
        kvClient = new RedisKvClient(redis);
    }

    @Test
    void testSetIfAbsent_UsesTtlWhenPositive() {
        when(ops.setIfAbsent("webhook:seen:SM1", "u1", Duration.ofMinutes(5))).thenReturn(true);

        assertTrue(kvClient.setIfAbsent("webhook:seen:SM1", "u1", Duration.ofMinutes(5)));
        verify(ops, never()).setIfAbsent("webhook:seen:SM1", "u1");
    }

    @Test
    void testSetIfAbsent_NullReplyCountsAsNotSet() {
        when(ops.setIfAbsent("k", "v")).thenReturn(null);

        assertFalse(kvClient.setIfAbsent("k", "v", Duration.ZERO));
    }

    @Test
    void testGet_MissingKeyIsEmpty() {
        when(ops.get("missing")).thenReturn(null);

        assertTrue(kvClient.get("missing").isEmpty());
    }
}
