package me.golemcore.gateway.adapter.outbound.cache;

import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCacheAdapterTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private SetOperations<String, String> setOps;
    private RedisCacheAdapter cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        setOps = mock(SetOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        cache = new RedisCacheAdapter(redisTemplate);
    }

    @Test
    void shouldReadAndWriteValuesWithTtl() {
        when(valueOps.get("session:1")).thenReturn("{}");

        cache.set("session:1", "{}", Duration.ofHours(24));

        verify(valueOps).set("session:1", "{}", Duration.ofHours(24));
        assertEquals(Optional.of("{}"), cache.get("session:1"));
        assertEquals(Optional.empty(), cache.get("session:2"));
    }

    @Test
    void shouldSetIfAbsentWithTtl() {
        when(valueOps.setIfAbsent("lock:a", "token", Duration.ofSeconds(30))).thenReturn(true);

        assertTrue(cache.setIfAbsent("lock:a", "token", Duration.ofSeconds(30)));
        assertFalse(cache.setIfAbsent("lock:b", "token", Duration.ofSeconds(30)));
    }

    @Test
    void shouldDeleteIfValueThroughScript() {
        when(redisTemplate.execute(eq(RedisCacheAdapter.DELETE_IF_VALUE_SCRIPT), eq(List.of("lock:a")),
                eq("token"))).thenReturn(1L);

        assertTrue(cache.deleteIfValue("lock:a", "token"));
        assertFalse(cache.deleteIfValue("lock:a", "other"));
    }

    @Test
    void shouldReturnEmptySetWhenRedisReturnsNull() {
        when(setOps.members("session:owner:h")).thenReturn(null);
        assertTrue(cache.setMembers("session:owner:h").isEmpty());

        when(setOps.members("session:owner:h")).thenReturn(Set.of("s1"));
        assertEquals(Set.of("s1"), cache.setMembers("session:owner:h"));
    }

    @Test
    void shouldWrapRedisFailuresAsCacheUnavailable() {
        when(redisTemplate.hasKey("active_session:s1"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        CacheUnavailableException ex = assertThrows(CacheUnavailableException.class,
                () -> cache.exists("active_session:s1"));
        assertTrue(ex.getCause() instanceof RedisConnectionFailureException);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReportPingFailureWithoutThrowing() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertFalse(cache.ping());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReportPingSuccess() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        assertTrue(cache.ping());
    }
}
