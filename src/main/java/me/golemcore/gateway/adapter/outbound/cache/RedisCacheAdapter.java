package me.golemcore.gateway.adapter.outbound.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link CachePort} for multi-replica deployments.
 *
 * <p>
 * Enabled with {@code gateway.cache.type=redis}; connection settings come from
 * the standard {@code spring.data.redis.*} properties. Every Redis failure is
 * surfaced as {@link CacheUnavailableException}.
 */
@Component
@ConditionalOnProperty(prefix = "gateway.cache", name = "type", havingValue = "redis")
@Slf4j
public class RedisCacheAdapter implements CachePort {

    private static final long SCAN_BATCH = 100;

    // GET and DEL must run as one server-side step.
    static final RedisScript<Long> DELETE_IF_VALUE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCacheAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("[Cache] Using Redis cache");
    }

    @Override
    public Optional<String> get(String key) {
        return call("get", () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set", () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("delete", () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return call("exists", () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("setIfAbsent",
                () -> Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        return call("deleteIfValue", () -> {
            Long deleted = redisTemplate.execute(DELETE_IF_VALUE_SCRIPT, List.of(key), expectedValue);
            return deleted != null && deleted > 0;
        });
    }

    @Override
    public void addToSet(String key, String member) {
        call("addToSet", () -> redisTemplate.opsForSet().add(key, member));
    }

    @Override
    public void removeFromSet(String key, String member) {
        call("removeFromSet", () -> redisTemplate.opsForSet().remove(key, member));
    }

    @Override
    public Set<String> setMembers(String key) {
        return call("setMembers", () -> {
            Set<String> members = redisTemplate.opsForSet().members(key);
            return members != null ? members : Collections.<String>emptySet();
        });
    }

    @Override
    public List<String> scanKeys(String prefix, int maxKeys) {
        return call("scanKeys", () -> {
            ScanOptions options = ScanOptions.scanOptions()
                    .match(prefix + "*")
                    .count(SCAN_BATCH)
                    .build();
            List<String> keys = new ArrayList<>();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext() && keys.size() < maxKeys) {
                    keys.add(cursor.next());
                }
            }
            return keys;
        });
    }

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("[Cache] Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("[Cache] Redis {} failed: {}", operation, e.getMessage());
            throw new CacheUnavailableException("Shared cache unavailable", e);
        }
    }
}
