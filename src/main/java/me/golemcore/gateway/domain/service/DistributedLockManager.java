package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.domain.exception.LockAcquisitionException;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Best-effort mutual exclusion across replicas, backed by the shared cache.
 *
 * <p>
 * A lock is the key {@code lock:{resourceId}} holding a random owner token
 * with a TTL, so a crashed holder releases it eventually. Acquisition retries
 * with jittered exponential backoff until the timeout; release deletes the key
 * only if it still holds our token.
 *
 * <p>
 * Without a configured cache the operation runs unlocked. Errors from a
 * configured cache propagate.
 */
@Service
@Slf4j
public class DistributedLockManager {

    static final String LOCK_PREFIX = "lock:";

    private final CachePort cache;
    private final GatewayProperties properties;

    public DistributedLockManager(Optional<CachePort> cache, GatewayProperties properties) {
        this.cache = cache.orElse(null);
        this.properties = properties;
    }

    public <T> T withLock(String resourceId, String operationName, Supplier<T> operation) {
        GatewayProperties.LockProperties lock = properties.getLock();
        return withLock(resourceId, operationName, lock.getAcquireTimeout(), lock.getTtl(), operation);
    }

    public <T> T withLock(String resourceId, String operationName, Duration acquireTimeout, Duration lockTtl,
            Supplier<T> operation) {
        if (cache == null) {
            log.debug("[Lock] No shared cache, running {} on {} unlocked", operationName, resourceId);
            return operation.get();
        }

        String key = LOCK_PREFIX + resourceId;
        String token = UUID.randomUUID().toString();
        acquire(resourceId, key, token, operationName, acquireTimeout, lockTtl);
        try {
            return operation.get();
        } finally {
            release(key, token, operationName);
        }
    }

    private void acquire(String resourceId, String key, String token, String operationName,
            Duration acquireTimeout, Duration lockTtl) {
        GatewayProperties.LockProperties lock = properties.getLock();
        long deadline = System.nanoTime() + acquireTimeout.toNanos();
        long backoffMillis = Math.max(1, lock.getInitialBackoff().toMillis());
        long maxBackoffMillis = Math.max(backoffMillis, lock.getMaxBackoff().toMillis());
        int attempts = 0;

        while (true) {
            attempts++;
            if (cache.setIfAbsent(key, token, lockTtl)) {
                log.debug("[Lock] Acquired {} for {} after {} attempt(s)", key, operationName, attempts);
                return;
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.warn("[Lock] Timed out acquiring {} for {} after {} attempt(s)", key, operationName, attempts);
                throw new LockAcquisitionException(resourceId, operationName, acquireTimeout);
            }

            long sleepMillis = Math.min(withJitter(backoffMillis, lock.getJitter()),
                    TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1);
            try {
                Thread.sleep(Math.max(1, sleepMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException(resourceId, operationName, acquireTimeout, e);
            }
            backoffMillis = Math.min(backoffMillis * 2, maxBackoffMillis);
        }
    }

    private void release(String key, String token, String operationName) {
        try {
            if (!cache.deleteIfValue(key, token)) {
                log.warn("[Lock] {} expired or changed owner before release ({})", key, operationName);
            }
        } catch (RuntimeException e) { // NOSONAR - best-effort release
            log.warn("[Lock] Failed to release {} after {}: {}", key, operationName, e.getMessage());
        }
    }

    static long withJitter(long millis, double jitter) {
        if (jitter <= 0) {
            return millis;
        }
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
        return Math.max(1, Math.round(millis * factor));
    }
}
