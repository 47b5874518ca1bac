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
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Cross-replica "is running" and "interrupt requested" markers.
 *
 * <p>
 * Markers live in the shared cache with TTLs so that a crashed replica cannot
 * leave a session active forever. Every operation fails closed: without a
 * reachable cache a {@link CacheUnavailableException} is raised and no
 * process-local state is consulted.
 */
@Service
@Slf4j
public class ActiveSessionTracker {

    static final String ACTIVE_PREFIX = "active_session:";
    static final String INTERRUPT_PREFIX = "interrupted:";
    static final String UNOWNED_MARKER = "1";

    private final CachePort cache;
    private final GatewayProperties properties;

    public ActiveSessionTracker(Optional<CachePort> cache, GatewayProperties properties) {
        this.cache = cache.orElse(null);
        this.properties = properties;
    }

    public void register(String sessionId) {
        register(sessionId, null);
    }

    /**
     * Mark the session active. The marker carries the owner hash so the
     * session can be guarded before its record is written.
     */
    public void register(String sessionId, String ownerCredential) {
        String marker = OwnerHashSupport.hasCredential(ownerCredential)
                ? OwnerHashSupport.hash(ownerCredential)
                : UNOWNED_MARKER;
        requireCache().set(ACTIVE_PREFIX + sessionId, marker, properties.getSession().getActiveTtl());
        log.debug("[Tracker] Registered active session: {}", sessionId);
    }

    /**
     * Owner hash recorded when the session was registered, empty when the
     * session is not active or was registered without a credential.
     */
    public Optional<String> activeOwnerHash(String sessionId) {
        return requireCache().get(ACTIVE_PREFIX + sessionId)
                .filter(marker -> !UNOWNED_MARKER.equals(marker));
    }

    public boolean isActive(String sessionId) {
        return requireCache().exists(ACTIVE_PREFIX + sessionId);
    }

    /**
     * Remove the active marker. Removing an absent marker is a no-op.
     */
    public void unregister(String sessionId) {
        requireCache().delete(ACTIVE_PREFIX + sessionId);
        log.debug("[Tracker] Unregistered session: {}", sessionId);
    }

    public void markInterrupted(String sessionId) {
        requireCache().set(INTERRUPT_PREFIX + sessionId, "1", properties.getSession().getInterruptTtl());
        log.info("[Tracker] Interrupt requested for session: {}", sessionId);
    }

    public boolean isInterrupted(String sessionId) {
        return requireCache().exists(INTERRUPT_PREFIX + sessionId);
    }

    public void clearInterrupt(String sessionId) {
        requireCache().delete(INTERRUPT_PREFIX + sessionId);
    }

    private CachePort requireCache() {
        if (cache == null) {
            throw new CacheUnavailableException("Shared cache is not configured");
        }
        return cache;
    }
}
