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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.SessionPage;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.SessionUpdate;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CachePort;
import me.golemcore.gateway.port.outbound.SessionArchivePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session record store with centralized ownership enforcement.
 *
 * <p>
 * Records live in the shared cache as JSON under {@code session:{id}}. Owned
 * records are also indexed in the set {@code session:owner:{ownerHash}}. When a
 * {@link SessionArchivePort} is configured it receives a durable copy of every
 * write and serves reads the cache no longer has.
 *
 * <p>
 * Every accessor goes through {@link #enforceOwner}: a record owned by someone
 * else is reported exactly like a missing one. Every mutation runs under the
 * {@link DistributedLockManager} keyed {@code session_lock:{id}}.
 */
@Service
@Slf4j
public class SessionRecordService {

    static final String SESSION_PREFIX = "session:";
    static final String OWNER_INDEX_PREFIX = "session:owner:";
    static final String LOCK_PREFIX = "session_lock:";

    private static final String ERR_CACHE_PARSE_FAILED = "ERR_CACHE_PARSE_FAILED";

    private final CachePort cache;
    private final SessionArchivePort archive;
    private final DistributedLockManager lockManager;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    public SessionRecordService(Optional<CachePort> cache, Optional<SessionArchivePort> archive,
            DistributedLockManager lockManager, ObjectMapper objectMapper, GatewayProperties properties,
            Clock clock) {
        this.cache = cache.orElse(null);
        this.archive = archive.orElse(null);
        this.lockManager = lockManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create a new record. A random id is generated when {@code sessionId} is
     * null.
     */
    public SessionRecord create(String model, String sessionId, String ownerCredential, String parentSessionId) {
        String id = sessionId != null ? sessionId : UUID.randomUUID().toString();
        return lockManager.withLock(LOCK_PREFIX + id, "create_session",
                () -> store(newRecord(id, model, ownerCredential, parentSessionId)));
    }

    /**
     * Create the record unless one already exists, returning whichever record
     * is stored afterwards.
     */
    public SessionRecord createIfAbsent(String sessionId, String model, String ownerCredential,
            String parentSessionId) {
        return lockManager.withLock(LOCK_PREFIX + sessionId, "create_session", () -> {
            Optional<SessionRecord> existing = load(sessionId);
            if (existing.isPresent()) {
                return existing.get();
            }
            return store(newRecord(sessionId, model, ownerCredential, parentSessionId));
        });
    }

    /**
     * @throws SessionNotFoundException
     *             if the session is missing or owned by another credential
     */
    public SessionRecord get(String sessionId, String credential) {
        SessionRecord sessionRecord = load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        return enforceOwner(sessionRecord, credential);
    }

    public Optional<SessionRecord> find(String sessionId, String credential) {
        try {
            return Optional.of(get(sessionId, credential));
        } catch (SessionNotFoundException e) {
            return Optional.empty();
        }
    }

    public SessionRecord update(String sessionId, SessionUpdate update, String credential) {
        return lockManager.withLock(LOCK_PREFIX + sessionId, "update_session", () -> {
            SessionRecord sessionRecord = get(sessionId, credential);
            update.applyTo(sessionRecord);
            sessionRecord.setUpdatedAt(clock.instant());
            return store(sessionRecord);
        });
    }

    public void delete(String sessionId, String credential) {
        lockManager.withLock(LOCK_PREFIX + sessionId, "delete_session", () -> {
            SessionRecord sessionRecord = get(sessionId, credential);
            CachePort c = requireCache();
            if (sessionRecord.getOwnerHash() != null) {
                c.removeFromSet(OWNER_INDEX_PREFIX + sessionRecord.getOwnerHash(), sessionId);
            }
            c.delete(SESSION_PREFIX + sessionId);
            if (archive != null) {
                archive.delete(sessionId);
            }
            log.info("[Sessions] Deleted session: {}", sessionId);
            return null;
        });
    }

    /**
     * List sessions newest-first. With a credential only the caller's
     * sessions are listed via the owner index, pruning index entries whose
     * record has expired. Without one, a bounded scan over all session keys
     * is used.
     */
    public SessionPage list(String credential, int page, int pageSize) {
        int maxPageSize = properties.getSession().getMaxPageSize();
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + maxPageSize);
        }

        List<SessionRecord> records = OwnerHashSupport.hasCredential(credential)
                ? listOwned(OwnerHashSupport.hash(credential))
                : listAll();
        records.sort(Comparator.comparing(SessionRecord::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));

        int total = records.size();
        int from = Math.min((page - 1) * pageSize, total);
        int to = Math.min(from + pageSize, total);
        return new SessionPage(List.copyOf(records.subList(from, to)), total, page, pageSize);
    }

    public boolean exists(String sessionId) {
        if (requireCache().exists(SESSION_PREFIX + sessionId)) {
            return true;
        }
        return archive != null && archive.load(sessionId).isPresent();
    }

    /**
     * Central ownership gate. A record without an owner hash is public; a
     * request without a credential is not filtered.
     */
    SessionRecord enforceOwner(SessionRecord sessionRecord, String credential) {
        String storedHash = sessionRecord.getOwnerHash();
        if (storedHash == null || !OwnerHashSupport.hasCredential(credential)) {
            return sessionRecord;
        }
        if (!OwnerHashSupport.matches(storedHash, credential)) {
            throw new SessionNotFoundException(sessionRecord.getId());
        }
        return sessionRecord;
    }

    private List<SessionRecord> listOwned(String ownerHash) {
        CachePort c = requireCache();
        String indexKey = OWNER_INDEX_PREFIX + ownerHash;
        List<SessionRecord> records = new ArrayList<>();
        for (String sessionId : c.setMembers(indexKey)) {
            Optional<SessionRecord> cached = readCached(sessionId);
            if (cached.isPresent()) {
                records.add(cached.get());
            } else {
                c.removeFromSet(indexKey, sessionId);
                log.debug("[Sessions] Pruned expired session {} from owner index", sessionId);
            }
        }
        return records;
    }

    private List<SessionRecord> listAll() {
        CachePort c = requireCache();
        int limit = properties.getCache().getScanLimit();
        List<SessionRecord> records = new ArrayList<>();
        for (String key : c.scanKeys(SESSION_PREFIX, limit)) {
            if (key.startsWith(OWNER_INDEX_PREFIX)) {
                continue;
            }
            readCached(key.substring(SESSION_PREFIX.length())).ifPresent(records::add);
        }
        return records;
    }

    private Optional<SessionRecord> load(String sessionId) {
        Optional<SessionRecord> cached = readCached(sessionId);
        if (cached.isPresent() || archive == null) {
            return cached;
        }
        Optional<SessionRecord> archived = archive.load(sessionId);
        archived.ifPresent(sessionRecord -> {
            writeCached(sessionRecord);
            log.debug("[Sessions] Restored session {} from archive", sessionId);
        });
        return archived;
    }

    private Optional<SessionRecord> readCached(String sessionId) {
        CachePort c = requireCache();
        String key = SESSION_PREFIX + sessionId;
        Optional<String> json = c.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), SessionRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("[Sessions] Discarding corrupt cache entry {} errorId={}: {}", key, ERR_CACHE_PARSE_FAILED,
                    e.getOriginalMessage());
            c.delete(key);
            return Optional.empty();
        }
    }

    private SessionRecord store(SessionRecord sessionRecord) {
        if (archive != null) {
            archive.save(sessionRecord);
        }
        writeCached(sessionRecord);
        return sessionRecord;
    }

    private void writeCached(SessionRecord sessionRecord) {
        CachePort c = requireCache();
        String json;
        try {
            json = objectMapper.writeValueAsString(sessionRecord);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + sessionRecord.getId(), e);
        }
        c.set(SESSION_PREFIX + sessionRecord.getId(), json, properties.getSession().getTtl());
        if (sessionRecord.getOwnerHash() != null) {
            c.addToSet(OWNER_INDEX_PREFIX + sessionRecord.getOwnerHash(), sessionRecord.getId());
        }
    }

    private SessionRecord newRecord(String id, String model, String ownerCredential, String parentSessionId) {
        Instant now = clock.instant();
        SessionRecord sessionRecord = SessionRecord.builder()
                .id(id)
                .model(model)
                .status(SessionStatus.ACTIVE)
                .parentSessionId(parentSessionId)
                .ownerHash(OwnerHashSupport.hasCredential(ownerCredential)
                        ? OwnerHashSupport.hash(ownerCredential)
                        : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("[Sessions] Created session: {}", id);
        return sessionRecord;
    }

    private CachePort requireCache() {
        if (cache == null) {
            throw new CacheUnavailableException("Shared cache is not configured");
        }
        return cache;
    }
}
