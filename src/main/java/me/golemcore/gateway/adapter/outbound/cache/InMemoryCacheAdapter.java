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
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local implementation of {@link CachePort}.
 *
 * <p>
 * Suitable for a single replica and for development. Entries expire lazily on
 * access according to the injected {@link Clock}. Sets never expire. Selected
 * with {@code gateway.cache.type=memory} (the default).
 */
@Component
@ConditionalOnProperty(prefix = "gateway.cache", name = "type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryCacheAdapter implements CachePort {

    private final Clock clock;
    private final Map<String, Entry> values = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();

    public InMemoryCacheAdapter(Clock clock) {
        this.clock = clock;
        log.info("[Cache] Using in-memory cache (single replica only)");
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(liveEntry(key)).map(Entry::value);
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        values.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean delete(String key) {
        boolean existed = liveEntry(key) != null;
        values.remove(key);
        boolean setExisted = sets.remove(key) != null;
        return existed || setExisted;
    }

    @Override
    public synchronized boolean exists(String key) {
        return liveEntry(key) != null || sets.containsKey(key);
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (liveEntry(key) != null) {
            return false;
        }
        values.put(key, new Entry(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean deleteIfValue(String key, String expectedValue) {
        Entry entry = liveEntry(key);
        if (entry == null || !Objects.equals(entry.value(), expectedValue)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    @Override
    public synchronized void addToSet(String key, String member) {
        sets.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(member);
    }

    @Override
    public synchronized void removeFromSet(String key, String member) {
        Set<String> members = sets.get(key);
        if (members == null) {
            return;
        }
        members.remove(member);
        if (members.isEmpty()) {
            sets.remove(key);
        }
    }

    @Override
    public synchronized Set<String> setMembers(String key) {
        Set<String> members = sets.get(key);
        if (members == null) {
            return Collections.emptySet();
        }
        return Set.copyOf(members);
    }

    @Override
    public synchronized List<String> scanKeys(String prefix, int maxKeys) {
        List<String> result = new ArrayList<>();
        for (String key : new ArrayList<>(values.keySet())) {
            if (result.size() >= maxKeys) {
                break;
            }
            if (key.startsWith(prefix) && liveEntry(key) != null) {
                result.add(key);
            }
        }
        for (String key : sets.keySet()) {
            if (result.size() >= maxKeys) {
                break;
            }
            if (key.startsWith(prefix)) {
                result.add(key);
            }
        }
        return result;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private Entry liveEntry(String key) {
        Entry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    private Instant expiry(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return null;
        }
        return clock.instant().plus(ttl);
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
