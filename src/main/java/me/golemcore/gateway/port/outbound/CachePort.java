package me.golemcore.gateway.port.outbound;

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

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Port for the shared key-value cache visible to every gateway replica.
 *
 * <p>
 * Implementations raise
 * {@link me.golemcore.gateway.domain.exception.CacheUnavailableException} when
 * the backend cannot be reached. Callers decide whether to fail closed or to
 * degrade.
 */
public interface CachePort {

    Optional<String> get(String key);

    /**
     * Store a value that expires after {@code ttl}.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Delete a key.
     *
     * @return true if the key existed
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Atomically store a value only when the key is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Atomically delete the key only if it still holds {@code expectedValue}.
     *
     * @return true if the key was deleted
     */
    boolean deleteIfValue(String key, String expectedValue);

    void addToSet(String key, String member);

    void removeFromSet(String key, String member);

    Set<String> setMembers(String key);

    /**
     * List keys starting with {@code prefix}, returning at most
     * {@code maxKeys}.
     */
    List<String> scanKeys(String prefix, int maxKeys);

    /**
     * Health check.
     */
    boolean ping();
}
