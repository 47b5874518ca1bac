package me.golemcore.gateway.adapter.outbound.archive;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionArchivePort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Keeps a durable JSON copy of each session record on {@link StoragePort}, one
 * file per session ({@code sessions/{id}.json}).
 */
@Component
@ConditionalOnProperty(prefix = "gateway.archive", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StorageSessionArchiveAdapter implements SessionArchivePort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;

    @Override
    public void save(SessionRecord sessionRecord) {
        String json;
        try {
            json = objectMapper.writeValueAsString(sessionRecord);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + sessionRecord.getId(), e);
        }
        storagePort.putTextAtomic(directory(), fileName(sessionRecord.getId()), json).join();
        log.debug("[Archive] Saved session: {}", sessionRecord.getId());
    }

    @Override
    public Optional<SessionRecord> load(String sessionId) {
        try {
            String json = storagePort.getText(directory(), fileName(sessionId)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SessionRecord.class));
        } catch (IOException | CompletionException e) {
            log.warn("[Archive] Failed to load session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String sessionId) {
        try {
            storagePort.deleteObject(directory(), fileName(sessionId)).join();
            log.debug("[Archive] Deleted session: {}", sessionId);
        } catch (CompletionException e) {
            log.error("[Archive] Failed to delete session: {}", sessionId, e);
        }
    }

    private String directory() {
        return properties.getArchive().getDirectory();
    }

    private static String fileName(String sessionId) {
        return sessionId + JSON_EXTENSION;
    }
}
