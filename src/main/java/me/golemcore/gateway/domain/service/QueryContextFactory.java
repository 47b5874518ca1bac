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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.InitManifest;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates a query and resolves which session it runs in.
 *
 * <p>
 * A plain query runs in the given session id or a fresh one. {@code resume}
 * requires the existing session, {@code forkSession} branches a new session
 * from it. In all cases an existing session must be visible to the caller.
 */
@Component
@RequiredArgsConstructor
public class QueryContextFactory {

    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final SessionRecordService recordService;
    private final AgentRuntimePort runtime;
    private final GatewayProperties properties;

    public StreamContext create(QueryRequest request, String credential) {
        validate(request);

        String requestedId = request.getSessionId();
        String model = hasText(request.getModel()) ? request.getModel() : null;
        String sessionId;
        String parentSessionId = null;

        if (request.isForkSession()) {
            SessionRecord parent = recordService.get(requireSessionId(requestedId), credential);
            parentSessionId = parent.getId();
            sessionId = UUID.randomUUID().toString();
            model = model != null ? model : parent.getModel();
        } else if (request.isResume()) {
            SessionRecord existing = recordService.get(requireSessionId(requestedId), credential);
            sessionId = existing.getId();
            model = model != null ? model : existing.getModel();
        } else if (requestedId != null) {
            sessionId = requestedId;
            if (recordService.exists(sessionId)) {
                model = model != null ? model : recordService.get(sessionId, credential).getModel();
            }
        } else {
            sessionId = UUID.randomUUID().toString();
        }

        return StreamContext.builder()
                .sessionId(sessionId)
                .model(model != null ? model : properties.getDefaultModel())
                .parentSessionId(parentSessionId)
                .ownerCredential(credential)
                .startNanos(System.nanoTime())
                .includePartialMessages(request.isIncludePartialMessages())
                .enableFileCheckpointing(request.isEnableFileCheckpointing())
                .build();
    }

    public InitManifest manifest(QueryRequest request) {
        List<Map<String, Object>> mcpServers = request.getMcpServers() == null
                ? List.of()
                : request.getMcpServers().stream()
                        .map(QueryContextFactory::mcpServerEntry)
                        .toList();
        return new InitManifest(request.getAllowedTools(), request.getPlugins(), runtime.describeCommands(),
                mcpServers, request.getPermissionMode());
    }

    private static Map<String, Object> mcpServerEntry(String name) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        return entry;
    }

    private static void validate(QueryRequest request) {
        if (request == null || !hasText(request.getPrompt())) {
            throw new IllegalArgumentException("prompt is required");
        }
        if (request.getMaxTurns() != null && request.getMaxTurns() < 1) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        if (request.getSessionId() != null && !SESSION_ID_PATTERN.matcher(request.getSessionId()).matches()) {
            throw new IllegalArgumentException("sessionId is invalid");
        }
        if (request.isResume() && request.isForkSession()) {
            throw new IllegalArgumentException("resume and forkSession are mutually exclusive");
        }
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId is required to resume or fork");
        }
        return sessionId;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
