package me.golemcore.gateway.domain.stream;

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

import me.golemcore.gateway.domain.model.DoneReason;
import me.golemcore.gateway.domain.model.InitManifest;
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.model.StreamEventKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the structural events that frame every query stream.
 *
 * <p>
 * A stream is always {@code init}, any number of content or {@code error}
 * events, then {@code result} and finally {@code done}. Builders are pure and
 * copy what they read from the context.
 */
@Component
public class StreamOrchestrator {

    public static final String AGENT_ERROR = "AGENT_ERROR";
    public static final String INIT_INVALID = "INIT_INVALID";
    public static final String SESSION_ERROR = "SESSION_ERROR";

    public StreamEvent buildInit(StreamContext ctx, InitManifest manifest) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", ctx.getSessionId());
        payload.put("model", ctx.getModel());
        payload.put("tools", manifest.tools());
        payload.put("mcp_servers", manifest.mcpServers());
        payload.put("plugins", manifest.plugins());
        payload.put("commands", manifest.commands());
        payload.put("permission_mode", manifest.permissionMode());
        return StreamEvent.of(StreamEventKind.INIT, payload);
    }

    public StreamEvent buildResult(StreamContext ctx, long durationMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", ctx.getSessionId());
        payload.put("is_error", ctx.isError());
        payload.put("duration_ms", durationMs);
        payload.put("num_turns", ctx.getNumTurns());
        payload.put("total_cost_usd", ctx.getTotalCostUsd());
        payload.put("usage", copy(ctx.getUsage()));
        payload.put("model_usage", copy(ctx.getModelUsage()));
        payload.put("result", ctx.getResultText());
        payload.put("structured_output", copy(ctx.getStructuredOutput()));
        payload.put("files_modified", List.copyOf(ctx.getModifiedFiles()));
        // user message the modified files can be rewound to
        payload.put("checkpoint_uuid", ctx.getLastUserMessageUuid());
        return StreamEvent.of(StreamEventKind.RESULT, payload);
    }

    public StreamEvent buildDone(DoneReason reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.wireName());
        return StreamEvent.of(StreamEventKind.DONE, payload);
    }

    /**
     * Error event for the client. {@code message} must already be sanitized.
     */
    public StreamEvent buildError(String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message);
        return StreamEvent.of(StreamEventKind.ERROR, payload);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? null : new LinkedHashMap<>(source);
    }
}
