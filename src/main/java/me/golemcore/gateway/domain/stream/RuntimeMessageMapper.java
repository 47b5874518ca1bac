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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.MalformedRuntimeMessageException;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.model.StreamEventKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps agent runtime messages to stream events and keeps the
 * {@link StreamContext} bookkeeping current.
 *
 * <p>
 * System and result messages update the context without producing an event.
 * Partial content-block events are only forwarded when the query asked for
 * them. An {@code AskUserQuestion} tool call becomes a {@code question} event
 * instead of a regular message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuntimeMessageMapper {

    private static final String ERR_RUNTIME_MESSAGE_MALFORMED = "ERR_RUNTIME_MESSAGE_MALFORMED";
    private static final Set<String> BLOCK_TYPES = Set.of("text", "thinking", "tool_use", "tool_result");
    private static final Set<String> DELTA_TYPES = Set.of("text_delta", "thinking_delta", "input_json_delta");
    private static final Set<String> FILE_TOOLS = Set.of("Write", "Edit");
    private static final String ASK_USER_QUESTION = "AskUserQuestion";
    private static final String TYPE = "type";
    private static final String TEXT = "text";
    private static final String INDEX = "index";
    private static final String CONTENT = "content";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Map one message.
     *
     * @return the event to emit, or empty when the message only updates the
     *         context
     * @throws MalformedRuntimeMessageException
     *             if the message cannot be interpreted
     */
    public Optional<StreamEvent> map(RuntimeMessage message, StreamContext ctx) {
        if (message == null || message.type() == null) {
            throw new MalformedRuntimeMessageException("Runtime message without type", false,
                    String.valueOf(message));
        }
        return switch (message.type()) {
        case SYSTEM -> handleSystem(message, ctx);
        case USER -> Optional.of(handleUser(requireObject(message), ctx));
        case ASSISTANT -> Optional.of(handleAssistant(requireObject(message), ctx));
        case RESULT -> {
            handleResult(requireObject(message), ctx);
            yield Optional.empty();
        }
        case STREAM_EVENT -> ctx.isIncludePartialMessages()
                ? handlePartial(requireObject(message))
                : Optional.empty();
        };
    }

    /**
     * Like {@link #map} but logs and skips malformed messages. A malformed
     * init message is still thrown because the query cannot continue without
     * it.
     */
    public Optional<StreamEvent> mapOrSkip(RuntimeMessage message, StreamContext ctx) {
        try {
            return map(message, ctx);
        } catch (MalformedRuntimeMessageException e) {
            if (e.isInitMessage()) {
                throw e;
            }
            log.warn("[Stream] Skipping malformed runtime message for session {} errorId={}: {} excerpt={}",
                    ctx.getSessionId(), ERR_RUNTIME_MESSAGE_MALFORMED, e.getMessage(), e.getExcerpt());
            return Optional.empty();
        }
    }

    private Optional<StreamEvent> handleSystem(RuntimeMessage message, StreamContext ctx) {
        if (!message.isInit()) {
            return Optional.empty();
        }
        JsonNode data = message.data();
        if (data == null || !data.isObject()) {
            throw new MalformedRuntimeMessageException("Runtime init data is not an object", true,
                    String.valueOf(data));
        }
        JsonNode mcpServers = data.path("mcp_servers");
        int serverCount = mcpServers.isArray() ? mcpServers.size() : 0;
        if (!mcpServers.isMissingNode() && !mcpServers.isArray()) {
            log.warn("[Stream] Runtime init for session {} has non-list mcp_servers", ctx.getSessionId());
        }
        log.info("[Stream] Runtime initialized for session {} with {} MCP server(s)", ctx.getSessionId(),
                serverCount);
        return Optional.empty();
    }

    private StreamEvent handleUser(JsonNode data, StreamContext ctx) {
        List<Map<String, Object>> content = extractContentBlocks(data);
        String uuid = textOrNull(data, "uuid");
        if (ctx.isEnableFileCheckpointing() && uuid != null) {
            ctx.setLastUserMessageUuid(uuid);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, "user");
        payload.put(CONTENT, content);
        payload.put("uuid", uuid);
        return StreamEvent.of(StreamEventKind.MESSAGE, payload);
    }

    private StreamEvent handleAssistant(JsonNode data, StreamContext ctx) {
        List<Map<String, Object>> content = extractContentBlocks(data);
        if (ctx.isEnableFileCheckpointing()) {
            trackFileModifications(content, ctx);
        }

        Optional<StreamEvent> question = findQuestion(content, ctx);
        if (question.isPresent()) {
            return question.get();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, "assistant");
        payload.put(CONTENT, content);
        String model = textOrNull(data, "model");
        payload.put("model", model != null ? model : ctx.getModel());
        payload.put("usage", objectOrNull(data, "usage"));
        return StreamEvent.of(StreamEventKind.MESSAGE, payload);
    }

    private void handleResult(JsonNode data, StreamContext ctx) {
        if (data.path("is_error").asBoolean(false)) {
            ctx.setError(true);
        }
        if (data.path("num_turns").isNumber()) {
            ctx.setNumTurns(data.get("num_turns").asInt());
        }
        if (data.path("total_cost_usd").isNumber()) {
            ctx.setTotalCostUsd(data.get("total_cost_usd").asDouble());
        }
        ctx.setResultText(textOrNull(data, "result"));

        Map<String, Object> usage = objectOrNull(data, "usage");
        if (usage != null) {
            ctx.setUsage(usage);
        }

        JsonNode modelUsage = data.path("model_usage");
        if (modelUsage.isObject()) {
            ctx.setModelUsage(objectMapper.convertValue(modelUsage, MAP_TYPE));
        } else if (!modelUsage.isMissingNode() && !modelUsage.isNull()) {
            log.warn("[Stream] model_usage is not an object for session {}", ctx.getSessionId());
        }

        JsonNode structured = data.path("structured_output");
        if (structured.isObject()) {
            ctx.setStructuredOutput(objectMapper.convertValue(structured, MAP_TYPE));
        } else if (!structured.isMissingNode() && !structured.isNull()) {
            log.warn("[Stream] structured_output is not an object for session {}", ctx.getSessionId());
            ctx.setError(true);
        }
    }

    private Optional<StreamEvent> handlePartial(JsonNode data) {
        JsonNode event = data.path("event");
        if (!event.isObject()) {
            return Optional.empty();
        }
        String type = event.path(TYPE).asText("");
        int index = event.path(INDEX).isInt() ? event.get(INDEX).asInt() : 0;

        Map<String, Object> payload = new LinkedHashMap<>();
        switch (type) {
        case "content_block_start" -> {
            payload.put(TYPE, type);
            payload.put(INDEX, index);
            payload.put("content_block", partialBlock(event.path("content_block")));
        }
        case "content_block_delta" -> {
            payload.put(TYPE, type);
            payload.put(INDEX, index);
            payload.put("delta", partialDelta(event.path("delta")));
        }
        case "content_block_stop" -> {
            payload.put(TYPE, type);
            payload.put(INDEX, index);
        }
        default -> {
            return Optional.empty();
        }
        }
        return Optional.of(StreamEvent.of(StreamEventKind.PARTIAL, payload));
    }

    private Map<String, Object> partialBlock(JsonNode block) {
        if (!block.isObject()) {
            return null;
        }
        Map<String, Object> mapped = new LinkedHashMap<>();
        mapped.put(TYPE, normalizeBlockType(block.path(TYPE).asText(null)));
        mapped.put(TEXT, textOrNull(block, TEXT));
        mapped.put("id", textOrNull(block, "id"));
        mapped.put("name", textOrNull(block, "name"));
        return mapped;
    }

    private Map<String, Object> partialDelta(JsonNode delta) {
        if (!delta.isObject()) {
            return null;
        }
        String type = delta.path(TYPE).asText("");
        if (!DELTA_TYPES.contains(type)) {
            type = "text_delta";
        }
        Map<String, Object> mapped = new LinkedHashMap<>();
        mapped.put(TYPE, type);
        mapped.put(TEXT, "text_delta".equals(type) ? textOrNull(delta, TEXT) : null);
        mapped.put("thinking", "thinking_delta".equals(type) ? textOrNull(delta, "thinking") : null);
        mapped.put("partial_json", "input_json_delta".equals(type) ? textOrNull(delta, "partial_json") : null);
        return mapped;
    }

    private List<Map<String, Object>> extractContentBlocks(JsonNode data) {
        JsonNode content = data.path(CONTENT);
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (content.isMissingNode() || content.isNull()) {
            return blocks;
        }
        if (content.isTextual()) {
            blocks.add(textBlock(content.asText()));
            return blocks;
        }
        if (!content.isArray()) {
            throw new MalformedRuntimeMessageException("Message content is neither text nor a list", false,
                    data.toString());
        }
        for (JsonNode block : content) {
            if (block.isObject()) {
                Map<String, Object> mapped = objectMapper.convertValue(block, MAP_TYPE);
                mapped.put(TYPE, normalizeBlockType(block.path(TYPE).asText(null)));
                blocks.add(mapped);
            } else if (block.isTextual()) {
                blocks.add(textBlock(block.asText()));
            }
        }
        return blocks;
    }

    private Optional<StreamEvent> findQuestion(List<Map<String, Object>> content, StreamContext ctx) {
        for (Map<String, Object> block : content) {
            if (!isToolUse(block)) {
                continue;
            }
            Object name = block.get("name");
            if (ASK_USER_QUESTION.equals(name)) {
                Object question = input(block).get("question");
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("tool_use_id", block.get("id") != null ? block.get("id").toString() : "");
                payload.put("question", question != null ? question.toString() : "");
                payload.put("session_id", ctx.getSessionId());
                return Optional.of(StreamEvent.of(StreamEventKind.QUESTION, payload));
            }
            if ("TodoWrite".equals(name) && input(block).get("todos") instanceof List<?> todos) {
                log.info("[Stream] TodoWrite in session {} with {} item(s)", ctx.getSessionId(), todos.size());
            }
        }
        return Optional.empty();
    }

    private void trackFileModifications(List<Map<String, Object>> content, StreamContext ctx) {
        for (Map<String, Object> block : content) {
            if (!isToolUse(block) || !FILE_TOOLS.contains(String.valueOf(block.get("name")))) {
                continue;
            }
            if (input(block).get("file_path") instanceof String filePath && !filePath.isBlank()
                    && !ctx.getModifiedFiles().contains(filePath)) {
                ctx.getModifiedFiles().add(filePath);
                log.debug("[Stream] Tracked file modification {} in session {}", filePath, ctx.getSessionId());
            }
        }
    }

    private static boolean isToolUse(Map<String, Object> block) {
        return "tool_use".equals(block.get(TYPE));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> input(Map<String, Object> block) {
        Object input = block.get("input");
        return input instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Map<String, Object> textBlock(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put(TYPE, TEXT);
        block.put(TEXT, text);
        return block;
    }

    private static String normalizeBlockType(String type) {
        return type != null && BLOCK_TYPES.contains(type) ? type : TEXT;
    }

    private Map<String, Object> objectOrNull(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.isObject() ? objectMapper.convertValue(node, MAP_TYPE) : null;
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.isTextual() ? node.asText() : null;
    }

    private static JsonNode requireObject(RuntimeMessage message) {
        JsonNode data = message.data();
        if (data == null || !data.isObject()) {
            throw new MalformedRuntimeMessageException(
                    "Runtime " + message.type().name().toLowerCase(Locale.ROOT)
                            + " message data is not an object",
                    false, String.valueOf(data));
        }
        return data;
    }
}
