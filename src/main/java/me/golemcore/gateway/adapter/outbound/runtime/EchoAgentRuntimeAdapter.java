package me.golemcore.gateway.adapter.outbound.runtime;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import me.golemcore.gateway.domain.model.RuntimeMessageType;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Development runtime that answers every query with its own prompt.
 *
 * <p>
 * Emits the same message sequence a real runtime does (system init, one
 * assistant message, result) so the gateway can be exercised end to end
 * without an agent backend. Selected with {@code gateway.runtime.type=echo}
 * (the default).
 */
@Component
@ConditionalOnProperty(prefix = "gateway.runtime", name = "type", havingValue = "echo", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EchoAgentRuntimeAdapter implements AgentRuntimePort {

    private final ObjectMapper objectMapper;
    private final Map<String, Sinks.Empty<Void>> running = new ConcurrentHashMap<>();

    @Override
    public Flux<RuntimeMessage> execute(QueryRequest request, String sessionId) {
        Sinks.Empty<Void> stopSignal = Sinks.empty();
        running.put(sessionId, stopSignal);
        String model = request.getModel() != null ? request.getModel() : "echo";
        int tokens = request.getPrompt().split("\\s+").length;

        return Flux.just(init(), assistant(request.getPrompt(), model, tokens),
                result(request.getPrompt(), tokens))
                .takeUntilOther(stopSignal.asMono())
                .doFinally(signal -> running.remove(sessionId, stopSignal));
    }

    @Override
    public boolean stop(String sessionId) {
        Sinks.Empty<Void> stopSignal = running.remove(sessionId);
        if (stopSignal == null) {
            return false;
        }
        stopSignal.tryEmitEmpty();
        log.debug("[Echo] Stopped session {}", sessionId);
        return true;
    }

    @Override
    public List<Map<String, Object>> describeCommands() {
        return List.of(Map.of("name", "/echo", "description", "Repeat the prompt"));
    }

    private RuntimeMessage init() {
        ObjectNode data = objectMapper.createObjectNode();
        data.putArray("mcp_servers");
        return new RuntimeMessage(RuntimeMessageType.SYSTEM, "init", data);
    }

    private RuntimeMessage assistant(String prompt, String model, int tokens) {
        ObjectNode data = objectMapper.createObjectNode();
        ArrayNode content = data.putArray("content");
        content.addObject().put("type", "text").put("text", prompt);
        data.put("model", model);
        data.set("usage", usage(tokens));
        return RuntimeMessage.of(RuntimeMessageType.ASSISTANT, data);
    }

    private RuntimeMessage result(String prompt, int tokens) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("is_error", false);
        data.put("num_turns", 1);
        data.put("total_cost_usd", 0.0);
        data.put("result", prompt);
        data.set("usage", usage(tokens));
        return RuntimeMessage.of(RuntimeMessageType.RESULT, data);
    }

    private ObjectNode usage(int tokens) {
        ObjectNode usage = objectMapper.createObjectNode();
        usage.put("input_tokens", tokens);
        usage.put("output_tokens", tokens);
        return usage;
    }
}
