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

import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Port for the agent runtime that actually executes a query.
 *
 * <p>
 * The gateway consumes the returned flux pull-based, one message at a time.
 * Cancelling the subscription must release runtime resources.
 */
public interface AgentRuntimePort {

    /**
     * Start executing the query bound to {@code sessionId}.
     */
    Flux<RuntimeMessage> execute(QueryRequest request, String sessionId);

    /**
     * Ask a running execution to stop. Best-effort.
     *
     * @return true if an execution for the session was signalled
     */
    boolean stop(String sessionId);

    /**
     * Slash commands the runtime supports, announced in the init event.
     */
    default List<Map<String, Object>> describeCommands() {
        return List.of();
    }
}
