package me.golemcore.gateway.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Role-tagged message produced by the agent runtime.
 *
 * <p>
 * {@code data} layout by type:
 * <ul>
 * <li>SYSTEM - subtype {@code init}: runtime manifest object
 * <li>USER - {@code content}, {@code uuid}
 * <li>ASSISTANT - {@code content} blocks, {@code model}, {@code usage}
 * <li>RESULT - {@code is_error}, {@code num_turns}, {@code total_cost_usd},
 * {@code result}, {@code usage}, {@code model_usage},
 * {@code structured_output}
 * <li>STREAM_EVENT - {@code event} with a content block start/delta/stop
 * </ul>
 */
public record RuntimeMessage(RuntimeMessageType type, String subtype, JsonNode data) {

    public static RuntimeMessage of(RuntimeMessageType type, JsonNode data) {
        return new RuntimeMessage(type, null, data);
    }

    public boolean isInit() {
        return type == RuntimeMessageType.SYSTEM && "init".equals(subtype);
    }
}
