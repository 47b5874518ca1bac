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

import java.util.List;
import java.util.Map;

/**
 * Static description of a query's capabilities, announced in the
 * {@code init} event.
 */
public record InitManifest(
        List<String> tools,
        List<String> plugins,
        List<Map<String, Object>> commands,
        List<Map<String, Object>> mcpServers,
        String permissionMode) {

    public InitManifest {
        tools = tools == null ? List.of() : List.copyOf(tools);
        plugins = plugins == null ? List.of() : List.copyOf(plugins);
        commands = commands == null ? List.of() : List.copyOf(commands);
        mcpServers = mcpServers == null ? List.of() : List.copyOf(mcpServers);
    }
}
