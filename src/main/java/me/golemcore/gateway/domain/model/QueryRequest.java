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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single agent query as submitted by a client.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String prompt;
    private String sessionId;
    private String model;

    @Builder.Default
    private List<String> allowedTools = new ArrayList<>();

    @Builder.Default
    private List<String> disallowedTools = new ArrayList<>();

    @Builder.Default
    private List<String> plugins = new ArrayList<>();

    @Builder.Default
    private List<String> mcpServers = new ArrayList<>();

    private String permissionMode;
    private Integer maxTurns;
    private boolean includePartialMessages;
    private boolean enableFileCheckpointing;

    /**
     * Continue the existing session {@link #sessionId}.
     */
    private boolean resume;

    /**
     * Start a new session branched from {@link #sessionId}.
     */
    private boolean forkSession;
}
