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
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-execution bookkeeping for one query stream. Mutated only by the
 * producer, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamContext {

    private String sessionId;
    private String model;
    private String parentSessionId;
    @ToString.Exclude
    private String ownerCredential;
    private long startNanos;
    private int numTurns;
    private boolean error;
    private Double totalCostUsd;
    private String resultText;
    private Map<String, Object> usage;
    private Map<String, Object> modelUsage;
    private Map<String, Object> structuredOutput;

    @Builder.Default
    private List<String> modifiedFiles = new ArrayList<>();

    private boolean includePartialMessages;
    private boolean enableFileCheckpointing;
    private String lastUserMessageUuid;

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
