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

import me.golemcore.gateway.domain.model.QueryResponse;
import me.golemcore.gateway.domain.model.StreamEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a query's event sequence into one {@link QueryResponse}.
 *
 * <p>
 * Assistant message content is concatenated and integer usage counters are
 * summed per field. An {@code error} event replaces everything collected so far
 * with a single error text block and later content is ignored. Not
 * thread-safe; one instance per query.
 */
public class SingleQueryAggregator {

    private String sessionId;
    private String model;
    private final List<Map<String, Object>> content = new ArrayList<>();
    private Map<String, Long> usage;
    private boolean errorSeen;
    private boolean resultError;
    private long durationMs;
    private int numTurns;
    private Double totalCostUsd;
    private String result;
    private Map<String, Object> structuredOutput;

    public static QueryResponse aggregate(Iterable<StreamEvent> events) {
        SingleQueryAggregator aggregator = new SingleQueryAggregator();
        for (StreamEvent event : events) {
            aggregator.accept(event);
        }
        return aggregator.toResponse();
    }

    public void accept(StreamEvent event) {
        switch (event.kind()) {
        case INIT -> {
            sessionId = asString(event.get("session_id"));
            model = asString(event.get("model"));
        }
        case MESSAGE -> acceptMessage(event);
        case ERROR -> {
            errorSeen = true;
            content.clear();
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("type", "text");
            block.put("text", "Error: " + asString(event.get("message")));
            content.add(block);
        }
        case RESULT -> acceptResult(event);
        default -> {
            // partial, question and done carry nothing for the composite response
        }
        }
    }

    public QueryResponse toResponse() {
        return QueryResponse.builder()
                .sessionId(sessionId)
                .model(model)
                .content(List.copyOf(content))
                .error(errorSeen || resultError)
                .durationMs(durationMs)
                .numTurns(numTurns)
                .totalCostUsd(totalCostUsd)
                .usage(usage)
                .result(result)
                .structuredOutput(structuredOutput)
                .build();
    }

    @SuppressWarnings("unchecked")
    private void acceptMessage(StreamEvent event) {
        if (errorSeen || !"assistant".equals(event.get("type"))) {
            return;
        }
        if (event.get("content") instanceof List<?> blocks) {
            for (Object block : blocks) {
                if (block instanceof Map<?, ?> map) {
                    content.add((Map<String, Object>) map);
                }
            }
        }
        if (event.get("usage") instanceof Map<?, ?> messageUsage) {
            mergeUsage(messageUsage);
        }
    }

    private void mergeUsage(Map<?, ?> messageUsage) {
        if (usage == null) {
            usage = new LinkedHashMap<>();
        }
        for (Map.Entry<?, ?> entry : messageUsage.entrySet()) {
            if (isInteger(entry.getValue())) {
                long value = ((Number) entry.getValue()).longValue();
                usage.merge(String.valueOf(entry.getKey()), value, Long::sum);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void acceptResult(StreamEvent event) {
        resultError = Boolean.TRUE.equals(event.get("is_error"));
        if (event.get("duration_ms") instanceof Number duration) {
            durationMs = duration.longValue();
        }
        if (event.get("num_turns") instanceof Number turns) {
            numTurns = turns.intValue();
        }
        totalCostUsd = event.get("total_cost_usd") instanceof Number cost ? cost.doubleValue() : null;
        result = asString(event.get("result"));
        structuredOutput = event.get("structured_output") instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : null;
    }

    private static boolean isInteger(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
