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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable event on a query stream. The payload is a JSON-compatible map and
 * may contain {@code null} values.
 */
public record StreamEvent(StreamEventKind kind, Map<String, Object> payload) {

    public StreamEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static StreamEvent of(StreamEventKind kind, Map<String, Object> payload) {
        return new StreamEvent(kind, payload);
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
