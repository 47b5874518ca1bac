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

import java.time.Instant;

/**
 * Shared state of one conversation session, stored as JSON in the shared
 * cache under {@code session:{id}}.
 *
 * <p>
 * {@code ownerHash} is the SHA-256 hex of the creating caller's credential; a
 * record without it is public.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String id;
    private String model;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    private int totalTurns;
    private double totalCostUsd;
    private String parentSessionId;
    private String ownerHash;
    private Instant createdAt;
    private Instant updatedAt;
}
