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

import lombok.Builder;
import lombok.Data;

/**
 * Partial update applied to a {@link SessionRecord}. Absolute values win over
 * increments when both are given.
 */
@Data
@Builder
public class SessionUpdate {

    private SessionStatus status;
    private Integer totalTurns;
    private int turnsIncrement;
    private Double totalCostUsd;
    private Double costIncrement;

    public static SessionUpdate incrementTurns(int turns) {
        return SessionUpdate.builder().turnsIncrement(turns).build();
    }

    public void applyTo(SessionRecord sessionRecord) {
        if (status != null) {
            sessionRecord.setStatus(status);
        }
        if (totalTurns != null) {
            sessionRecord.setTotalTurns(totalTurns);
        } else if (turnsIncrement != 0) {
            sessionRecord.setTotalTurns(sessionRecord.getTotalTurns() + turnsIncrement);
        }
        if (totalCostUsd != null) {
            sessionRecord.setTotalCostUsd(totalCostUsd);
        } else if (costIncrement != null) {
            sessionRecord.setTotalCostUsd(sessionRecord.getTotalCostUsd() + costIncrement);
        }
    }
}
