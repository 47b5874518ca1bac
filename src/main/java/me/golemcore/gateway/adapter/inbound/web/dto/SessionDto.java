package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.domain.model.SessionStatus;

import java.time.Instant;

/**
 * Public view of a session record. The owner hash is never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDto {

    private String id;
    private String model;
    private SessionStatus status;
    private int totalTurns;
    private double totalCostUsd;
    private String parentSessionId;
    private Instant createdAt;
    private Instant updatedAt;

    public static SessionDto from(SessionRecord sessionRecord) {
        return SessionDto.builder()
                .id(sessionRecord.getId())
                .model(sessionRecord.getModel())
                .status(sessionRecord.getStatus())
                .totalTurns(sessionRecord.getTotalTurns())
                .totalCostUsd(sessionRecord.getTotalCostUsd())
                .parentSessionId(sessionRecord.getParentSessionId())
                .createdAt(sessionRecord.getCreatedAt())
                .updatedAt(sessionRecord.getUpdatedAt())
                .build();
    }
}
