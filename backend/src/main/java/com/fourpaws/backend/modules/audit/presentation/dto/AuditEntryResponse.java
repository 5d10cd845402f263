package com.fourpaws.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.audit.domain.AuditLog;

public record AuditEntryResponse(
        UUID id,
        String action,
        String entityType,
        UUID entityId,
        UUID actorUserId,
        Map<String, Object> dataSnapshot,
        OffsetDateTime createdAt
) {

    public static AuditEntryResponse from(AuditLog entry) {
        return new AuditEntryResponse(
                entry.getId(),
                entry.getAction(),
                entry.getEntityType(),
                entry.getEntityId(),
                entry.getActor() != null ? entry.getActor().getId() : null,
                entry.getDataSnapshot(),
                entry.getCreatedAt()
        );
    }
}
