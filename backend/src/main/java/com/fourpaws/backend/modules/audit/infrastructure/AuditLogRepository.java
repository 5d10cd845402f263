package com.fourpaws.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByOrganizationIdOrderByCreatedAtDesc(UUID organizationId, Pageable pageable);

    List<AuditLog> findByOrganizationIdAndEntityTypeOrderByCreatedAtDesc(
            UUID organizationId,
            String entityType,
            Pageable pageable
    );

    List<AuditLog> findByOrganizationIdAndEntityIdOrderByCreatedAtDesc(
            UUID organizationId,
            UUID entityId,
            Pageable pageable
    );

    List<AuditLog> findByOrganizationIdAndEntityIdOrderByCreatedAtAsc(UUID organizationId, UUID entityId);
}
