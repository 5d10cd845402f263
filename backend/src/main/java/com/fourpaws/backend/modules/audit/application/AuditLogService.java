package com.fourpaws.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.audit.domain.AuditLog;
import com.fourpaws.backend.modules.audit.infrastructure.AuditLogRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.domain.ShelterUser;

import jakarta.persistence.EntityManager;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private static final int MAX_PAGE_SIZE = 200;

    private final AuditLogRepository auditLogRepository;
    private final TenantAuthorizationService authorizationService;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(
            AuditLogRepository auditLogRepository,
            TenantAuthorizationService authorizationService,
            EntityManager entityManager,
            Clock clock
    ) {
        this.auditLogRepository = auditLogRepository;
        this.authorizationService = authorizationService;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    /**
     * Appends inside the caller's transaction, so the entry commits or rolls back together
     * with the mutation it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.organizationId(), "organizationId is required");
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.entityType(), "entityType is required");
        Objects.requireNonNull(command.entityId(), "entityId is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setOrganizationId(command.organizationId());
        auditLog.setAction(command.action().name());
        auditLog.setEntityType(command.entityType());
        auditLog.setEntityId(command.entityId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(ShelterUser.class, command.actorUserId()));
        }

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("before", command.before());
        snapshot.put("after", command.after());
        auditLog.setDataSnapshot(snapshot);

        auditLogRepository.save(auditLog);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> listEntries(UUID organizationId, UUID actorId, String entityType, UUID entityId, int limit) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.ADMIN);
        return search(organizationId, entityType, entityId, limit);
    }

    /**
     * Full history of one entity, oldest first, for reconstructing earlier states.
     */
    @Transactional(readOnly = true)
    public List<AuditLog> history(UUID organizationId, UUID entityId) {
        return auditLogRepository.findByOrganizationIdAndEntityIdOrderByCreatedAtAsc(organizationId, entityId);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> search(UUID organizationId, String entityType, UUID entityId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
        if (entityId != null) {
            return auditLogRepository.findByOrganizationIdAndEntityIdOrderByCreatedAtDesc(organizationId, entityId, page);
        }
        if (entityType != null && !entityType.isBlank()) {
            return auditLogRepository.findByOrganizationIdAndEntityTypeOrderByCreatedAtDesc(
                    organizationId, entityType, page);
        }
        return auditLogRepository.findByOrganizationIdOrderByCreatedAtDesc(organizationId, page);
    }

    public record AuditLogCommand(
            UUID organizationId,
            UUID actorUserId,
            AuditAction action,
            String entityType,
            UUID entityId,
            Map<String, Object> before,
            Map<String, Object> after
    ) {

        public static AuditLogCommand created(UUID organizationId, UUID actorUserId, AuditAction action,
                                              String entityType, UUID entityId, Map<String, Object> after) {
            return new AuditLogCommand(organizationId, actorUserId, action, entityType, entityId, null, after);
        }
    }
}
