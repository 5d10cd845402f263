package com.fourpaws.backend.modules.tenant.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.domain.Organization;
import com.fourpaws.backend.modules.tenant.domain.ShelterUser;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.MembershipRepository;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.OrganizationRepository;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.ShelterUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);
    private static final String ENTITY_ORGANIZATION = "ORGANIZATION";
    private static final String ENTITY_MEMBERSHIP = "MEMBERSHIP";

    private final OrganizationRepository organizationRepository;
    private final ShelterUserRepository shelterUserRepository;
    private final MembershipRepository membershipRepository;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;

    public OrganizationService(
            OrganizationRepository organizationRepository,
            ShelterUserRepository shelterUserRepository,
            MembershipRepository membershipRepository,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService
    ) {
        this.organizationRepository = organizationRepository;
        this.shelterUserRepository = shelterUserRepository;
        this.membershipRepository = membershipRepository;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
    }

    /**
     * Creates a tenant; the creating user becomes its first ADMIN.
     */
    public Organization createOrganization(UUID actorId, String name, String slug, Map<String, Object> settings) {
        ShelterUser creator = shelterUserRepository.findById(actorId)
                .orElseThrow(() -> ProblemException.unknownEntity("User"));
        String normalizedSlug = slug.trim().toLowerCase();
        if (organizationRepository.existsBySlugIgnoreCase(normalizedSlug)) {
            throw new ProblemException(ErrorCode.DUPLICATE_SLUG, "slug already in use");
        }

        Organization organization = new Organization();
        organization.setName(name.trim());
        organization.setSlug(normalizedSlug);
        if (settings != null) {
            organization.getSettings().putAll(settings);
        }
        Organization saved = organizationRepository.save(organization);

        Membership membership = new Membership();
        membership.setOrganizationId(saved.getId());
        membership.setUser(creator);
        membership.setRole(MembershipRole.ADMIN);
        membershipRepository.save(membership);

        auditLogService.record(AuditLogCommand.created(saved.getId(), actorId, AuditAction.ORGANIZATION_CREATED,
                ENTITY_ORGANIZATION, saved.getId(), AuditSnapshot.of("name", saved.getName(), "slug", saved.getSlug())));
        log.info("Organization {} created by {}", saved.getId(), actorId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Organization getOrganization(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return organizationRepository.findById(organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Organization"));
    }

    public void deleteOrganization(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.ADMIN);
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Organization"));
        // tenant rows, audit log included, are removed by ON DELETE CASCADE
        organizationRepository.delete(organization);
        log.warn("Organization {} deleted by {}", organizationId, actorId);
    }

    @Transactional(readOnly = true)
    public List<Membership> listMembers(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        return membershipRepository.findByOrganizationIdWithUser(organizationId);
    }

    public Membership addMember(UUID organizationId, UUID actorId, String email, MembershipRole role) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.ADMIN);
        ShelterUser user = shelterUserRepository.findByEmailIgnoreCase(email.trim())
                .orElseThrow(() -> ProblemException.unknownEntity("User"));
        if (membershipRepository.findByUserAndOrganization(user.getId(), organizationId).isPresent()) {
            throw new ProblemException(ErrorCode.DUPLICATE_MEMBERSHIP, "user is already a member");
        }

        Membership membership = new Membership();
        membership.setOrganizationId(organizationId);
        membership.setUser(user);
        membership.setRole(role);
        Membership saved = membershipRepository.save(membership);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.MEMBER_ADDED,
                ENTITY_MEMBERSHIP, saved.getId(), AuditSnapshot.of("userId", user.getId(), "role", role)));
        return saved;
    }

    public Membership changeRole(UUID organizationId, UUID actorId, UUID userId, MembershipRole role) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.ADMIN);
        Membership membership = membershipRepository.findByUserAndOrganization(userId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Membership"));
        MembershipRole previous = membership.getRole();
        if (previous == role) {
            return membership;
        }
        if (previous == MembershipRole.ADMIN) {
            ensureAnotherAdmin(organizationId, membership);
        }
        membership.setRole(role);

        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.MEMBER_ROLE_CHANGED,
                ENTITY_MEMBERSHIP, membership.getId(),
                AuditSnapshot.of("role", previous), AuditSnapshot.of("role", role)));
        return membership;
    }

    public void removeMember(UUID organizationId, UUID actorId, UUID userId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.ADMIN);
        Membership membership = membershipRepository.findByUserAndOrganization(userId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Membership"));
        if (membership.getRole() == MembershipRole.ADMIN) {
            ensureAnotherAdmin(organizationId, membership);
        }
        membershipRepository.delete(membership);

        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.MEMBER_REMOVED,
                ENTITY_MEMBERSHIP, membership.getId(),
                AuditSnapshot.of("userId", userId, "role", membership.getRole()), null));
    }

    private void ensureAnotherAdmin(UUID organizationId, Membership leaving) {
        boolean anotherAdmin = membershipRepository
                .findByOrganizationIdAndRoleForUpdate(organizationId, MembershipRole.ADMIN)
                .stream()
                .anyMatch(m -> !m.getId().equals(leaving.getId()));
        if (!anotherAdmin) {
            throw new ProblemException(ErrorCode.LAST_ADMIN, "organization needs at least one admin");
        }
    }
}
