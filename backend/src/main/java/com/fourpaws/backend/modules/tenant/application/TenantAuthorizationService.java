package com.fourpaws.backend.modules.tenant.application;

import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.tenant.domain.AuthorizationDecision;
import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.MembershipRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves what a user may do inside one organization. The role always comes from the
 * membership row; nothing the client sends can raise it.
 */
@Service
@Transactional(readOnly = true)
public class TenantAuthorizationService {

    private final MembershipRepository membershipRepository;

    public TenantAuthorizationService(MembershipRepository membershipRepository) {
        this.membershipRepository = membershipRepository;
    }

    /**
     * @throws ProblemException {@code NOT_A_MEMBER} when the user has no membership in the organization
     */
    public AuthorizationDecision authorize(UUID userId, UUID organizationId, MembershipRole requiredRole) {
        Membership membership = loadMembership(userId, organizationId);
        if (!membership.getUser().isActive()) {
            return AuthorizationDecision.DENIED;
        }
        return membership.getRole().satisfies(requiredRole)
                ? AuthorizationDecision.ALLOWED
                : AuthorizationDecision.DENIED;
    }

    public Membership requireRole(UUID userId, UUID organizationId, MembershipRole requiredRole) {
        Membership membership = loadMembership(userId, organizationId);
        if (!membership.getUser().isActive() || !membership.getRole().satisfies(requiredRole)) {
            throw new ProblemException(ErrorCode.PERMISSION_DENIED, requiredRole.name() + " role required");
        }
        return membership;
    }

    public boolean isMember(UUID userId, UUID organizationId) {
        return userId != null && membershipRepository.findByUserAndOrganization(userId, organizationId).isPresent();
    }

    private Membership loadMembership(UUID userId, UUID organizationId) {
        if (userId == null || organizationId == null) {
            throw new ProblemException(ErrorCode.NOT_A_MEMBER);
        }
        return membershipRepository.findByUserAndOrganization(userId, organizationId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_A_MEMBER));
    }
}
