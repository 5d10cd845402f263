package com.fourpaws.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.UUID;

import com.fourpaws.backend.global.security.JwtSigningKeyProvider;
import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.domain.ShelterUser;
import com.fourpaws.backend.modules.tenant.domain.UserStatus;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.MembershipRepository;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.ShelterUserRepository;

import io.jsonwebtoken.Jwts;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates users and memberships directly and signs access tokens the way the external auth
 * service does.
 */
@Component
@Transactional
public class TestUserFactory {

    private final ShelterUserRepository shelterUserRepository;
    private final MembershipRepository membershipRepository;
    private final JwtSigningKeyProvider keyProvider;
    private final Clock clock;

    public TestUserFactory(
            ShelterUserRepository shelterUserRepository,
            MembershipRepository membershipRepository,
            JwtSigningKeyProvider keyProvider,
            Clock clock
    ) {
        this.shelterUserRepository = shelterUserRepository;
        this.membershipRepository = membershipRepository;
        this.keyProvider = keyProvider;
        this.clock = clock;
    }

    public ShelterUser createUser(String label) {
        ShelterUser user = new ShelterUser();
        user.setEmail(label + "-" + UUID.randomUUID() + "@example.org");
        user.setFullName(label);
        user.setStatus(UserStatus.ACTIVE);
        return shelterUserRepository.save(user);
    }

    public void grant(ShelterUser user, UUID organizationId, MembershipRole role) {
        Membership membership = new Membership();
        membership.setOrganizationId(organizationId);
        membership.setUser(user);
        membership.setRole(role);
        membershipRepository.save(membership);
    }

    public String bearer(ShelterUser user) {
        Date issuedAt = Date.from(clock.instant());
        String token = Jwts.builder()
                .subject(user.getId().toString())
                .claim("email", user.getEmail())
                .issuedAt(issuedAt)
                .expiration(Date.from(clock.instant().plus(Duration.ofHours(1))))
                .signWith(keyProvider.getSecretKey())
                .compact();
        return "Bearer " + token;
    }
}
