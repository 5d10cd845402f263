package com.fourpaws.backend.modules.tenant.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipRepository extends JpaRepository<Membership, UUID> {

    @Query("select m from Membership m where m.user.id = :userId and m.organizationId = :organizationId")
    Optional<Membership> findByUserAndOrganization(
            @Param("userId") UUID userId,
            @Param("organizationId") UUID organizationId
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Membership m where m.organizationId = :organizationId and m.role = :role")
    List<Membership> findByOrganizationIdAndRoleForUpdate(
            @Param("organizationId") UUID organizationId,
            @Param("role") MembershipRole role
    );

    @Query("""
            select m
              from Membership m
              join fetch m.user u
             where m.organizationId = :organizationId
             order by u.email
            """)
    List<Membership> findByOrganizationIdWithUser(@Param("organizationId") UUID organizationId);
}
