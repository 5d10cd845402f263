package com.fourpaws.backend.modules.tenant.infrastructure.persistence;

import java.util.UUID;

import com.fourpaws.backend.modules.tenant.domain.Organization;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

    boolean existsBySlugIgnoreCase(String slug);
}
