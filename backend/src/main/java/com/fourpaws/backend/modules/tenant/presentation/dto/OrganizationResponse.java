package com.fourpaws.backend.modules.tenant.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.tenant.domain.Organization;

public record OrganizationResponse(
        UUID organizationId,
        String name,
        String slug,
        Map<String, Object> settings,
        OffsetDateTime createdAt
) {

    public static OrganizationResponse from(Organization organization) {
        return new OrganizationResponse(
                organization.getId(),
                organization.getName(),
                organization.getSlug(),
                organization.getSettings(),
                organization.getCreatedAt()
        );
    }
}
