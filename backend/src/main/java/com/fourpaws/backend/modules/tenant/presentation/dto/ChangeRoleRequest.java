package com.fourpaws.backend.modules.tenant.presentation.dto;

import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import jakarta.validation.constraints.NotNull;

public record ChangeRoleRequest(
        @NotNull(message = "ROLE_REQUIRED")
        MembershipRole role
) {
}
