package com.fourpaws.backend.modules.tenant.presentation.dto;

import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AddMemberRequest(
        @NotBlank(message = "EMAIL_REQUIRED")
        @Email(message = "EMAIL_INVALID")
        String email,
        @NotNull(message = "ROLE_REQUIRED")
        MembershipRole role
) {
}
