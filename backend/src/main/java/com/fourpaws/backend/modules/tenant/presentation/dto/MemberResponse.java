package com.fourpaws.backend.modules.tenant.presentation.dto;

import java.util.UUID;

import com.fourpaws.backend.modules.tenant.domain.Membership;

public record MemberResponse(
        UUID membershipId,
        UUID userId,
        String email,
        String fullName,
        String role
) {

    public static MemberResponse from(Membership membership) {
        return new MemberResponse(
                membership.getId(),
                membership.getUser().getId(),
                membership.getUser().getEmail(),
                membership.getUser().getFullName(),
                membership.getRole().name()
        );
    }
}
