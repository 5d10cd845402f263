package com.fourpaws.backend.global.security;

import java.util.UUID;

/**
 * Authenticated caller. Carries identity only: roles are resolved per organization from the
 * membership table on every request.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email) {
}
