package com.fourpaws.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the user resolved from the bearer token. Controllers pass the id into services as
 * the acting user; services never read the security context themselves.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static UUID getCurrentUserId() {
        return currentPrincipal()
                .map(JwtAuthenticationPrincipal::userId)
                .orElseThrow(() -> new ProblemException(ErrorCode.UNAUTHENTICATED, "No authenticated user"));
    }
}
