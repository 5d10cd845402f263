package com.fourpaws.backend.modules.tenant.presentation.dto;

public record AuthorizationResponse(String requiredRole, String decision) {
}
