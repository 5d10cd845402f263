package com.fourpaws.backend.modules.tenant.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateOrganizationRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 255, message = "NAME_TOO_LONG")
        String name,
        @NotBlank(message = "SLUG_REQUIRED")
        @Pattern(regexp = "[a-zA-Z0-9][a-zA-Z0-9\\-]{1,99}", message = "SLUG_INVALID")
        String slug,
        Map<String, Object> settings
) {
}
