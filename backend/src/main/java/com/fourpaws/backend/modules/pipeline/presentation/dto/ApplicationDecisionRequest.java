package com.fourpaws.backend.modules.pipeline.presentation.dto;

import jakarta.validation.constraints.Size;

public record ApplicationDecisionRequest(
        @Size(max = 4000, message = "NOTES_TOO_LONG")
        String notes,
        Long expectedVersion
) {
}
