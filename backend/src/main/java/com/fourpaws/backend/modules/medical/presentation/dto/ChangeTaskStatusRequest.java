package com.fourpaws.backend.modules.medical.presentation.dto;

import com.fourpaws.backend.modules.medical.domain.MedicalTaskStatus;

import jakarta.validation.constraints.NotNull;

public record ChangeTaskStatusRequest(
        @NotNull(message = "STATUS_REQUIRED")
        MedicalTaskStatus status,
        Long expectedVersion
) {
}
