package com.fourpaws.backend.modules.medical.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record BatchCompleteRequest(
        @NotEmpty(message = "TASK_IDS_REQUIRED")
        @Size(max = 200, message = "TOO_MANY_TASKS")
        List<UUID> taskIds
) {
}
