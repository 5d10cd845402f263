package com.fourpaws.backend.modules.medical.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.medical.application.MedicalTaskService.DirectCareCommand;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DirectCareRequest(
        @NotNull(message = "TYPE_REQUIRED")
        MedicalTaskType type,
        @Size(max = 200) String title,
        LocalDate performedOn,
        String notes
) {

    public DirectCareCommand toCommand() {
        return new DirectCareCommand(type, title, performedOn, notes);
    }
}
