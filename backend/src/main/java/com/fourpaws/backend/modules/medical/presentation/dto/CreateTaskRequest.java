package com.fourpaws.backend.modules.medical.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.application.MedicalTaskService.TaskCommand;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateTaskRequest(
        @NotNull(message = "ANIMAL_REQUIRED")
        UUID animalId,
        @NotNull(message = "TYPE_REQUIRED")
        MedicalTaskType type,
        @Size(max = 200) String title,
        @NotNull(message = "DUE_DATE_REQUIRED")
        LocalDate dueDate,
        UUID assignedTo,
        String notes
) {

    public TaskCommand toCommand() {
        return new TaskCommand(animalId, type, title, dueDate, assignedTo, notes);
    }
}
