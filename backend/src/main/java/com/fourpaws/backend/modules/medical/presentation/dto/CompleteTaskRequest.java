package com.fourpaws.backend.modules.medical.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.medical.application.MedicalTaskService.CompletionCommand;

public record CompleteTaskRequest(
        LocalDate completedOn,
        String notes,
        Boolean scheduleFollowUp,
        Long expectedVersion
) {

    public CompletionCommand toCommand() {
        return new CompletionCommand(completedOn, notes, scheduleFollowUp == null || scheduleFollowUp, expectedVersion);
    }
}
