package com.fourpaws.backend.modules.animal.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.animal.application.TransitionCommand;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TransitionRequest(
        @NotNull(message = "TARGET_REQUIRED")
        AnimalStatus target,
        LocalDate outcomeDate,
        @Size(max = 255) String destination,
        String notes,
        boolean fosterFailed,
        Long expectedVersion
) {

    public TransitionCommand toCommand() {
        return new TransitionCommand(target, outcomeDate, destination, notes, fosterFailed, expectedVersion);
    }
}
