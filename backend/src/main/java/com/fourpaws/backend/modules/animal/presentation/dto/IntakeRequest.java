package com.fourpaws.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.util.Map;

import com.fourpaws.backend.modules.animal.application.AnimalService.IntakeCommand;
import com.fourpaws.backend.modules.animal.domain.IntakeType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record IntakeRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 100, message = "NAME_TOO_LONG")
        String name,
        @NotBlank(message = "SPECIES_REQUIRED")
        @Size(max = 50, message = "SPECIES_TOO_LONG")
        String species,
        @Size(max = 100) String breed,
        @Size(max = 20) String sex,
        @NotNull(message = "INTAKE_TYPE_REQUIRED")
        IntakeType intakeType,
        @Size(max = 255) String source,
        LocalDate intakeDate,
        boolean medicalHold,
        @Size(max = 64) String locationId,
        @Size(max = 64) String kennelId,
        @Size(max = 50) String microchip,
        String notes,
        Map<String, Object> attributes
) {

    public IntakeCommand toCommand() {
        return new IntakeCommand(name, species, breed, sex, intakeType, source, intakeDate, medicalHold,
                locationId, kennelId, microchip, notes, attributes);
    }
}
