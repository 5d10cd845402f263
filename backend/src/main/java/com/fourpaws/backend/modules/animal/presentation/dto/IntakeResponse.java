package com.fourpaws.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Intake;

public record IntakeResponse(
        UUID id,
        UUID animalId,
        String intakeType,
        String source,
        LocalDate intakeDate,
        boolean medicalHold,
        String notes
) {

    public static IntakeResponse from(Intake intake) {
        return new IntakeResponse(
                intake.getId(),
                intake.getAnimal().getId(),
                intake.getIntakeType().name(),
                intake.getSource(),
                intake.getIntakeDate(),
                intake.isMedicalHold(),
                intake.getNotes()
        );
    }
}
