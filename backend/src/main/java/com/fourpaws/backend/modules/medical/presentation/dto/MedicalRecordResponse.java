package com.fourpaws.backend.modules.medical.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.domain.MedicalRecord;

public record MedicalRecordResponse(
        UUID id,
        UUID animalId,
        UUID taskId,
        String type,
        String title,
        LocalDate performedOn,
        UUID performedBy,
        String notes
) {

    public static MedicalRecordResponse from(MedicalRecord record) {
        return new MedicalRecordResponse(
                record.getId(),
                record.getAnimal().getId(),
                record.getTaskId(),
                record.getType().name(),
                record.getTitle(),
                record.getPerformedOn(),
                record.getPerformedBy(),
                record.getNotes()
        );
    }
}
