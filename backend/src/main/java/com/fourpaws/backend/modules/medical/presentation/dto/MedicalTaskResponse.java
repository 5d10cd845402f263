package com.fourpaws.backend.modules.medical.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.application.MedicalTaskService.ClassifiedTask;
import com.fourpaws.backend.modules.medical.domain.MedicalTask;

public record MedicalTaskResponse(
        UUID id,
        UUID animalId,
        String type,
        String title,
        LocalDate dueDate,
        UUID assignedTo,
        String status,
        String classification,
        OffsetDateTime completedAt,
        UUID completedBy,
        UUID followUpOf,
        String notes,
        long version
) {

    public static MedicalTaskResponse from(ClassifiedTask item) {
        return from(item.task(), item.classification().name());
    }

    public static MedicalTaskResponse from(MedicalTask task, String classification) {
        return new MedicalTaskResponse(
                task.getId(),
                task.getAnimal().getId(),
                task.getType().name(),
                task.getTitle(),
                task.getDueDate(),
                task.getAssignedTo(),
                task.getStatus().name(),
                classification,
                task.getCompletedAt(),
                task.getCompletedBy(),
                task.getFollowUpOf(),
                task.getNotes(),
                task.getVersion()
        );
    }
}
