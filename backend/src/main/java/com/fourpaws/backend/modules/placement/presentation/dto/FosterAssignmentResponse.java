package com.fourpaws.backend.modules.placement.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.placement.domain.FosterAssignment;

public record FosterAssignmentResponse(
        UUID id,
        UUID animalId,
        UUID personId,
        UUID applicationId,
        String status,
        LocalDate startDate,
        LocalDate endDate,
        long version
) {

    public static FosterAssignmentResponse from(FosterAssignment assignment) {
        return new FosterAssignmentResponse(
                assignment.getId(),
                assignment.getAnimal().getId(),
                assignment.getPerson().getId(),
                assignment.getApplicationId(),
                assignment.getStatus().name(),
                assignment.getStartDate(),
                assignment.getEndDate(),
                assignment.getVersion()
        );
    }
}
