package com.fourpaws.backend.modules.placement.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.placement.application.PlacementService.EndFosterCommand;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;

public record EndFosterRequest(
        FosterAssignmentStatus result,
        AnimalStatus returnStatus,
        LocalDate endDate,
        Long expectedVersion
) {

    public EndFosterCommand toCommand() {
        return new EndFosterCommand(
                result != null ? result : FosterAssignmentStatus.COMPLETED,
                returnStatus != null ? returnStatus : AnimalStatus.AVAILABLE,
                endDate,
                expectedVersion
        );
    }
}
