package com.fourpaws.backend.modules.placement.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.placement.application.PlacementService.FosterCommand;

public record PlaceFosterRequest(LocalDate startDate, Long expectedVersion) {

    public FosterCommand toCommand() {
        return new FosterCommand(startDate, expectedVersion);
    }
}
