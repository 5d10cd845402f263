package com.fourpaws.backend.modules.placement.presentation.dto;

import java.time.LocalDate;

import com.fourpaws.backend.modules.placement.application.PlacementService.AdoptionCommand;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record FinalizeAdoptionRequest(
        @NotNull(message = "FEE_REQUIRED")
        Long feeCents,
        Long donationCents,
        LocalDate adoptionDate,
        @Size(max = 255) String contractRef,
        @Size(max = 255) String paymentRef,
        Long expectedVersion
) {

    public AdoptionCommand toCommand() {
        return new AdoptionCommand(feeCents, donationCents, adoptionDate, contractRef, paymentRef, expectedVersion);
    }
}
