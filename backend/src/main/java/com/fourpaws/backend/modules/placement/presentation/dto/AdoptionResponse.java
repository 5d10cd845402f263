package com.fourpaws.backend.modules.placement.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.placement.domain.Adoption;

public record AdoptionResponse(
        UUID id,
        UUID animalId,
        UUID adopterId,
        UUID applicationId,
        LocalDate adoptionDate,
        long feeCents,
        long donationCents,
        String contractRef,
        String paymentRef
) {

    public static AdoptionResponse from(Adoption adoption) {
        return new AdoptionResponse(
                adoption.getId(),
                adoption.getAnimal().getId(),
                adoption.getAdopter().getId(),
                adoption.getApplicationId(),
                adoption.getAdoptionDate(),
                adoption.getFeeCents(),
                adoption.getDonationCents(),
                adoption.getContractRef(),
                adoption.getPaymentRef()
        );
    }
}
