package com.fourpaws.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Outcome;

public record OutcomeResponse(
        UUID id,
        UUID animalId,
        String type,
        LocalDate outcomeDate,
        String destination,
        String notes
) {

    public static OutcomeResponse from(Outcome outcome) {
        return new OutcomeResponse(
                outcome.getId(),
                outcome.getAnimal().getId(),
                outcome.getType().name(),
                outcome.getOutcomeDate(),
                outcome.getDestination(),
                outcome.getNotes()
        );
    }
}
