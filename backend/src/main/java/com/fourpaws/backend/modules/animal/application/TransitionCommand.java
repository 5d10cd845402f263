package com.fourpaws.backend.modules.animal.application;

import java.time.LocalDate;

import com.fourpaws.backend.modules.animal.domain.AnimalStatus;

/**
 * A requested status change. Outcome fields are read only when {@code target} is terminal;
 * {@code fosterFailed} only when the animal leaves FOSTERED.
 */
public record TransitionCommand(
        AnimalStatus target,
        LocalDate outcomeDate,
        String destination,
        String notes,
        boolean fosterFailed,
        Long expectedVersion
) {

    public static TransitionCommand to(AnimalStatus target) {
        return new TransitionCommand(target, null, null, null, false, null);
    }
}
