package com.fourpaws.backend.modules.animal.presentation.dto;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Animal;

public record AnimalResponse(
        UUID id,
        String name,
        String species,
        String breed,
        String sex,
        String status,
        LocalDate intakeDate,
        String locationId,
        String kennelId,
        String microchip,
        Map<String, Object> attributes,
        long version
) {

    public static AnimalResponse from(Animal animal) {
        return new AnimalResponse(
                animal.getId(),
                animal.getName(),
                animal.getSpecies(),
                animal.getBreed(),
                animal.getSex(),
                animal.getStatus().name(),
                animal.getIntakeDate(),
                animal.getLocationId(),
                animal.getKennelId(),
                animal.getMicrochip(),
                animal.getAttributes(),
                animal.getVersion()
        );
    }
}
