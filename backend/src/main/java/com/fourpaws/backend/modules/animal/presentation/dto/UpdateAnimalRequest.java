package com.fourpaws.backend.modules.animal.presentation.dto;

import java.util.Map;

import com.fourpaws.backend.modules.animal.application.AnimalService.ProfileUpdate;

import jakarta.validation.constraints.Size;

public record UpdateAnimalRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 100) String breed,
        @Size(max = 20) String sex,
        @Size(max = 64) String locationId,
        @Size(max = 64) String kennelId,
        @Size(max = 50) String microchip,
        Map<String, Object> attributes,
        Long expectedVersion
) {

    public ProfileUpdate toUpdate() {
        return new ProfileUpdate(name, breed, sex, locationId, kennelId, microchip, attributes, expectedVersion);
    }
}
