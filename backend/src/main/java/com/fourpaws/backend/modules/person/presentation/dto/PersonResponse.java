package com.fourpaws.backend.modules.person.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.person.domain.Person;

public record PersonResponse(
        UUID id,
        String type,
        String fullName,
        String email,
        String phone,
        Map<String, Object> flags,
        long version
) {

    public static PersonResponse from(Person person) {
        return new PersonResponse(
                person.getId(),
                person.getType().name(),
                person.getFullName(),
                person.getEmail(),
                person.getPhone(),
                person.getFlags(),
                person.getVersion()
        );
    }
}
