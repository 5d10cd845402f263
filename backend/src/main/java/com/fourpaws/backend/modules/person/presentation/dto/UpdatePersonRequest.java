package com.fourpaws.backend.modules.person.presentation.dto;

import java.util.Map;

import com.fourpaws.backend.modules.person.application.PersonService.PersonCommand;
import com.fourpaws.backend.modules.person.domain.PersonType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdatePersonRequest(
        PersonType type,
        @Size(min = 1, max = 200) String fullName,
        @Email(message = "EMAIL_INVALID")
        @Size(max = 320) String email,
        @Size(max = 50) String phone,
        Map<String, Object> flags,
        Long expectedVersion
) {

    public PersonCommand toCommand() {
        return new PersonCommand(type, fullName, email, phone, flags);
    }
}
