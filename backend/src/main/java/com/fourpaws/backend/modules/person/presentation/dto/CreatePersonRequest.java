package com.fourpaws.backend.modules.person.presentation.dto;

import java.util.Map;

import com.fourpaws.backend.modules.person.application.PersonService.PersonCommand;
import com.fourpaws.backend.modules.person.domain.PersonType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreatePersonRequest(
        @NotNull(message = "TYPE_REQUIRED")
        PersonType type,
        @NotBlank(message = "FULL_NAME_REQUIRED")
        @Size(max = 200, message = "FULL_NAME_TOO_LONG")
        String fullName,
        @Email(message = "EMAIL_INVALID")
        @Size(max = 320) String email,
        @Size(max = 50) String phone,
        Map<String, Object> flags
) {

    public PersonCommand toCommand() {
        return new PersonCommand(type, fullName, email, phone, flags);
    }
}
