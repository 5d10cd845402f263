package com.fourpaws.backend.modules.pipeline.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.pipeline.application.ApplicationPipelineService.SubmitCommand;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationKind;

import jakarta.validation.constraints.NotNull;

public record SubmitApplicationRequest(
        @NotNull(message = "ANIMAL_REQUIRED")
        UUID animalId,
        @NotNull(message = "PERSON_REQUIRED")
        UUID personId,
        @NotNull(message = "KIND_REQUIRED")
        ApplicationKind kind,
        Map<String, Object> form
) {

    public SubmitCommand toCommand() {
        return new SubmitCommand(animalId, personId, kind, form);
    }
}
