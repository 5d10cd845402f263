package com.fourpaws.backend.modules.pipeline.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;

public record ApplicationResponse(
        UUID id,
        UUID animalId,
        UUID personId,
        String kind,
        String status,
        String stage,
        Map<String, Object> form,
        String reviewNotes,
        OffsetDateTime decidedAt,
        UUID decidedBy,
        OffsetDateTime finalizedAt,
        OffsetDateTime createdAt,
        long version
) {

    public static ApplicationResponse from(AnimalApplication application) {
        return new ApplicationResponse(
                application.getId(),
                application.getAnimal().getId(),
                application.getPerson().getId(),
                application.getKind().name(),
                application.getStatus().name(),
                application.getStage().map(PipelineStage::name).orElse(null),
                application.getForm(),
                application.getReviewNotes(),
                application.getDecidedAt(),
                application.getDecidedBy(),
                application.getFinalizedAt(),
                application.getCreatedAt(),
                application.getVersion()
        );
    }
}
