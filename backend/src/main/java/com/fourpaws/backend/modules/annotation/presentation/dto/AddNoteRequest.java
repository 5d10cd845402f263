package com.fourpaws.backend.modules.annotation.presentation.dto;

import com.fourpaws.backend.modules.annotation.domain.NoteVisibility;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddNoteRequest(
        @NotBlank(message = "BODY_REQUIRED")
        @Size(max = 10000, message = "BODY_TOO_LONG")
        String body,
        NoteVisibility visibility
) {
}
