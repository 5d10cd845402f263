package com.fourpaws.backend.modules.annotation.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record AddPhotoRequest(
        @NotBlank(message = "URL_REQUIRED")
        @Size(max = 2048, message = "URL_TOO_LONG")
        @Pattern(regexp = "https?://\\S+", message = "URL_INVALID")
        String url,
        @Size(max = 500) String caption,
        boolean primary
) {
}
