package com.fourpaws.backend.modules.annotation.presentation.dto;

import java.util.UUID;

import com.fourpaws.backend.modules.annotation.domain.Photo;

public record PhotoResponse(
        UUID id,
        String subjectType,
        UUID subjectId,
        String url,
        String caption,
        boolean primary,
        UUID uploadedBy
) {

    public static PhotoResponse from(Photo photo) {
        return new PhotoResponse(
                photo.getId(),
                photo.getSubjectType().name(),
                photo.getSubjectId(),
                photo.getUrl(),
                photo.getCaption(),
                photo.isPrimary(),
                photo.getUploadedBy()
        );
    }
}
