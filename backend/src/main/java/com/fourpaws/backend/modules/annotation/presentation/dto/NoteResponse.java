package com.fourpaws.backend.modules.annotation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fourpaws.backend.modules.annotation.domain.Note;

public record NoteResponse(
        UUID id,
        String subjectType,
        UUID subjectId,
        String body,
        String visibility,
        UUID authorId,
        OffsetDateTime createdAt
) {

    public static NoteResponse from(Note note) {
        return new NoteResponse(
                note.getId(),
                note.getSubjectType().name(),
                note.getSubjectId(),
                note.getBody(),
                note.getVisibility().name(),
                note.getAuthorId(),
                note.getCreatedAt()
        );
    }
}
