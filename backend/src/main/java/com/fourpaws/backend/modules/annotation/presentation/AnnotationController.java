package com.fourpaws.backend.modules.annotation.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.annotation.application.AnnotationService;
import com.fourpaws.backend.modules.annotation.domain.SubjectType;
import com.fourpaws.backend.modules.annotation.presentation.dto.AddNoteRequest;
import com.fourpaws.backend.modules.annotation.presentation.dto.AddPhotoRequest;
import com.fourpaws.backend.modules.annotation.presentation.dto.NoteResponse;
import com.fourpaws.backend.modules.annotation.presentation.dto.PhotoResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}/subjects/{subjectType}/{subjectId}")
public class AnnotationController {

    private final AnnotationService annotationService;

    public AnnotationController(AnnotationService annotationService) {
        this.annotationService = annotationService;
    }

    @PostMapping("/notes")
    public ResponseEntity<NoteResponse> addNote(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("subjectType") SubjectType subjectType,
            @PathVariable("subjectId") UUID subjectId,
            @Valid @RequestBody AddNoteRequest request
    ) {
        var note = annotationService.addNote(organizationId, SecurityUtils.getCurrentUserId(), subjectType, subjectId,
                request.body(), request.visibility());
        return ResponseEntity.status(201).body(NoteResponse.from(note));
    }

    @GetMapping("/notes")
    public ResponseEntity<List<NoteResponse>> listNotes(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("subjectType") SubjectType subjectType,
            @PathVariable("subjectId") UUID subjectId
    ) {
        return ResponseEntity.ok(annotationService.listNotes(
                        organizationId, SecurityUtils.getCurrentUserId(), subjectType, subjectId)
                .stream()
                .map(NoteResponse::from)
                .toList());
    }

    @PostMapping("/photos")
    public ResponseEntity<PhotoResponse> addPhoto(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("subjectType") SubjectType subjectType,
            @PathVariable("subjectId") UUID subjectId,
            @Valid @RequestBody AddPhotoRequest request
    ) {
        var photo = annotationService.addPhoto(organizationId, SecurityUtils.getCurrentUserId(), subjectType, subjectId,
                request.url(), request.caption(), request.primary());
        return ResponseEntity.status(201).body(PhotoResponse.from(photo));
    }

    @GetMapping("/photos")
    public ResponseEntity<List<PhotoResponse>> listPhotos(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("subjectType") SubjectType subjectType,
            @PathVariable("subjectId") UUID subjectId
    ) {
        return ResponseEntity.ok(annotationService.listPhotos(
                        organizationId, SecurityUtils.getCurrentUserId(), subjectType, subjectId)
                .stream()
                .map(PhotoResponse::from)
                .toList());
    }
}
