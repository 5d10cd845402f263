package com.fourpaws.backend.modules.annotation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.fourpaws.backend.modules.annotation.domain.Note;
import com.fourpaws.backend.modules.annotation.domain.NoteVisibility;
import com.fourpaws.backend.modules.annotation.domain.Photo;
import com.fourpaws.backend.modules.annotation.domain.SubjectType;
import com.fourpaws.backend.modules.annotation.infrastructure.persistence.NoteRepository;
import com.fourpaws.backend.modules.annotation.infrastructure.persistence.PhotoRepository;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AnnotationService {

    private final NoteRepository noteRepository;
    private final PhotoRepository photoRepository;
    private final SubjectResolver subjectResolver;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AnnotationService(
            NoteRepository noteRepository,
            PhotoRepository photoRepository,
            SubjectResolver subjectResolver,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.noteRepository = noteRepository;
        this.photoRepository = photoRepository;
        this.subjectResolver = subjectResolver;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public Note addNote(UUID organizationId, UUID actorId, SubjectType subjectType, UUID subjectId,
                        String body, NoteVisibility visibility) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.VOLUNTEER);
        subjectResolver.requireSubject(organizationId, subjectType, subjectId);

        Note note = new Note();
        note.setOrganizationId(organizationId);
        note.setSubjectType(subjectType);
        note.setSubjectId(subjectId);
        note.setBody(body.trim());
        note.setVisibility(visibility != null ? visibility : NoteVisibility.STAFF_ONLY);
        note.setAuthorId(actorId);
        note.setCreatedAt(OffsetDateTime.now(clock));
        Note saved = noteRepository.save(note);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.NOTE_ADDED,
                "NOTE", saved.getId(),
                AuditSnapshot.of("subjectType", subjectType, "subjectId", subjectId,
                        "visibility", saved.getVisibility())));
        return saved;
    }

    /**
     * Members below STAFF only see portal-visible notes.
     */
    @Transactional(readOnly = true)
    public List<Note> listNotes(UUID organizationId, UUID actorId, SubjectType subjectType, UUID subjectId) {
        Membership membership = authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        subjectResolver.requireSubject(organizationId, subjectType, subjectId);
        Set<NoteVisibility> visible = membership.getRole().satisfies(MembershipRole.STAFF)
                ? EnumSet.allOf(NoteVisibility.class)
                : EnumSet.of(NoteVisibility.PORTAL_VISIBLE);
        return noteRepository.findByOrganizationIdAndSubjectTypeAndSubjectIdAndVisibilityInOrderByCreatedAtDesc(
                organizationId, subjectType, subjectId, visible);
    }

    /**
     * Adds a photo; a new primary photo takes the flag from the previous one.
     */
    public Photo addPhoto(UUID organizationId, UUID actorId, SubjectType subjectType, UUID subjectId,
                          String url, String caption, boolean primary) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.VOLUNTEER);
        subjectResolver.requireSubject(organizationId, subjectType, subjectId);
        if (primary) {
            photoRepository.findByOrganizationIdAndSubjectTypeAndSubjectIdAndPrimaryTrue(
                    organizationId, subjectType, subjectId).forEach(existing -> existing.setPrimary(false));
        }

        Photo photo = new Photo();
        photo.setOrganizationId(organizationId);
        photo.setSubjectType(subjectType);
        photo.setSubjectId(subjectId);
        photo.setUrl(url.trim());
        photo.setCaption(caption);
        photo.setPrimary(primary);
        photo.setUploadedBy(actorId);
        Photo saved = photoRepository.save(photo);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.PHOTO_ADDED,
                "PHOTO", saved.getId(),
                AuditSnapshot.of("subjectType", subjectType, "subjectId", subjectId,
                        "url", saved.getUrl(), "primary", saved.isPrimary())));
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Photo> listPhotos(UUID organizationId, UUID actorId, SubjectType subjectType, UUID subjectId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        subjectResolver.requireSubject(organizationId, subjectType, subjectId);
        return photoRepository.findByOrganizationIdAndSubjectTypeAndSubjectIdOrderByPrimaryDescCreatedAtDesc(
                organizationId, subjectType, subjectId);
    }
}
