package com.fourpaws.backend.modules.annotation.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.modules.annotation.domain.Note;
import com.fourpaws.backend.modules.annotation.domain.NoteVisibility;
import com.fourpaws.backend.modules.annotation.domain.SubjectType;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NoteRepository extends JpaRepository<Note, UUID> {

    List<Note> findByOrganizationIdAndSubjectTypeAndSubjectIdAndVisibilityInOrderByCreatedAtDesc(
            UUID organizationId, SubjectType subjectType, UUID subjectId, Collection<NoteVisibility> visibilities);
}
