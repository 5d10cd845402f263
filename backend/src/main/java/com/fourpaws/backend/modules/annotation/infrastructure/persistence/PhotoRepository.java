package com.fourpaws.backend.modules.annotation.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.modules.annotation.domain.Photo;
import com.fourpaws.backend.modules.annotation.domain.SubjectType;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PhotoRepository extends JpaRepository<Photo, UUID> {

    List<Photo> findByOrganizationIdAndSubjectTypeAndSubjectIdOrderByPrimaryDescCreatedAtDesc(
            UUID organizationId, SubjectType subjectType, UUID subjectId);

    List<Photo> findByOrganizationIdAndSubjectTypeAndSubjectIdAndPrimaryTrue(
            UUID organizationId, SubjectType subjectType, UUID subjectId);
}
