package com.fourpaws.backend.modules.pipeline.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApplicationRepository extends JpaRepository<AnimalApplication, UUID> {

    Optional<AnimalApplication> findByIdAndOrganizationId(UUID id, UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from AnimalApplication a where a.id = :id and a.organizationId = :organizationId")
    Optional<AnimalApplication> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    List<AnimalApplication> findByOrganizationIdOrderByCreatedAtDesc(UUID organizationId);

    List<AnimalApplication> findByOrganizationIdAndStatusOrderByCreatedAtDesc(UUID organizationId, ApplicationStatus status);

    @Query("""
            select a
              from AnimalApplication a
             where a.organizationId = :organizationId
               and a.status in (com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus.RECEIVED,
                                com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus.REVIEW,
                                com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus.APPROVED)
             order by a.createdAt
            """)
    List<AnimalApplication> findBoardApplications(@Param("organizationId") UUID organizationId);

    long countByOrganizationIdAndStatus(UUID organizationId, ApplicationStatus status);

    long countByOrganizationIdAndStatusAndFinalizedAtIsNull(UUID organizationId, ApplicationStatus status);

    long countByOrganizationIdAndStatusAndFinalizedAtIsNotNull(UUID organizationId, ApplicationStatus status);
}
