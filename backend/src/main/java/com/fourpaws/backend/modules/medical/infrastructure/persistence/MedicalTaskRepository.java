package com.fourpaws.backend.modules.medical.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.domain.MedicalTask;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MedicalTaskRepository extends JpaRepository<MedicalTask, UUID> {

    Optional<MedicalTask> findByIdAndOrganizationId(UUID id, UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from MedicalTask t where t.id = :id and t.organizationId = :organizationId")
    Optional<MedicalTask> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    List<MedicalTask> findByOrganizationIdOrderByDueDateAscTitleAsc(UUID organizationId);

    @Query("""
            select t
              from MedicalTask t
             where t.organizationId = :organizationId
               and t.animal.id = :animalId
             order by t.dueDate, t.title
            """)
    List<MedicalTask> findByAnimal(@Param("organizationId") UUID organizationId, @Param("animalId") UUID animalId);

    long countByOrganizationIdAndStatusNotInAndDueDateBefore(
            UUID organizationId, Collection<MedicalTaskStatus> statuses, LocalDate asOf);

    long countByOrganizationIdAndStatusNotInAndDueDate(
            UUID organizationId, Collection<MedicalTaskStatus> statuses, LocalDate dueDate);

    long countByOrganizationIdAndStatusAndDueDateBetween(
            UUID organizationId, MedicalTaskStatus status, LocalDate from, LocalDate to);

    @Query("""
            select count(t)
              from MedicalTask t
             where t.organizationId = :organizationId
               and t.status not in :terminal
               and t.dueDate between :from and :to
               and t.dueDate < :asOf
            """)
    long countMissed(
            @Param("organizationId") UUID organizationId,
            @Param("terminal") Collection<MedicalTaskStatus> terminal,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to,
            @Param("asOf") LocalDate asOf
    );
}
