package com.fourpaws.backend.modules.placement.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.placement.domain.FosterAssignment;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FosterAssignmentRepository extends JpaRepository<FosterAssignment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from FosterAssignment f where f.id = :id and f.organizationId = :organizationId")
    Optional<FosterAssignment> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    Optional<FosterAssignment> findByIdAndOrganizationId(UUID id, UUID organizationId);

    @Query("select f.animal.id from FosterAssignment f where f.id = :id and f.organizationId = :organizationId")
    Optional<UUID> findAnimalIdById(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select f
              from FosterAssignment f
             where f.organizationId = :organizationId
               and f.animal.id = :animalId
               and f.status = com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus.ACTIVE
            """)
    Optional<FosterAssignment> findActiveByAnimalForUpdate(
            @Param("organizationId") UUID organizationId,
            @Param("animalId") UUID animalId
    );

    @Query("""
            select count(f)
              from FosterAssignment f
             where f.organizationId = :organizationId
               and f.animal.id = :animalId
               and f.status = com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus.ACTIVE
            """)
    long countActiveByAnimal(@Param("organizationId") UUID organizationId, @Param("animalId") UUID animalId);

    List<FosterAssignment> findByOrganizationIdOrderByStartDateDesc(UUID organizationId);

    List<FosterAssignment> findByOrganizationIdAndStatusOrderByStartDateDesc(
            UUID organizationId, FosterAssignmentStatus status);

    @Query("""
            select f
              from FosterAssignment f
             where f.organizationId = :organizationId
               and f.animal.id = :animalId
             order by f.startDate desc
            """)
    List<FosterAssignment> findByAnimal(@Param("organizationId") UUID organizationId, @Param("animalId") UUID animalId);
}
