package com.fourpaws.backend.modules.placement.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.placement.domain.Adoption;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdoptionRepository extends JpaRepository<Adoption, UUID> {

    Optional<Adoption> findByIdAndOrganizationId(UUID id, UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Query("select count(a) > 0 from Adoption a where a.animal.id = :animalId")
    boolean existsByAnimal(@Param("animalId") UUID animalId);

    List<Adoption> findByOrganizationIdOrderByAdoptionDateDesc(UUID organizationId);

    long countByOrganizationIdAndAdoptionDateBetween(UUID organizationId, LocalDate from, LocalDate to);
}
