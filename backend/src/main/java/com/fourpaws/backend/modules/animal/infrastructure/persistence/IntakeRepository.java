package com.fourpaws.backend.modules.animal.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Intake;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IntakeRepository extends JpaRepository<Intake, UUID> {

    @Query("select i from Intake i where i.animal.id = :animalId and i.organizationId = :organizationId")
    Optional<Intake> findByAnimal(@Param("animalId") UUID animalId, @Param("organizationId") UUID organizationId);

    List<Intake> findByOrganizationIdAndIntakeDateBetween(UUID organizationId, LocalDate from, LocalDate to);
}
