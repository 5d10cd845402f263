package com.fourpaws.backend.modules.animal.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Outcome;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OutcomeRepository extends JpaRepository<Outcome, UUID> {

    @Query("select o from Outcome o where o.animal.id = :animalId and o.organizationId = :organizationId")
    Optional<Outcome> findByAnimal(@Param("animalId") UUID animalId, @Param("organizationId") UUID organizationId);

    @Query("select count(o) from Outcome o where o.animal.id = :animalId")
    long countByAnimal(@Param("animalId") UUID animalId);

    @Query("""
            select o
              from Outcome o
              join fetch o.animal a
             where o.organizationId = :organizationId
               and o.outcomeDate between :from and :to
            """)
    List<Outcome> findInWindowWithAnimal(
            @Param("organizationId") UUID organizationId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
