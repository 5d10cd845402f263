package com.fourpaws.backend.modules.animal.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnimalRepository extends JpaRepository<Animal, UUID> {

    Optional<Animal> findByIdAndOrganizationId(UUID id, UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Animal a where a.id = :id and a.organizationId = :organizationId")
    Optional<Animal> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    List<Animal> findByOrganizationIdOrderByIntakeDateDescNameAsc(UUID organizationId);

    List<Animal> findByOrganizationIdAndStatusOrderByIntakeDateDescNameAsc(UUID organizationId, AnimalStatus status);

    long countByOrganizationIdAndStatus(UUID organizationId, AnimalStatus status);

    long countByOrganizationIdAndStatusIn(UUID organizationId, Collection<AnimalStatus> statuses);

    @Query("""
            select a.species as species, count(a) as total
              from Animal a
             where a.organizationId = :organizationId
               and a.status in :statuses
             group by a.species
             order by count(a) desc, a.species
            """)
    List<SpeciesCount> countBySpecies(
            @Param("organizationId") UUID organizationId,
            @Param("statuses") Collection<AnimalStatus> statuses
    );

    interface SpeciesCount {
        String getSpecies();

        long getTotal();
    }
}
