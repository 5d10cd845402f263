package com.fourpaws.backend.modules.person.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.person.domain.PersonType;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PersonRepository extends JpaRepository<Person, UUID> {

    Optional<Person> findByIdAndOrganizationId(UUID id, UUID organizationId);

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Person p where p.id = :id and p.organizationId = :organizationId")
    Optional<Person> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);

    List<Person> findByOrganizationIdOrderByFullNameAsc(UUID organizationId);

    List<Person> findByOrganizationIdAndTypeOrderByFullNameAsc(UUID organizationId, PersonType type);
}
