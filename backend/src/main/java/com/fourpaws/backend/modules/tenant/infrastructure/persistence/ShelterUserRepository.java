package com.fourpaws.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.modules.tenant.domain.ShelterUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ShelterUserRepository extends JpaRepository<ShelterUser, UUID> {

    Optional<ShelterUser> findByEmailIgnoreCase(String email);
}
