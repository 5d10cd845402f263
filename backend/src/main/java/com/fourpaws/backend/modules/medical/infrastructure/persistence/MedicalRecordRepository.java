package com.fourpaws.backend.modules.medical.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.domain.MedicalRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MedicalRecordRepository extends JpaRepository<MedicalRecord, UUID> {

    @Query("""
            select r
              from MedicalRecord r
             where r.organizationId = :organizationId
               and r.animal.id = :animalId
             order by r.performedOn desc, r.createdAt desc
            """)
    List<MedicalRecord> findByAnimal(@Param("organizationId") UUID organizationId, @Param("animalId") UUID animalId);

    @Query("select r from MedicalRecord r where r.taskId = :taskId")
    List<MedicalRecord> findByTaskId(@Param("taskId") UUID taskId);
}
