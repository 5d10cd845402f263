package com.fourpaws.backend.modules.annotation.application;

import java.util.UUID;

import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.fourpaws.backend.modules.annotation.domain.SubjectType;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalTaskRepository;
import com.fourpaws.backend.modules.person.infrastructure.persistence.PersonRepository;
import com.fourpaws.backend.modules.pipeline.infrastructure.persistence.ApplicationRepository;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.AdoptionRepository;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.FosterAssignmentRepository;

import org.springframework.stereotype.Component;

/**
 * Checks that the target of a note or photo exists in the organization. The store has no
 * foreign key for these columns.
 */
@Component
public class SubjectResolver {

    private final AnimalRepository animalRepository;
    private final PersonRepository personRepository;
    private final ApplicationRepository applicationRepository;
    private final MedicalTaskRepository medicalTaskRepository;
    private final FosterAssignmentRepository fosterAssignmentRepository;
    private final AdoptionRepository adoptionRepository;

    public SubjectResolver(
            AnimalRepository animalRepository,
            PersonRepository personRepository,
            ApplicationRepository applicationRepository,
            MedicalTaskRepository medicalTaskRepository,
            FosterAssignmentRepository fosterAssignmentRepository,
            AdoptionRepository adoptionRepository
    ) {
        this.animalRepository = animalRepository;
        this.personRepository = personRepository;
        this.applicationRepository = applicationRepository;
        this.medicalTaskRepository = medicalTaskRepository;
        this.fosterAssignmentRepository = fosterAssignmentRepository;
        this.adoptionRepository = adoptionRepository;
    }

    public void requireSubject(UUID organizationId, SubjectType subjectType, UUID subjectId) {
        if (subjectType == null || subjectId == null || !exists(organizationId, subjectType, subjectId)) {
            throw ProblemException.unknownEntity("Subject");
        }
    }

    private boolean exists(UUID organizationId, SubjectType subjectType, UUID subjectId) {
        return switch (subjectType) {
            case ANIMAL -> animalRepository.existsByIdAndOrganizationId(subjectId, organizationId);
            case PERSON -> personRepository.existsByIdAndOrganizationId(subjectId, organizationId);
            case APPLICATION -> applicationRepository.existsByIdAndOrganizationId(subjectId, organizationId);
            case MEDICAL_TASK -> medicalTaskRepository.existsByIdAndOrganizationId(subjectId, organizationId);
            case FOSTER_ASSIGNMENT -> fosterAssignmentRepository.existsByIdAndOrganizationId(subjectId, organizationId);
            case ADOPTION -> adoptionRepository.existsByIdAndOrganizationId(subjectId, organizationId);
        };
    }
}
