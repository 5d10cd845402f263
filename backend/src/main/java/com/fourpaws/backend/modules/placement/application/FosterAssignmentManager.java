package com.fourpaws.backend.modules.placement.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import com.fourpaws.backend.modules.animal.application.FosterPlacementPort;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.placement.domain.FosterAssignment;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.FosterAssignmentRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opens and closes foster assignments inside the caller's transaction.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class FosterAssignmentManager implements FosterPlacementPort {

    static final String ENTITY_FOSTER_ASSIGNMENT = "FOSTER_ASSIGNMENT";

    private final FosterAssignmentRepository assignmentRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public FosterAssignmentManager(
            FosterAssignmentRepository assignmentRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.assignmentRepository = assignmentRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Override
    public boolean hasActiveAssignment(UUID organizationId, UUID animalId) {
        return assignmentRepository.countActiveByAnimal(organizationId, animalId) > 0;
    }

    @Override
    public void closeActiveAssignment(UUID organizationId, UUID actorId, UUID animalId, boolean failed) {
        assignmentRepository.findActiveByAnimalForUpdate(organizationId, animalId)
                .ifPresent(assignment -> close(assignment, actorId,
                        failed ? FosterAssignmentStatus.FAILED : FosterAssignmentStatus.COMPLETED,
                        LocalDate.now(clock)));
    }

    public FosterAssignment open(Animal animal, Person person, UUID applicationId, UUID actorId, LocalDate startDate) {
        FosterAssignment assignment = new FosterAssignment();
        assignment.setOrganizationId(animal.getOrganizationId());
        assignment.setAnimal(animal);
        assignment.setPerson(person);
        assignment.setApplicationId(applicationId);
        assignment.setStatus(FosterAssignmentStatus.ACTIVE);
        assignment.setStartDate(startDate != null ? startDate : LocalDate.now(clock));
        FosterAssignment saved = assignmentRepository.saveAndFlush(assignment);

        auditLogService.record(AuditLogCommand.created(animal.getOrganizationId(), actorId,
                AuditAction.FOSTER_ASSIGNMENT_OPENED, ENTITY_FOSTER_ASSIGNMENT, saved.getId(),
                AuditSnapshot.of("animalId", animal.getId(), "personId", person.getId(),
                        "applicationId", applicationId, "status", saved.getStatus(),
                        "startDate", saved.getStartDate())));
        return saved;
    }

    public void close(FosterAssignment assignment, UUID actorId, FosterAssignmentStatus result, LocalDate endDate) {
        FosterAssignmentStatus previous = assignment.getStatus();
        assignment.setStatus(result);
        assignment.setEndDate(endDate);
        assignmentRepository.flush();

        auditLogService.record(new AuditLogCommand(assignment.getOrganizationId(), actorId,
                AuditAction.FOSTER_ASSIGNMENT_CLOSED, ENTITY_FOSTER_ASSIGNMENT, assignment.getId(),
                AuditSnapshot.of("status", previous),
                AuditSnapshot.of("status", result, "endDate", endDate)));
    }
}
