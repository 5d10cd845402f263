package com.fourpaws.backend.modules.animal.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.animal.domain.Outcome;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.OutcomeRepository;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of {@link Animal#setStatus}. A status change, its Outcome (when terminal)
 * and the audit entries commit in one transaction.
 */
@Service
@Transactional
public class AnimalLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AnimalLifecycleService.class);
    static final String ENTITY_ANIMAL = "ANIMAL";
    static final String ENTITY_OUTCOME = "OUTCOME";

    private final AnimalRepository animalRepository;
    private final OutcomeRepository outcomeRepository;
    private final FosterPlacementPort fosterPlacementPort;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AnimalLifecycleService(
            AnimalRepository animalRepository,
            OutcomeRepository outcomeRepository,
            FosterPlacementPort fosterPlacementPort,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.animalRepository = animalRepository;
        this.outcomeRepository = outcomeRepository;
        this.fosterPlacementPort = fosterPlacementPort;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public Animal transition(UUID organizationId, UUID actorId, UUID animalId, TransitionCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Animal animal = lockAnimal(organizationId, animalId);
        animal.checkVersion(command.expectedVersion(), ENTITY_ANIMAL);
        return applyTransition(animal, actorId, command);
    }

    /**
     * Loads the animal with a row lock held until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Animal lockAnimal(UUID organizationId, UUID animalId) {
        return animalRepository.findByIdForUpdate(animalId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Animal"));
    }

    /**
     * Applies a transition to an animal the caller has already locked and authorized for.
     * Used by foster placement and adoption finalization.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Animal applyTransition(Animal animal, UUID actorId, TransitionCommand command) {
        AnimalStatus from = animal.getStatus();
        AnimalStatus target = command.target();
        if (from.isTerminal()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal already has an outcome");
        }
        if (target == null || !from.canTransitionTo(target)) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION, "cannot move animal from " + from + " to " + target);
        }
        UUID organizationId = animal.getOrganizationId();
        if (target == AnimalStatus.FOSTERED
                && !fosterPlacementPort.hasActiveAssignment(organizationId, animal.getId())) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION, "FOSTERED requires an active foster assignment");
        }
        if (from == AnimalStatus.FOSTERED) {
            fosterPlacementPort.closeActiveAssignment(organizationId, actorId, animal.getId(), command.fosterFailed());
        }

        animal.setStatus(target);
        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.ANIMAL_STATUS_CHANGED,
                ENTITY_ANIMAL, animal.getId(), AuditSnapshot.of("status", from), AuditSnapshot.of("status", target)));

        if (target.isTerminal()) {
            recordOutcome(animal, actorId, command);
        }
        log.info("Animal {} moved {} -> {}", animal.getId(), from, target);
        return animal;
    }

    private void recordOutcome(Animal animal, UUID actorId, TransitionCommand command) {
        LocalDate today = LocalDate.now(clock);
        Outcome outcome = new Outcome();
        outcome.setOrganizationId(animal.getOrganizationId());
        outcome.setAnimal(animal);
        outcome.setType(command.target().getOutcomeType());
        outcome.setOutcomeDate(command.outcomeDate() != null ? command.outcomeDate() : today);
        outcome.setDestination(command.destination());
        outcome.setNotes(command.notes());
        outcome.setRecordedBy(actorId);
        outcome.setCreatedAt(OffsetDateTime.now(clock));
        Outcome saved = outcomeRepository.save(outcome);

        auditLogService.record(AuditLogCommand.created(animal.getOrganizationId(), actorId,
                AuditAction.OUTCOME_RECORDED, ENTITY_OUTCOME, saved.getId(),
                AuditSnapshot.of("animalId", animal.getId(), "type", saved.getType(),
                        "outcomeDate", saved.getOutcomeDate(), "destination", saved.getDestination())));
    }
}
