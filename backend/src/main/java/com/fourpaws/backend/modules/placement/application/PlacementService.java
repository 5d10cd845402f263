package com.fourpaws.backend.modules.placement.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.application.AnimalLifecycleService;
import com.fourpaws.backend.modules.animal.application.TransitionCommand;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.pipeline.application.ApplicationPipelineService;
import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationKind;
import com.fourpaws.backend.modules.placement.domain.Adoption;
import com.fourpaws.backend.modules.placement.domain.FosterAssignment;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.AdoptionRepository;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.FosterAssignmentRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns approved applications into adoptions and foster placements. Row locks are always
 * taken in the order application, animal, foster assignment, the same order a plain animal
 * transition out of FOSTERED uses.
 */
@Service
@Transactional
public class PlacementService {

    private static final Logger log = LoggerFactory.getLogger(PlacementService.class);
    private static final String ENTITY_ADOPTION = "ADOPTION";

    private final AdoptionRepository adoptionRepository;
    private final FosterAssignmentRepository assignmentRepository;
    private final FosterAssignmentManager assignmentManager;
    private final ApplicationPipelineService pipelineService;
    private final AnimalLifecycleService lifecycleService;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public PlacementService(
            AdoptionRepository adoptionRepository,
            FosterAssignmentRepository assignmentRepository,
            FosterAssignmentManager assignmentManager,
            ApplicationPipelineService pipelineService,
            AnimalLifecycleService lifecycleService,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.adoptionRepository = adoptionRepository;
        this.assignmentRepository = assignmentRepository;
        this.assignmentManager = assignmentManager;
        this.pipelineService = pipelineService;
        this.lifecycleService = lifecycleService;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates the adoption, moves the animal to ADOPTED (recording its outcome) and marks the
     * application finalized, all in one transaction.
     */
    public Adoption finalizeAdoption(UUID organizationId, UUID actorId, UUID applicationId, AdoptionCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        long donationCents = command.donationCents() != null ? command.donationCents() : 0L;
        if (command.feeCents() < 0 || donationCents < 0) {
            throw new ProblemException(ErrorCode.INVALID_AMOUNT, "amounts must not be negative");
        }

        AnimalApplication application = pipelineService.lockApplication(organizationId, applicationId);
        application.checkVersion(command.expectedVersion(), ApplicationPipelineService.ENTITY_APPLICATION);
        pipelineService.requireFinalizable(application, ApplicationKind.ADOPTION);
        Animal animal = lifecycleService.lockAnimal(organizationId, application.getAnimal().getId());
        if (adoptionRepository.existsByAnimal(animal.getId())) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal already adopted");
        }

        LocalDate adoptionDate = command.adoptionDate() != null ? command.adoptionDate() : LocalDate.now(clock);
        AnimalStatus before = animal.getStatus();
        lifecycleService.applyTransition(animal, actorId, new TransitionCommand(AnimalStatus.ADOPTED,
                adoptionDate, application.getPerson().getFullName(), null, false, null));

        Adoption adoption = new Adoption();
        adoption.setOrganizationId(organizationId);
        adoption.setAnimal(animal);
        adoption.setAdopter(application.getPerson());
        adoption.setApplicationId(application.getId());
        adoption.setAdoptionDate(adoptionDate);
        adoption.setFeeCents(command.feeCents());
        adoption.setDonationCents(donationCents);
        adoption.setContractRef(command.contractRef());
        adoption.setPaymentRef(command.paymentRef());
        adoption.setCreatedAt(OffsetDateTime.now(clock));
        Adoption saved = adoptionRepository.save(adoption);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.ADOPTION_CREATED,
                ENTITY_ADOPTION, saved.getId(),
                AuditSnapshot.of("animalId", animal.getId(), "adopterId", application.getPerson().getId(),
                        "applicationId", application.getId(), "adoptionDate", adoptionDate,
                        "feeCents", saved.getFeeCents(), "donationCents", saved.getDonationCents(),
                        "animalStatusBefore", before)));
        pipelineService.markFinalized(application, actorId, saved.getId());
        log.info("Application {} finalized as adoption {}", application.getId(), saved.getId());
        return saved;
    }

    /**
     * Opens an active foster assignment for an approved foster application and moves the
     * animal to FOSTERED.
     */
    public FosterAssignment placeFoster(UUID organizationId, UUID actorId, UUID applicationId, FosterCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        AnimalApplication application = pipelineService.lockApplication(organizationId, applicationId);
        application.checkVersion(command.expectedVersion(), ApplicationPipelineService.ENTITY_APPLICATION);
        pipelineService.requireFinalizable(application, ApplicationKind.FOSTER);
        Animal animal = lifecycleService.lockAnimal(organizationId, application.getAnimal().getId());

        if (animal.getStatus().isTerminal()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal already has an outcome");
        }
        if (assignmentManager.hasActiveAssignment(organizationId, animal.getId())) {
            throw new ProblemException(ErrorCode.ANIMAL_ALREADY_FOSTERED, "animal already has an active foster");
        }
        if (!animal.getStatus().canTransitionTo(AnimalStatus.FOSTERED)) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "cannot move animal from " + animal.getStatus() + " to FOSTERED");
        }

        FosterAssignment assignment = assignmentManager.open(
                animal, application.getPerson(), application.getId(), actorId, command.startDate());
        lifecycleService.applyTransition(animal, actorId, TransitionCommand.to(AnimalStatus.FOSTERED));
        pipelineService.markFinalized(application, actorId, assignment.getId());
        log.info("Animal {} placed in foster with {}", animal.getId(), application.getPerson().getId());
        return assignment;
    }

    /**
     * Closes a foster assignment and returns the animal to AVAILABLE or HOLD.
     */
    public FosterAssignment endFoster(UUID organizationId, UUID actorId, UUID assignmentId, EndFosterCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        if (command.result() == FosterAssignmentStatus.ACTIVE) {
            throw new ProblemException(ErrorCode.INVALID_REQUEST, "result must be COMPLETED or FAILED");
        }
        if (command.returnStatus() != AnimalStatus.AVAILABLE && command.returnStatus() != AnimalStatus.HOLD) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION, "an ended foster returns to AVAILABLE or HOLD");
        }

        UUID animalId = assignmentRepository.findAnimalIdById(assignmentId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("FosterAssignment"));
        Animal animal = lifecycleService.lockAnimal(organizationId, animalId);
        FosterAssignment assignment = assignmentRepository.findByIdForUpdate(assignmentId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("FosterAssignment"));
        assignment.checkVersion(command.expectedVersion(), FosterAssignmentManager.ENTITY_FOSTER_ASSIGNMENT);
        if (!assignment.isActive()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "foster assignment is " + assignment.getStatus());
        }

        LocalDate endDate = command.endDate() != null ? command.endDate() : LocalDate.now(clock);
        assignmentManager.close(assignment, actorId, command.result(), endDate);
        lifecycleService.applyTransition(animal, actorId, new TransitionCommand(command.returnStatus(),
                null, null, null, command.result() == FosterAssignmentStatus.FAILED, null));
        return assignment;
    }

    @Transactional(readOnly = true)
    public List<FosterAssignment> listFosterAssignments(UUID organizationId, UUID actorId,
                                                        FosterAssignmentStatus status) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (status == null) {
            return assignmentRepository.findByOrganizationIdOrderByStartDateDesc(organizationId);
        }
        return assignmentRepository.findByOrganizationIdAndStatusOrderByStartDateDesc(organizationId, status);
    }

    @Transactional(readOnly = true)
    public FosterAssignment getFosterAssignment(UUID organizationId, UUID actorId, UUID assignmentId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return assignmentRepository.findByIdAndOrganizationId(assignmentId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("FosterAssignment"));
    }

    @Transactional(readOnly = true)
    public List<Adoption> listAdoptions(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return adoptionRepository.findByOrganizationIdOrderByAdoptionDateDesc(organizationId);
    }

    @Transactional(readOnly = true)
    public Adoption getAdoption(UUID organizationId, UUID actorId, UUID adoptionId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return adoptionRepository.findByIdAndOrganizationId(adoptionId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Adoption"));
    }

    public record AdoptionCommand(
            long feeCents,
            Long donationCents,
            LocalDate adoptionDate,
            String contractRef,
            String paymentRef,
            Long expectedVersion
    ) {
    }

    public record FosterCommand(LocalDate startDate, Long expectedVersion) {
    }

    public record EndFosterCommand(
            FosterAssignmentStatus result,
            AnimalStatus returnStatus,
            LocalDate endDate,
            Long expectedVersion
    ) {
    }
}
