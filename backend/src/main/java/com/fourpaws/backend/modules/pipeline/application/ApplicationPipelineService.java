package com.fourpaws.backend.modules.pipeline.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.attribute.AttributeSchema;
import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.application.AnimalService;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.person.application.PersonService;
import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationKind;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;
import com.fourpaws.backend.modules.pipeline.infrastructure.persistence.ApplicationRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ApplicationPipelineService {

    private static final Logger log = LoggerFactory.getLogger(ApplicationPipelineService.class);
    public static final String ENTITY_APPLICATION = "APPLICATION";
    private static final AttributeSchema FORM = AttributeSchema.open("form");

    private final ApplicationRepository applicationRepository;
    private final AnimalService animalService;
    private final PersonService personService;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ApplicationPipelineService(
            ApplicationRepository applicationRepository,
            AnimalService animalService,
            PersonService personService,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.animalService = animalService;
        this.personService = personService;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public AnimalApplication submit(UUID organizationId, UUID actorId, SubmitCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.VOLUNTEER);
        Animal animal = animalService.requireAnimal(organizationId, command.animalId());
        Person person = personService.requirePerson(organizationId, command.personId());
        if (!animal.isInCare()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal is no longer in care");
        }

        AnimalApplication application = new AnimalApplication();
        application.setOrganizationId(organizationId);
        application.setAnimal(animal);
        application.setPerson(person);
        application.setKind(command.kind());
        application.setForm(FORM.validate(command.form()));
        application.setStatus(ApplicationStatus.RECEIVED);
        AnimalApplication saved = applicationRepository.save(application);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.APPLICATION_SUBMITTED,
                ENTITY_APPLICATION, saved.getId(),
                AuditSnapshot.of("animalId", animal.getId(), "personId", person.getId(),
                        "kind", saved.getKind(), "status", saved.getStatus())));
        return saved;
    }

    public AnimalApplication moveToReview(UUID organizationId, UUID actorId, UUID applicationId, Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        return move(organizationId, actorId, applicationId, ApplicationStatus.REVIEW, null, expectedVersion);
    }

    /**
     * Approval does not touch the animal. Finalization is a separate step.
     */
    public AnimalApplication approve(UUID organizationId, UUID actorId, UUID applicationId, String notes,
                                     Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        return move(organizationId, actorId, applicationId, ApplicationStatus.APPROVED, notes, expectedVersion);
    }

    public AnimalApplication deny(UUID organizationId, UUID actorId, UUID applicationId, String notes,
                                  Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        return move(organizationId, actorId, applicationId, ApplicationStatus.DENIED, notes, expectedVersion);
    }

    public AnimalApplication withdraw(UUID organizationId, UUID actorId, UUID applicationId, Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.VOLUNTEER);
        return move(organizationId, actorId, applicationId, ApplicationStatus.WITHDRAWN, null, expectedVersion);
    }

    @Transactional(readOnly = true)
    public AnimalApplication getApplication(UUID organizationId, UUID actorId, UUID applicationId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return applicationRepository.findByIdAndOrganizationId(applicationId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Application"));
    }

    @Transactional(readOnly = true)
    public List<AnimalApplication> listApplications(UUID organizationId, UUID actorId, ApplicationStatus status) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (status == null) {
            return applicationRepository.findByOrganizationIdOrderByCreatedAtDesc(organizationId);
        }
        return applicationRepository.findByOrganizationIdAndStatusOrderByCreatedAtDesc(organizationId, status);
    }

    @Transactional(readOnly = true)
    public Map<PipelineStage, List<AnimalApplication>> board(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        Map<PipelineStage, List<AnimalApplication>> columns = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            columns.put(stage, new ArrayList<>());
        }
        for (AnimalApplication application : applicationRepository.findBoardApplications(organizationId)) {
            application.getStage().ifPresent(stage -> columns.get(stage).add(application));
        }
        return columns;
    }

    /**
     * Locks an application for finalization by the placement module.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AnimalApplication lockApplication(UUID organizationId, UUID applicationId) {
        return applicationRepository.findByIdForUpdate(applicationId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Application"));
    }

    /**
     * Checks that a locked application can be turned into a placement of the given kind.
     */
    public void requireFinalizable(AnimalApplication application, ApplicationKind kind) {
        if (application.getStatus() != ApplicationStatus.APPROVED || application.getKind() != kind) {
            throw new ProblemException(ErrorCode.APPLICATION_NOT_APPROVED,
                    "an approved " + kind.name().toLowerCase() + " application is required");
        }
        if (application.isFinalized()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "application already finalized");
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markFinalized(AnimalApplication application, UUID actorId, UUID placementId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        application.setFinalizedAt(now);
        auditLogService.record(new AuditLogCommand(application.getOrganizationId(), actorId,
                AuditAction.APPLICATION_FINALIZED, ENTITY_APPLICATION, application.getId(),
                AuditSnapshot.of("finalizedAt", null),
                AuditSnapshot.of("finalizedAt", now, "placementId", placementId)));
    }

    private AnimalApplication move(UUID organizationId, UUID actorId, UUID applicationId,
                                   ApplicationStatus target, String notes, Long expectedVersion) {
        AnimalApplication application = applicationRepository.findByIdForUpdate(applicationId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Application"));
        application.checkVersion(expectedVersion, ENTITY_APPLICATION);

        ApplicationStatus from = application.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "cannot move application from " + from + " to " + target);
        }
        application.setStatus(target);
        if (notes != null && !notes.isBlank()) {
            application.setReviewNotes(notes.trim());
        }
        if (target == ApplicationStatus.APPROVED || target == ApplicationStatus.DENIED) {
            application.setDecidedAt(OffsetDateTime.now(clock));
            application.setDecidedBy(actorId);
        }

        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.APPLICATION_STATUS_CHANGED,
                ENTITY_APPLICATION, application.getId(),
                AuditSnapshot.of("status", from),
                AuditSnapshot.of("status", target, "reviewNotes", application.getReviewNotes())));
        log.info("Application {} moved {} -> {}", application.getId(), from, target);
        return application;
    }

    public record SubmitCommand(UUID animalId, UUID personId, ApplicationKind kind, Map<String, Object> form) {
    }
}
