package com.fourpaws.backend.modules.animal.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.attribute.AttributeSchema;
import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.animal.domain.Intake;
import com.fourpaws.backend.modules.animal.domain.IntakeType;
import com.fourpaws.backend.modules.animal.domain.Outcome;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.IntakeRepository;
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
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AnimalService {

    private static final Logger log = LoggerFactory.getLogger(AnimalService.class);
    private static final AttributeSchema ATTRIBUTES = AttributeSchema.open("attributes");

    private final AnimalRepository animalRepository;
    private final IntakeRepository intakeRepository;
    private final OutcomeRepository outcomeRepository;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AnimalService(
            AnimalRepository animalRepository,
            IntakeRepository intakeRepository,
            OutcomeRepository outcomeRepository,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.animalRepository = animalRepository;
        this.intakeRepository = intakeRepository;
        this.outcomeRepository = outcomeRepository;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates the animal and its intake record. The animal starts in HOLD when the intake
     * flags a medical hold, AVAILABLE otherwise.
     */
    public Animal intake(UUID organizationId, UUID actorId, IntakeCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Map<String, Object> attributes = ATTRIBUTES.validate(command.attributes());
        LocalDate intakeDate = command.intakeDate() != null ? command.intakeDate() : LocalDate.now(clock);

        Animal animal = new Animal();
        animal.setOrganizationId(organizationId);
        animal.setName(command.name().trim());
        animal.setSpecies(command.species().trim().toLowerCase());
        animal.setBreed(command.breed());
        animal.setSex(command.sex());
        animal.setIntakeDate(intakeDate);
        animal.setLocationId(command.locationId());
        animal.setKennelId(command.kennelId());
        animal.setMicrochip(command.microchip());
        animal.setAttributes(attributes);
        animal.setStatus(command.medicalHold() ? AnimalStatus.HOLD : AnimalStatus.AVAILABLE);
        Animal saved = animalRepository.save(animal);

        Intake intake = new Intake();
        intake.setOrganizationId(organizationId);
        intake.setAnimal(saved);
        intake.setIntakeType(command.intakeType());
        intake.setSource(command.source());
        intake.setIntakeDate(intakeDate);
        intake.setMedicalHold(command.medicalHold());
        intake.setNotes(command.notes());
        intake.setRecordedBy(actorId);
        intake.setCreatedAt(OffsetDateTime.now(clock));
        intakeRepository.save(intake);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.ANIMAL_INTAKE,
                AnimalLifecycleService.ENTITY_ANIMAL, saved.getId(),
                AuditSnapshot.of("name", saved.getName(), "species", saved.getSpecies(),
                        "status", saved.getStatus(), "intakeType", command.intakeType(),
                        "intakeDate", intakeDate)));
        log.info("Animal {} taken in as {}", saved.getId(), saved.getStatus());
        return saved;
    }

    public Animal updateProfile(UUID organizationId, UUID actorId, UUID animalId, ProfileUpdate update) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Animal animal = animalRepository.findByIdForUpdate(animalId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Animal"));
        animal.checkVersion(update.expectedVersion(), AnimalLifecycleService.ENTITY_ANIMAL);
        if (animal.getStatus().isTerminal()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal already has an outcome");
        }

        Map<String, Object> before = profileSnapshot(animal);
        if (update.name() != null) {
            animal.setName(update.name().trim());
        }
        if (update.breed() != null) {
            animal.setBreed(update.breed());
        }
        if (update.sex() != null) {
            animal.setSex(update.sex());
        }
        if (update.locationId() != null) {
            animal.setLocationId(update.locationId());
        }
        if (update.kennelId() != null) {
            animal.setKennelId(update.kennelId());
        }
        if (update.microchip() != null) {
            animal.setMicrochip(update.microchip());
        }
        if (update.attributes() != null) {
            animal.setAttributes(ATTRIBUTES.validate(update.attributes()));
        }

        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.ANIMAL_UPDATED,
                AnimalLifecycleService.ENTITY_ANIMAL, animal.getId(), before, profileSnapshot(animal)));
        return animal;
    }

    @Transactional(readOnly = true)
    public Animal getAnimal(UUID organizationId, UUID actorId, UUID animalId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return requireAnimal(organizationId, animalId);
    }

    @Transactional(readOnly = true)
    public List<Animal> listAnimals(UUID organizationId, UUID actorId, AnimalStatus status) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (status == null) {
            return animalRepository.findByOrganizationIdOrderByIntakeDateDescNameAsc(organizationId);
        }
        return animalRepository.findByOrganizationIdAndStatusOrderByIntakeDateDescNameAsc(organizationId, status);
    }

    @Transactional(readOnly = true)
    public Intake getIntake(UUID organizationId, UUID actorId, UUID animalId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return intakeRepository.findByAnimal(animalId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Intake"));
    }

    @Transactional(readOnly = true)
    public Outcome getOutcome(UUID organizationId, UUID actorId, UUID animalId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return outcomeRepository.findByAnimal(animalId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Outcome"));
    }

    /**
     * Tenant-scoped lookup shared with the other modules. An id from another organization is
     * indistinguishable from a missing one.
     */
    @Transactional(readOnly = true)
    public Animal requireAnimal(UUID organizationId, UUID animalId) {
        return animalRepository.findByIdAndOrganizationId(animalId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Animal"));
    }

    private Map<String, Object> profileSnapshot(Animal animal) {
        return AuditSnapshot.of(
                "name", animal.getName(),
                "breed", animal.getBreed(),
                "sex", animal.getSex(),
                "locationId", animal.getLocationId(),
                "kennelId", animal.getKennelId(),
                "microchip", animal.getMicrochip(),
                "attributes", animal.getAttributes()
        );
    }

    public record IntakeCommand(
            String name,
            String species,
            String breed,
            String sex,
            IntakeType intakeType,
            String source,
            LocalDate intakeDate,
            boolean medicalHold,
            String locationId,
            String kennelId,
            String microchip,
            String notes,
            Map<String, Object> attributes
    ) {
    }

    public record ProfileUpdate(
            String name,
            String breed,
            String sex,
            String locationId,
            String kennelId,
            String microchip,
            Map<String, Object> attributes,
            Long expectedVersion
    ) {
    }
}
