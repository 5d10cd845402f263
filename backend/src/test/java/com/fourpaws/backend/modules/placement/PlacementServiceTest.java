package com.fourpaws.backend.modules.placement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.application.AnimalLifecycleService;
import com.fourpaws.backend.modules.animal.application.AnimalService;
import com.fourpaws.backend.modules.animal.application.TransitionCommand;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.animal.domain.Outcome;
import com.fourpaws.backend.modules.animal.domain.OutcomeType;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.OutcomeRepository;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.person.application.PersonService;
import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.person.domain.PersonType;
import com.fourpaws.backend.modules.pipeline.application.ApplicationPipelineService;
import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationKind;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;
import com.fourpaws.backend.modules.pipeline.infrastructure.persistence.ApplicationRepository;
import com.fourpaws.backend.modules.placement.application.FosterAssignmentManager;
import com.fourpaws.backend.modules.placement.application.PlacementService;
import com.fourpaws.backend.modules.placement.application.PlacementService.AdoptionCommand;
import com.fourpaws.backend.modules.placement.application.PlacementService.EndFosterCommand;
import com.fourpaws.backend.modules.placement.application.PlacementService.FosterCommand;
import com.fourpaws.backend.modules.placement.domain.Adoption;
import com.fourpaws.backend.modules.placement.domain.FosterAssignment;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.AdoptionRepository;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.FosterAssignmentRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Runs the placement flows against the real lifecycle and pipeline services with mocked
 * repositories.
 */
@ExtendWith(MockitoExtension.class)
class PlacementServiceTest {

    private static final UUID ORG_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID STAFF_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private AdoptionRepository adoptionRepository;

    @Mock
    private FosterAssignmentRepository assignmentRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private AnimalRepository animalRepository;

    @Mock
    private OutcomeRepository outcomeRepository;

    @Mock
    private AnimalService animalService;

    @Mock
    private PersonService personService;

    @Mock
    private TenantAuthorizationService authorizationService;

    @Mock
    private AuditLogService auditLogService;

    private PlacementService placementService;
    private AnimalLifecycleService lifecycleService;
    private List<Outcome> outcomes;
    private Animal animal;
    private Person person;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2024-05-20T12:00:00Z").toInstant(), ZoneOffset.UTC);
        FosterAssignmentManager assignmentManager = new FosterAssignmentManager(assignmentRepository, auditLogService, clock);
        lifecycleService = new AnimalLifecycleService(animalRepository, outcomeRepository,
                assignmentManager, authorizationService, auditLogService, clock);
        ApplicationPipelineService pipelineService = new ApplicationPipelineService(applicationRepository,
                animalService, personService, authorizationService, auditLogService, clock);
        placementService = new PlacementService(adoptionRepository, assignmentRepository, assignmentManager,
                pipelineService, lifecycleService, authorizationService, auditLogService, clock);

        animal = TestEntities.withId(new Animal(), UUID.randomUUID());
        animal.setOrganizationId(ORG_ID);
        animal.setName("Pepper");
        animal.setSpecies("dog");
        animal.setIntakeDate(LocalDate.of(2024, 4, 1));
        animal.setStatus(AnimalStatus.AVAILABLE);
        lenient().when(animalRepository.findByIdForUpdate(animal.getId(), ORG_ID)).thenReturn(Optional.of(animal));

        person = TestEntities.withId(new Person(), UUID.randomUUID());
        person.setOrganizationId(ORG_ID);
        person.setType(PersonType.ADOPTER);
        person.setFullName("Dana Reyes");

        outcomes = new ArrayList<>();
        lenient().when(outcomeRepository.save(any(Outcome.class))).thenAnswer(invocation -> {
            Outcome outcome = TestEntities.withId(invocation.<Outcome>getArgument(0), UUID.randomUUID());
            outcomes.add(outcome);
            return outcome;
        });
        lenient().when(adoptionRepository.save(any(Adoption.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<Adoption>getArgument(0), UUID.randomUUID()));
        lenient().when(assignmentRepository.saveAndFlush(any(FosterAssignment.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<FosterAssignment>getArgument(0), UUID.randomUUID()));
    }

    @Test
    @DisplayName("finalizing an approved adoption adopts the animal, records the outcome and completes the application")
    void finalizeAdoption() {
        AnimalApplication application = application(ApplicationKind.ADOPTION, ApplicationStatus.APPROVED);

        Adoption adoption = placementService.finalizeAdoption(ORG_ID, STAFF_ID, application.getId(),
                new AdoptionCommand(15000, null, null, "C-17", null, null));

        assertThat(animal.getStatus()).isEqualTo(AnimalStatus.ADOPTED);
        assertThat(adoption.getFeeCents()).isEqualTo(15000);
        assertThat(adoption.getDonationCents()).isZero();
        assertThat(adoption.getAdoptionDate()).isEqualTo(LocalDate.of(2024, 5, 20));
        assertThat(adoption.getAdopter()).isSameAs(person);
        assertThat(outcomes).singleElement().satisfies(outcome -> {
            assertThat(outcome.getType()).isEqualTo(OutcomeType.ADOPTION);
            assertThat(outcome.getDestination()).isEqualTo("Dana Reyes");
        });
        assertThat(application.isFinalized()).isTrue();
        assertThat(application.getStage()).contains(PipelineStage.COMPLETED);

        ArgumentCaptor<AuditLogCommand> audits = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, atLeastOnce()).record(audits.capture());
        assertThat(audits.getAllValues()).extracting(AuditLogCommand::action).containsExactly(
                AuditAction.ANIMAL_STATUS_CHANGED,
                AuditAction.OUTCOME_RECORDED,
                AuditAction.ADOPTION_CREATED,
                AuditAction.APPLICATION_FINALIZED);
    }

    @Test
    void negativeFeeIsRejectedBeforeAnythingIsLocked() {
        assertThatThrownBy(() -> placementService.finalizeAdoption(ORG_ID, STAFF_ID, UUID.randomUUID(),
                new AdoptionCommand(-1, null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_AMOUNT)).isTrue());
        verify(applicationRepository, never()).findByIdForUpdate(any(), any());
    }

    @Test
    void applicationUnderReviewCannotBeFinalized() {
        AnimalApplication application = application(ApplicationKind.ADOPTION, ApplicationStatus.REVIEW);

        assertThatThrownBy(() -> placementService.finalizeAdoption(ORG_ID, STAFF_ID, application.getId(),
                new AdoptionCommand(0, 0L, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.APPLICATION_NOT_APPROVED)).isTrue());
        assertThat(animal.getStatus()).isEqualTo(AnimalStatus.AVAILABLE);
    }

    @Test
    void fosterApplicationCannotBeFinalizedAsAdoption() {
        AnimalApplication application = application(ApplicationKind.FOSTER, ApplicationStatus.APPROVED);

        assertThatThrownBy(() -> placementService.finalizeAdoption(ORG_ID, STAFF_ID, application.getId(),
                new AdoptionCommand(0, null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.APPLICATION_NOT_APPROVED)).isTrue());
    }

    @Test
    void secondFinalizationFailsAlreadyTerminal() {
        AnimalApplication application = application(ApplicationKind.ADOPTION, ApplicationStatus.APPROVED);
        application.setFinalizedAt(OffsetDateTime.parse("2024-05-01T00:00:00Z"));

        assertThatThrownBy(() -> placementService.finalizeAdoption(ORG_ID, STAFF_ID, application.getId(),
                new AdoptionCommand(0, null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.ALREADY_TERMINAL)).isTrue());
    }

    @Test
    void placeFosterOpensAssignmentAndMovesAnimal() {
        AnimalApplication application = application(ApplicationKind.FOSTER, ApplicationStatus.APPROVED);
        when(assignmentRepository.countActiveByAnimal(ORG_ID, animal.getId())).thenReturn(0L, 1L);

        FosterAssignment assignment = placementService.placeFoster(ORG_ID, STAFF_ID, application.getId(),
                new FosterCommand(LocalDate.of(2024, 5, 21), null));

        assertThat(assignment.getStatus()).isEqualTo(FosterAssignmentStatus.ACTIVE);
        assertThat(assignment.getStartDate()).isEqualTo(LocalDate.of(2024, 5, 21));
        assertThat(animal.getStatus()).isEqualTo(AnimalStatus.FOSTERED);
        assertThat(application.isFinalized()).isTrue();
    }

    @Test
    void secondActiveFosterIsRejected() {
        AnimalApplication application = application(ApplicationKind.FOSTER, ApplicationStatus.APPROVED);
        animal.setStatus(AnimalStatus.FOSTERED);
        when(assignmentRepository.countActiveByAnimal(ORG_ID, animal.getId())).thenReturn(1L);

        assertThatThrownBy(() -> placementService.placeFoster(ORG_ID, STAFF_ID, application.getId(),
                new FosterCommand(null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.ANIMAL_ALREADY_FOSTERED)).isTrue());
        verify(assignmentRepository, never()).saveAndFlush(any());
        assertThat(application.isFinalized()).isFalse();
    }

    @Test
    void endFosterReturnsTheAnimalToHold() {
        animal.setStatus(AnimalStatus.FOSTERED);
        FosterAssignment assignment = activeAssignment();

        FosterAssignment ended = placementService.endFoster(ORG_ID, STAFF_ID, assignment.getId(),
                new EndFosterCommand(FosterAssignmentStatus.FAILED, AnimalStatus.HOLD, null, null));

        assertThat(ended.getStatus()).isEqualTo(FosterAssignmentStatus.FAILED);
        assertThat(ended.getEndDate()).isEqualTo(LocalDate.of(2024, 5, 20));
        assertThat(animal.getStatus()).isEqualTo(AnimalStatus.HOLD);
    }

    @Test
    @DisplayName("ending a foster locks the animal before the assignment, like a plain transition out of FOSTERED")
    void fosterLocksAreTakenAnimalFirst() {
        animal.setStatus(AnimalStatus.FOSTERED);
        FosterAssignment assignment = activeAssignment();

        placementService.endFoster(ORG_ID, STAFF_ID, assignment.getId(),
                new EndFosterCommand(FosterAssignmentStatus.COMPLETED, AnimalStatus.AVAILABLE, null, null));

        InOrder endFosterLocks = inOrder(animalRepository, assignmentRepository);
        endFosterLocks.verify(animalRepository).findByIdForUpdate(animal.getId(), ORG_ID);
        endFosterLocks.verify(assignmentRepository).findByIdForUpdate(assignment.getId(), ORG_ID);

        Animal second = TestEntities.withId(new Animal(), UUID.randomUUID());
        second.setOrganizationId(ORG_ID);
        second.setStatus(AnimalStatus.FOSTERED);
        when(animalRepository.findByIdForUpdate(second.getId(), ORG_ID)).thenReturn(Optional.of(second));

        lifecycleService.transition(ORG_ID, STAFF_ID, second.getId(), TransitionCommand.to(AnimalStatus.AVAILABLE));

        InOrder transitionLocks = inOrder(animalRepository, assignmentRepository);
        transitionLocks.verify(animalRepository).findByIdForUpdate(second.getId(), ORG_ID);
        transitionLocks.verify(assignmentRepository).findActiveByAnimalForUpdate(ORG_ID, second.getId());
    }

    @Test
    void endingAnUnknownAssignmentLocksNothing() {
        assertThatThrownBy(() -> placementService.endFoster(ORG_ID, STAFF_ID, UUID.randomUUID(),
                new EndFosterCommand(FosterAssignmentStatus.COMPLETED, AnimalStatus.AVAILABLE, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.UNKNOWN_ENTITY)).isTrue());
        verify(animalRepository, never()).findByIdForUpdate(any(), any());
        verify(assignmentRepository, never()).findByIdForUpdate(any(), any());
    }

    @Test
    void endFosterCannotAdoptTheAnimal() {
        assertThatThrownBy(() -> placementService.endFoster(ORG_ID, STAFF_ID, UUID.randomUUID(),
                new EndFosterCommand(FosterAssignmentStatus.COMPLETED, AnimalStatus.ADOPTED, null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_TRANSITION)).isTrue());
    }

    @Test
    void adoptingAFosteredAnimalClosesItsAssignment() {
        animal.setStatus(AnimalStatus.FOSTERED);
        FosterAssignment assignment = activeAssignment();
        when(assignmentRepository.findActiveByAnimalForUpdate(ORG_ID, animal.getId()))
                .thenReturn(Optional.of(assignment));
        AnimalApplication application = application(ApplicationKind.ADOPTION, ApplicationStatus.APPROVED);

        placementService.finalizeAdoption(ORG_ID, STAFF_ID, application.getId(),
                new AdoptionCommand(5000, 1000L, null, null, null, null));

        assertThat(assignment.getStatus()).isEqualTo(FosterAssignmentStatus.COMPLETED);
        assertThat(animal.getStatus()).isEqualTo(AnimalStatus.ADOPTED);
    }

    private AnimalApplication application(ApplicationKind kind, ApplicationStatus status) {
        AnimalApplication application = TestEntities.withId(new AnimalApplication(), UUID.randomUUID());
        application.setOrganizationId(ORG_ID);
        application.setAnimal(animal);
        application.setPerson(person);
        application.setKind(kind);
        application.setStatus(status);
        lenient().when(applicationRepository.findByIdForUpdate(application.getId(), ORG_ID))
                .thenReturn(Optional.of(application));
        return application;
    }

    private FosterAssignment activeAssignment() {
        FosterAssignment assignment = TestEntities.withId(new FosterAssignment(), UUID.randomUUID());
        assignment.setOrganizationId(ORG_ID);
        assignment.setAnimal(animal);
        assignment.setPerson(person);
        assignment.setStatus(FosterAssignmentStatus.ACTIVE);
        assignment.setStartDate(LocalDate.of(2024, 5, 1));
        lenient().when(assignmentRepository.findAnimalIdById(assignment.getId(), ORG_ID))
                .thenReturn(Optional.of(animal.getId()));
        lenient().when(assignmentRepository.findByIdForUpdate(assignment.getId(), ORG_ID))
                .thenReturn(Optional.of(assignment));
        return assignment;
    }
}
