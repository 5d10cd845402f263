package com.fourpaws.backend.modules.medical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.application.AnimalService;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.medical.application.BatchCompletionResult;
import com.fourpaws.backend.modules.medical.application.MedicalRecurrenceProperties;
import com.fourpaws.backend.modules.medical.application.MedicalTaskService;
import com.fourpaws.backend.modules.medical.application.MedicalTaskService.CompletionCommand;
import com.fourpaws.backend.modules.medical.application.MedicalTaskService.CompletionResult;
import com.fourpaws.backend.modules.medical.application.MedicalTaskService.TaskCommand;
import com.fourpaws.backend.modules.medical.application.RecurrencePolicy;
import com.fourpaws.backend.modules.medical.domain.MedicalRecord;
import com.fourpaws.backend.modules.medical.domain.MedicalTask;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskStatus;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskType;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalRecordRepository;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalTaskRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class MedicalTaskServiceTest {

    private static final UUID ORG_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private MedicalTaskRepository taskRepository;

    @Mock
    private MedicalRecordRepository recordRepository;

    @Mock
    private AnimalService animalService;

    @Mock
    private TenantAuthorizationService authorizationService;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private MedicalTaskService medicalTaskService;
    private Animal animal;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2024-01-10T09:00:00Z").toInstant(), ZoneOffset.UTC);
        medicalTaskService = new MedicalTaskService(
                taskRepository,
                recordRepository,
                animalService,
                new RecurrencePolicy(new MedicalRecurrenceProperties()),
                authorizationService,
                auditLogService,
                transactionManager,
                clock
        );

        animal = TestEntities.withId(new Animal(), UUID.randomUUID());
        animal.setOrganizationId(ORG_ID);
        animal.setName("Mochi");
        animal.setSpecies("cat");
        animal.setIntakeDate(LocalDate.of(2023, 12, 1));

        lenient().when(taskRepository.save(any(MedicalTask.class))).thenAnswer(invocation -> {
            MedicalTask task = invocation.getArgument(0);
            if (task.getId() == null) {
                TestEntities.withId(task, UUID.randomUUID());
            }
            return task;
        });
        lenient().when(recordRepository.save(any(MedicalRecord.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<MedicalRecord>getArgument(0), UUID.randomUUID()));
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    }

    @Test
    @DisplayName("completing a vaccine writes a record and schedules the yearly booster")
    void completeVaccineSchedulesFollowUp() {
        MedicalTask task = task(MedicalTaskType.VACCINE, MedicalTaskStatus.SCHEDULED);

        CompletionResult result = medicalTaskService.completeTask(ORG_ID, ACTOR_ID, task.getId(),
                CompletionCommand.defaults());

        assertThat(result.task().getStatus()).isEqualTo(MedicalTaskStatus.COMPLETED);
        assertThat(result.task().getCompletedBy()).isEqualTo(ACTOR_ID);
        assertThat(result.record().getPerformedOn()).isEqualTo(LocalDate.of(2024, 1, 10));
        assertThat(result.record().getTaskId()).isEqualTo(task.getId());
        assertThat(result.followUp()).isNotNull();
        assertThat(result.followUp().getDueDate()).isEqualTo(LocalDate.of(2025, 1, 10));
        assertThat(result.followUp().getFollowUpOf()).isEqualTo(task.getId());
        assertThat(result.followUp().getStatus()).isEqualTo(MedicalTaskStatus.SCHEDULED);
    }

    @Test
    void followUpCanBeSkippedPerRequest() {
        MedicalTask task = task(MedicalTaskType.VACCINE, MedicalTaskStatus.IN_PROGRESS);

        CompletionResult result = medicalTaskService.completeTask(ORG_ID, ACTOR_ID, task.getId(),
                new CompletionCommand(null, "booster not needed", false, null));

        assertThat(result.followUp()).isNull();
    }

    @Test
    void noFollowUpForAnAnimalOutOfCare() {
        animal.setStatus(AnimalStatus.TRANSFERRED);
        MedicalTask task = task(MedicalTaskType.CHECKUP, MedicalTaskStatus.SCHEDULED);

        CompletionResult result = medicalTaskService.completeTask(ORG_ID, ACTOR_ID, task.getId(),
                CompletionCommand.defaults());

        assertThat(result.followUp()).isNull();
        assertThat(result.record()).isNotNull();
    }

    @Test
    void completingTwiceFailsAlreadyTerminal() {
        MedicalTask task = task(MedicalTaskType.EXAM, MedicalTaskStatus.SCHEDULED);
        medicalTaskService.completeTask(ORG_ID, ACTOR_ID, task.getId(), CompletionCommand.defaults());

        assertThatThrownBy(() -> medicalTaskService.completeTask(ORG_ID, ACTOR_ID, task.getId(),
                CompletionCommand.defaults()))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.ALREADY_TERMINAL)).isTrue());

        verify(recordRepository, times(1)).save(any(MedicalRecord.class));
        verify(taskRepository, times(1)).save(any(MedicalTask.class));
        assertThat(task.getStatus()).isEqualTo(MedicalTaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("batch completion reports failures per task and keeps the successes")
    void batchCompleteReportsPartialFailure() {
        MedicalTask open = task(MedicalTaskType.TREATMENT, MedicalTaskStatus.SCHEDULED);
        MedicalTask done = task(MedicalTaskType.TREATMENT, MedicalTaskStatus.COMPLETED);

        BatchCompletionResult result = medicalTaskService.batchComplete(ORG_ID, ACTOR_ID,
                List.of(open.getId(), done.getId()));

        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.taskId()).isEqualTo(done.getId());
            assertThat(failure.reason()).isEqualTo(ErrorCode.ALREADY_TERMINAL.name());
        });
        assertThat(open.getStatus()).isEqualTo(MedicalTaskStatus.COMPLETED);
        verify(transactionManager).rollback(any());
    }

    @Test
    void batchCompleteReportsUnknownTasks() {
        UUID missing = UUID.randomUUID();
        when(taskRepository.findByIdForUpdate(missing, ORG_ID)).thenReturn(Optional.empty());

        BatchCompletionResult result = medicalTaskService.batchComplete(ORG_ID, ACTOR_ID, List.of(missing));

        assertThat(result.updated()).isZero();
        assertThat(result.failures()).extracting(BatchCompletionResult.Failure::reason)
                .containsExactly(ErrorCode.UNKNOWN_ENTITY.name());
    }

    @Test
    @DisplayName("a lock conflict on one task is reported for that task and the rest of the batch still runs")
    void batchCompleteReportsLockConflictsPerTask() {
        MedicalTask open = task(MedicalTaskType.TREATMENT, MedicalTaskStatus.SCHEDULED);
        UUID contended = UUID.randomUUID();
        UUID broken = UUID.randomUUID();
        when(taskRepository.findByIdForUpdate(contended, ORG_ID))
                .thenThrow(new CannotAcquireLockException("deadlock detected"));
        when(taskRepository.findByIdForUpdate(broken, ORG_ID))
                .thenThrow(new DataIntegrityViolationException("constraint violated"));

        BatchCompletionResult result = medicalTaskService.batchComplete(ORG_ID, ACTOR_ID,
                List.of(open.getId(), contended, broken));

        assertThat(result.updated()).isEqualTo(1);
        assertThat(open.getStatus()).isEqualTo(MedicalTaskStatus.COMPLETED);
        assertThat(result.failures())
                .extracting(BatchCompletionResult.Failure::taskId, BatchCompletionResult.Failure::reason)
                .containsExactly(
                        tuple(contended, ErrorCode.CONCURRENT_MODIFICATION.name()),
                        tuple(broken, BatchCompletionResult.STORE_FAILURE));
        verify(transactionManager, times(2)).rollback(any());
    }

    @Test
    void batchCompleteByANonMemberFailsBeforeAnyTask() {
        MedicalTask open = task(MedicalTaskType.TREATMENT, MedicalTaskStatus.SCHEDULED);
        doThrow(new ProblemException(ErrorCode.NOT_A_MEMBER))
                .when(authorizationService).requireRole(ACTOR_ID, ORG_ID, MembershipRole.STAFF);

        assertThatThrownBy(() -> medicalTaskService.batchComplete(ORG_ID, ACTOR_ID, List.of(open.getId())))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.NOT_A_MEMBER)).isTrue());
        assertThat(open.getStatus()).isEqualTo(MedicalTaskStatus.SCHEDULED);
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    void createTaskOnTerminalAnimalFails() {
        animal.setStatus(AnimalStatus.ADOPTED);
        when(animalService.requireAnimal(ORG_ID, animal.getId())).thenReturn(animal);

        assertThatThrownBy(() -> medicalTaskService.createTask(ORG_ID, ACTOR_ID,
                new TaskCommand(animal.getId(), MedicalTaskType.VACCINE, null, LocalDate.of(2024, 2, 1), null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.ALREADY_TERMINAL)).isTrue());
        verify(taskRepository, never()).save(any());
    }

    @Test
    void createTaskRejectsAnAssigneeOutsideTheOrganization() {
        UUID stranger = UUID.randomUUID();
        when(animalService.requireAnimal(ORG_ID, animal.getId())).thenReturn(animal);
        when(authorizationService.isMember(stranger, ORG_ID)).thenReturn(false);

        assertThatThrownBy(() -> medicalTaskService.createTask(ORG_ID, ACTOR_ID,
                new TaskCommand(animal.getId(), MedicalTaskType.EXAM, "Dental", LocalDate.of(2024, 2, 1), stranger, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.UNKNOWN_ENTITY)).isTrue());
    }

    @Test
    void createTaskDefaultsTheTitleFromItsType() {
        when(animalService.requireAnimal(ORG_ID, animal.getId())).thenReturn(animal);

        MedicalTask task = medicalTaskService.createTask(ORG_ID, ACTOR_ID,
                new TaskCommand(animal.getId(), MedicalTaskType.VACCINE, " ", LocalDate.of(2024, 2, 1), null, null));

        assertThat(task.getTitle()).isEqualTo("Vaccine");
        assertThat(task.getStatus()).isEqualTo(MedicalTaskStatus.SCHEDULED);
    }

    @Test
    void terminalStatusCannotBeSetThroughChangeStatus() {
        MedicalTask task = task(MedicalTaskType.EXAM, MedicalTaskStatus.SCHEDULED);

        assertThatThrownBy(() -> medicalTaskService.changeStatus(ORG_ID, ACTOR_ID, task.getId(),
                MedicalTaskStatus.COMPLETED, null))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_TRANSITION)).isTrue());

        MedicalTask moved = medicalTaskService.changeStatus(ORG_ID, ACTOR_ID, task.getId(),
                MedicalTaskStatus.ON_HOLD, null);
        assertThat(moved.getStatus()).isEqualTo(MedicalTaskStatus.ON_HOLD);
    }

    @Test
    void cancelledTaskCannotBeCancelledAgain() {
        MedicalTask task = task(MedicalTaskType.SURGERY, MedicalTaskStatus.CANCELLED);

        assertThatThrownBy(() -> medicalTaskService.cancelTask(ORG_ID, ACTOR_ID, task.getId(), null))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.ALREADY_TERMINAL)).isTrue());
    }

    private MedicalTask task(MedicalTaskType type, MedicalTaskStatus status) {
        MedicalTask task = TestEntities.withId(new MedicalTask(), UUID.randomUUID());
        task.setOrganizationId(ORG_ID);
        task.setAnimal(animal);
        task.setType(type);
        task.setTitle(type.name());
        task.setDueDate(LocalDate.of(2024, 1, 9));
        task.setStatus(status);
        lenient().when(taskRepository.findByIdForUpdate(task.getId(), ORG_ID)).thenReturn(Optional.of(task));
        return task;
    }
}
