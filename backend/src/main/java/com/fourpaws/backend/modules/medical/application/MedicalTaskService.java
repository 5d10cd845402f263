package com.fourpaws.backend.modules.medical.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.application.AnimalService;
import com.fourpaws.backend.modules.animal.domain.Animal;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.medical.domain.MedicalRecord;
import com.fourpaws.backend.modules.medical.domain.MedicalTask;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskStatus;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskType;
import com.fourpaws.backend.modules.medical.domain.TaskClassification;
import com.fourpaws.backend.modules.medical.domain.TaskClassifier;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalRecordRepository;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalTaskRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@Transactional
public class MedicalTaskService {

    private static final Logger log = LoggerFactory.getLogger(MedicalTaskService.class);
    private static final String ENTITY_TASK = "MEDICAL_TASK";
    private static final String ENTITY_RECORD = "MEDICAL_RECORD";

    private final MedicalTaskRepository taskRepository;
    private final MedicalRecordRepository recordRepository;
    private final AnimalService animalService;
    private final RecurrencePolicy recurrencePolicy;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;
    private final TransactionTemplate itemTransaction;
    private final Clock clock;

    public MedicalTaskService(
            MedicalTaskRepository taskRepository,
            MedicalRecordRepository recordRepository,
            AnimalService animalService,
            RecurrencePolicy recurrencePolicy,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.animalService = animalService;
        this.recurrencePolicy = recurrencePolicy;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
        this.itemTransaction = new TransactionTemplate(transactionManager);
        this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public MedicalTask createTask(UUID organizationId, UUID actorId, TaskCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Animal animal = animalService.requireAnimal(organizationId, command.animalId());
        if (!animal.isInCare()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "animal is no longer in care");
        }
        requireAssignee(organizationId, command.assignedTo());

        MedicalTask task = new MedicalTask();
        task.setOrganizationId(organizationId);
        task.setAnimal(animal);
        task.setType(command.type());
        task.setTitle(titleOrDefault(command.title(), command.type()));
        task.setDueDate(command.dueDate());
        task.setAssignedTo(command.assignedTo());
        task.setNotes(command.notes());
        task.setStatus(MedicalTaskStatus.SCHEDULED);
        MedicalTask saved = taskRepository.save(task);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.MEDICAL_TASK_CREATED,
                ENTITY_TASK, saved.getId(), taskSnapshot(saved)));
        return saved;
    }

    /**
     * Completes a task, writes its medical record and, when the recurrence policy yields an
     * interval, schedules the follow-up due {@code completedOn + interval}.
     *
     * @throws ProblemException {@code ALREADY_TERMINAL} when the task is completed or cancelled
     */
    public CompletionResult completeTask(UUID organizationId, UUID actorId, UUID taskId, CompletionCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        MedicalTask task = lockTask(organizationId, taskId);
        task.checkVersion(command.expectedVersion(), ENTITY_TASK);
        requireOpen(task);

        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate completedOn = command.completedOn() != null ? command.completedOn() : LocalDate.now(clock);
        MedicalTaskStatus previous = task.getStatus();
        task.setStatus(MedicalTaskStatus.COMPLETED);
        task.setCompletedAt(now);
        task.setCompletedBy(actorId);
        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.MEDICAL_TASK_COMPLETED,
                ENTITY_TASK, task.getId(),
                AuditSnapshot.of("status", previous),
                AuditSnapshot.of("status", task.getStatus(), "completedOn", completedOn, "completedBy", actorId)));

        MedicalRecord record = saveRecord(task.getAnimal(), actorId, task.getId(), task.getType(), task.getTitle(),
                completedOn, command.notes());

        MedicalTask followUp = null;
        if (command.scheduleFollowUp() && task.getAnimal().isInCare()) {
            followUp = recurrencePolicy.nextDueDate(task.getType(), completedOn)
                    .map(dueDate -> scheduleFollowUp(task, actorId, dueDate))
                    .orElse(null);
        }
        log.info("Medical task {} completed by {}", task.getId(), actorId);
        return new CompletionResult(task, record, followUp);
    }

    /**
     * Completes each task in its own transaction. A failing task is reported and skipped;
     * tasks completed before it stay committed. Store failures on one task, lock conflicts
     * included, become per-task failures as well.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BatchCompletionResult batchComplete(UUID organizationId, UUID actorId, List<UUID> taskIds) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        int updated = 0;
        List<BatchCompletionResult.Failure> failures = new ArrayList<>();
        for (UUID taskId : taskIds) {
            try {
                itemTransaction.executeWithoutResult(status ->
                        completeTask(organizationId, actorId, taskId, CompletionCommand.defaults()));
                updated++;
            } catch (ProblemException ex) {
                log.warn("Batch completion skipped task {}: {}", taskId, ex.getCode());
                failures.add(new BatchCompletionResult.Failure(taskId, ex.getCode()));
            } catch (ConcurrencyFailureException ex) {
                log.warn("Batch completion skipped task {}: lock conflict ({})", taskId, ex.getClass().getSimpleName());
                failures.add(new BatchCompletionResult.Failure(taskId, ErrorCode.CONCURRENT_MODIFICATION.name()));
            } catch (DataAccessException ex) {
                log.warn("Batch completion skipped task {}: store failure", taskId, ex);
                failures.add(new BatchCompletionResult.Failure(taskId, BatchCompletionResult.STORE_FAILURE));
            }
        }
        return new BatchCompletionResult(updated, failures);
    }

    /**
     * Moves an open task between the working states. COMPLETED is reached only through
     * {@link #completeTask} and CANCELLED through {@link #cancelTask}.
     */
    public MedicalTask changeStatus(UUID organizationId, UUID actorId, UUID taskId,
                                    MedicalTaskStatus target, Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        MedicalTask task = lockTask(organizationId, taskId);
        task.checkVersion(expectedVersion, ENTITY_TASK);
        requireOpen(task);
        if (target == null || target.isTerminal()) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION, "status " + target + " cannot be set directly");
        }
        MedicalTaskStatus previous = task.getStatus();
        if (previous == target) {
            return task;
        }
        task.setStatus(target);
        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.MEDICAL_TASK_STATUS_CHANGED,
                ENTITY_TASK, task.getId(), AuditSnapshot.of("status", previous), AuditSnapshot.of("status", target)));
        return task;
    }

    public MedicalTask cancelTask(UUID organizationId, UUID actorId, UUID taskId, Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        MedicalTask task = lockTask(organizationId, taskId);
        task.checkVersion(expectedVersion, ENTITY_TASK);
        requireOpen(task);
        MedicalTaskStatus previous = task.getStatus();
        task.setStatus(MedicalTaskStatus.CANCELLED);
        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.MEDICAL_TASK_STATUS_CHANGED,
                ENTITY_TASK, task.getId(), AuditSnapshot.of("status", previous),
                AuditSnapshot.of("status", MedicalTaskStatus.CANCELLED)));
        return task;
    }

    @Transactional(readOnly = true)
    public List<ClassifiedTask> listTasks(UUID organizationId, UUID actorId, UUID animalId,
                                          LocalDate asOf, TaskClassification classification) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        LocalDate effectiveAsOf = asOf != null ? asOf : LocalDate.now(clock);
        List<MedicalTask> tasks;
        if (animalId != null) {
            animalService.requireAnimal(organizationId, animalId);
            tasks = taskRepository.findByAnimal(organizationId, animalId);
        } else {
            tasks = taskRepository.findByOrganizationIdOrderByDueDateAscTitleAsc(organizationId);
        }
        return tasks.stream()
                .map(task -> new ClassifiedTask(task, TaskClassifier.classify(task, effectiveAsOf)))
                .filter(item -> classification == null || item.classification() == classification)
                .toList();
    }

    @Transactional(readOnly = true)
    public ClassifiedTask getTask(UUID organizationId, UUID actorId, UUID taskId, LocalDate asOf) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        MedicalTask task = taskRepository.findByIdAndOrganizationId(taskId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("MedicalTask"));
        return new ClassifiedTask(task, TaskClassifier.classify(task, asOf != null ? asOf : LocalDate.now(clock)));
    }

    public MedicalRecord recordDirectCare(UUID organizationId, UUID actorId, UUID animalId, DirectCareCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Animal animal = animalService.requireAnimal(organizationId, animalId);
        LocalDate performedOn = command.performedOn() != null ? command.performedOn() : LocalDate.now(clock);
        return saveRecord(animal, actorId, null, command.type(), titleOrDefault(command.title(), command.type()),
                performedOn, command.notes());
    }

    @Transactional(readOnly = true)
    public List<MedicalRecord> listRecords(UUID organizationId, UUID actorId, UUID animalId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        animalService.requireAnimal(organizationId, animalId);
        return recordRepository.findByAnimal(organizationId, animalId);
    }

    private MedicalTask scheduleFollowUp(MedicalTask completed, UUID actorId, LocalDate dueDate) {
        MedicalTask followUp = new MedicalTask();
        followUp.setOrganizationId(completed.getOrganizationId());
        followUp.setAnimal(completed.getAnimal());
        followUp.setType(completed.getType());
        followUp.setTitle(completed.getTitle());
        followUp.setDueDate(dueDate);
        followUp.setAssignedTo(completed.getAssignedTo());
        followUp.setFollowUpOf(completed.getId());
        followUp.setStatus(MedicalTaskStatus.SCHEDULED);
        MedicalTask saved = taskRepository.save(followUp);

        auditLogService.record(AuditLogCommand.created(completed.getOrganizationId(), actorId,
                AuditAction.MEDICAL_TASK_CREATED, ENTITY_TASK, saved.getId(), taskSnapshot(saved)));
        return saved;
    }

    private MedicalRecord saveRecord(Animal animal, UUID actorId, UUID taskId, MedicalTaskType type, String title,
                                     LocalDate performedOn, String notes) {
        MedicalRecord record = new MedicalRecord();
        record.setOrganizationId(animal.getOrganizationId());
        record.setAnimal(animal);
        record.setTaskId(taskId);
        record.setType(type);
        record.setTitle(title);
        record.setPerformedOn(performedOn);
        record.setPerformedBy(actorId);
        record.setNotes(notes);
        record.setCreatedAt(OffsetDateTime.now(clock));
        MedicalRecord saved = recordRepository.save(record);

        auditLogService.record(AuditLogCommand.created(animal.getOrganizationId(), actorId,
                AuditAction.MEDICAL_RECORD_CREATED, ENTITY_RECORD, saved.getId(),
                AuditSnapshot.of("animalId", animal.getId(), "taskId", taskId, "type", type,
                        "performedOn", performedOn)));
        return saved;
    }

    private MedicalTask lockTask(UUID organizationId, UUID taskId) {
        return taskRepository.findByIdForUpdate(taskId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("MedicalTask"));
    }

    private void requireOpen(MedicalTask task) {
        if (task.getStatus().isTerminal()) {
            throw new ProblemException(ErrorCode.ALREADY_TERMINAL, "task is " + task.getStatus());
        }
    }

    private void requireAssignee(UUID organizationId, UUID assignedTo) {
        if (assignedTo != null && !authorizationService.isMember(assignedTo, organizationId)) {
            throw ProblemException.unknownEntity("User");
        }
    }

    private static String titleOrDefault(String title, MedicalTaskType type) {
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        String name = type.name().toLowerCase();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static Map<String, Object> taskSnapshot(MedicalTask task) {
        return AuditSnapshot.of(
                "animalId", task.getAnimal().getId(),
                "type", task.getType(),
                "title", task.getTitle(),
                "dueDate", task.getDueDate(),
                "assignedTo", task.getAssignedTo(),
                "status", task.getStatus(),
                "followUpOf", task.getFollowUpOf()
        );
    }

    public record TaskCommand(
            UUID animalId,
            MedicalTaskType type,
            String title,
            LocalDate dueDate,
            UUID assignedTo,
            String notes
    ) {
    }

    public record CompletionCommand(LocalDate completedOn, String notes, boolean scheduleFollowUp, Long expectedVersion) {

        public static CompletionCommand defaults() {
            return new CompletionCommand(null, null, true, null);
        }
    }

    public record DirectCareCommand(MedicalTaskType type, String title, LocalDate performedOn, String notes) {
    }

    public record CompletionResult(MedicalTask task, MedicalRecord record, MedicalTask followUp) {
    }

    public record ClassifiedTask(MedicalTask task, TaskClassification classification) {
    }
}
