package com.fourpaws.backend.modules.medical.presentation;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.medical.application.MedicalTaskService;
import com.fourpaws.backend.modules.medical.domain.TaskClassification;
import com.fourpaws.backend.modules.medical.domain.TaskClassifier;
import com.fourpaws.backend.modules.medical.presentation.dto.BatchCompleteRequest;
import com.fourpaws.backend.modules.medical.presentation.dto.BatchCompletionResponse;
import com.fourpaws.backend.modules.medical.presentation.dto.ChangeTaskStatusRequest;
import com.fourpaws.backend.modules.medical.presentation.dto.CompleteTaskRequest;
import com.fourpaws.backend.modules.medical.presentation.dto.CompletionResponse;
import com.fourpaws.backend.modules.medical.presentation.dto.CreateTaskRequest;
import com.fourpaws.backend.modules.medical.presentation.dto.DirectCareRequest;
import com.fourpaws.backend.modules.medical.presentation.dto.MedicalRecordResponse;
import com.fourpaws.backend.modules.medical.presentation.dto.MedicalTaskResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}")
public class MedicalController {

    private final MedicalTaskService medicalTaskService;
    private final Clock clock;

    public MedicalController(MedicalTaskService medicalTaskService, Clock clock) {
        this.medicalTaskService = medicalTaskService;
        this.clock = clock;
    }

    @PostMapping("/medical-tasks")
    public ResponseEntity<MedicalTaskResponse> createTask(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        var task = medicalTaskService.createTask(organizationId, SecurityUtils.getCurrentUserId(), request.toCommand());
        return ResponseEntity.status(201).body(MedicalTaskResponse.from(
                task, TaskClassifier.classify(task, LocalDate.now(clock)).name()));
    }

    @Operation(summary = "List medical tasks with their due classification")
    @GetMapping("/medical-tasks")
    public ResponseEntity<List<MedicalTaskResponse>> listTasks(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "animalId", required = false) UUID animalId,
            @Parameter(description = "Evaluation date; defaults to today in the shelter time zone")
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @RequestParam(name = "classification", required = false) TaskClassification classification
    ) {
        return ResponseEntity.ok(medicalTaskService.listTasks(
                        organizationId, SecurityUtils.getCurrentUserId(), animalId, asOf, classification)
                .stream()
                .map(MedicalTaskResponse::from)
                .toList());
    }

    @GetMapping("/medical-tasks/{taskId}")
    public ResponseEntity<MedicalTaskResponse> getTask(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("taskId") UUID taskId,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(MedicalTaskResponse.from(
                medicalTaskService.getTask(organizationId, SecurityUtils.getCurrentUserId(), taskId, asOf)));
    }

    @PostMapping("/medical-tasks/{taskId}/complete")
    public ResponseEntity<CompletionResponse> completeTask(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("taskId") UUID taskId,
            @Valid @RequestBody(required = false) CompleteTaskRequest request
    ) {
        var command = request != null
                ? request.toCommand()
                : MedicalTaskService.CompletionCommand.defaults();
        var result = medicalTaskService.completeTask(organizationId, SecurityUtils.getCurrentUserId(), taskId, command);
        var followUpClassification = result.followUp() != null
                ? TaskClassifier.classify(result.followUp(), LocalDate.now(clock))
                : TaskClassification.UPCOMING;
        return ResponseEntity.ok(CompletionResponse.from(result, followUpClassification));
    }

    @Operation(
            summary = "Complete several tasks",
            description = "Each task is completed in its own transaction; failures are listed with their error code "
                    + "and do not undo the tasks that succeeded."
    )
    @PostMapping("/medical-tasks/batch-complete")
    public ResponseEntity<BatchCompletionResponse> batchComplete(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody BatchCompleteRequest request
    ) {
        var result = medicalTaskService.batchComplete(organizationId, SecurityUtils.getCurrentUserId(), request.taskIds());
        return ResponseEntity.ok(BatchCompletionResponse.from(result));
    }

    @PatchMapping("/medical-tasks/{taskId}/status")
    public ResponseEntity<MedicalTaskResponse> changeStatus(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("taskId") UUID taskId,
            @Valid @RequestBody ChangeTaskStatusRequest request
    ) {
        var task = medicalTaskService.changeStatus(organizationId, SecurityUtils.getCurrentUserId(), taskId,
                request.status(), request.expectedVersion());
        return ResponseEntity.ok(MedicalTaskResponse.from(task, TaskClassifier.classify(task, LocalDate.now(clock)).name()));
    }

    @PostMapping("/medical-tasks/{taskId}/cancel")
    public ResponseEntity<MedicalTaskResponse> cancelTask(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("taskId") UUID taskId,
            @RequestParam(name = "expectedVersion", required = false) Long expectedVersion
    ) {
        var task = medicalTaskService.cancelTask(organizationId, SecurityUtils.getCurrentUserId(), taskId, expectedVersion);
        return ResponseEntity.ok(MedicalTaskResponse.from(task, TaskClassification.CANCELLED.name()));
    }

    @PostMapping("/animals/{animalId}/medical-records")
    public ResponseEntity<MedicalRecordResponse> recordDirectCare(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId,
            @Valid @RequestBody DirectCareRequest request
    ) {
        var record = medicalTaskService.recordDirectCare(
                organizationId, SecurityUtils.getCurrentUserId(), animalId, request.toCommand());
        return ResponseEntity.status(201).body(MedicalRecordResponse.from(record));
    }

    @GetMapping("/animals/{animalId}/medical-records")
    public ResponseEntity<List<MedicalRecordResponse>> listRecords(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId
    ) {
        return ResponseEntity.ok(medicalTaskService.listRecords(organizationId, SecurityUtils.getCurrentUserId(), animalId)
                .stream()
                .map(MedicalRecordResponse::from)
                .toList());
    }
}
