package com.fourpaws.backend.modules.pipeline.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.pipeline.application.ApplicationPipelineService;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus;
import com.fourpaws.backend.modules.pipeline.presentation.dto.ApplicationDecisionRequest;
import com.fourpaws.backend.modules.pipeline.presentation.dto.ApplicationResponse;
import com.fourpaws.backend.modules.pipeline.presentation.dto.PipelineBoardResponse;
import com.fourpaws.backend.modules.pipeline.presentation.dto.SubmitApplicationRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}/applications")
public class ApplicationController {

    private final ApplicationPipelineService pipelineService;

    public ApplicationController(ApplicationPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping
    public ResponseEntity<ApplicationResponse> submit(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody SubmitApplicationRequest request
    ) {
        var application = pipelineService.submit(organizationId, SecurityUtils.getCurrentUserId(), request.toCommand());
        return ResponseEntity.status(201).body(ApplicationResponse.from(application));
    }

    @GetMapping
    public ResponseEntity<List<ApplicationResponse>> listApplications(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "status", required = false) ApplicationStatus status
    ) {
        return ResponseEntity.ok(pipelineService.listApplications(organizationId, SecurityUtils.getCurrentUserId(), status)
                .stream()
                .map(ApplicationResponse::from)
                .toList());
    }

    @Operation(summary = "Pipeline board", description = "Open applications grouped into RECEIVED, REVIEW, APPROVED and COMPLETED.")
    @GetMapping("/board")
    public ResponseEntity<PipelineBoardResponse> board(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(PipelineBoardResponse.from(
                pipelineService.board(organizationId, SecurityUtils.getCurrentUserId())));
    }

    @GetMapping("/{applicationId}")
    public ResponseEntity<ApplicationResponse> getApplication(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId
    ) {
        return ResponseEntity.ok(ApplicationResponse.from(
                pipelineService.getApplication(organizationId, SecurityUtils.getCurrentUserId(), applicationId)));
    }

    @PostMapping("/{applicationId}/review")
    public ResponseEntity<ApplicationResponse> moveToReview(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody(required = false) ApplicationDecisionRequest request
    ) {
        var application = pipelineService.moveToReview(organizationId, SecurityUtils.getCurrentUserId(),
                applicationId, expectedVersion(request));
        return ResponseEntity.ok(ApplicationResponse.from(application));
    }

    @PostMapping("/{applicationId}/approve")
    public ResponseEntity<ApplicationResponse> approve(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody(required = false) ApplicationDecisionRequest request
    ) {
        var application = pipelineService.approve(organizationId, SecurityUtils.getCurrentUserId(),
                applicationId, notes(request), expectedVersion(request));
        return ResponseEntity.ok(ApplicationResponse.from(application));
    }

    @PostMapping("/{applicationId}/deny")
    public ResponseEntity<ApplicationResponse> deny(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody(required = false) ApplicationDecisionRequest request
    ) {
        var application = pipelineService.deny(organizationId, SecurityUtils.getCurrentUserId(),
                applicationId, notes(request), expectedVersion(request));
        return ResponseEntity.ok(ApplicationResponse.from(application));
    }

    @PostMapping("/{applicationId}/withdraw")
    public ResponseEntity<ApplicationResponse> withdraw(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody(required = false) ApplicationDecisionRequest request
    ) {
        var application = pipelineService.withdraw(organizationId, SecurityUtils.getCurrentUserId(),
                applicationId, expectedVersion(request));
        return ResponseEntity.ok(ApplicationResponse.from(application));
    }

    private static String notes(ApplicationDecisionRequest request) {
        return request != null ? request.notes() : null;
    }

    private static Long expectedVersion(ApplicationDecisionRequest request) {
        return request != null ? request.expectedVersion() : null;
    }
}
