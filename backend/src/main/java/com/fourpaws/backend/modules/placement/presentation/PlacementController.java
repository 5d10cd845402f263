package com.fourpaws.backend.modules.placement.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.placement.application.PlacementService;
import com.fourpaws.backend.modules.placement.domain.FosterAssignmentStatus;
import com.fourpaws.backend.modules.placement.presentation.dto.AdoptionResponse;
import com.fourpaws.backend.modules.placement.presentation.dto.EndFosterRequest;
import com.fourpaws.backend.modules.placement.presentation.dto.FinalizeAdoptionRequest;
import com.fourpaws.backend.modules.placement.presentation.dto.FosterAssignmentResponse;
import com.fourpaws.backend.modules.placement.presentation.dto.PlaceFosterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

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
@RequestMapping("/organizations/{organizationId}")
public class PlacementController {

    private final PlacementService placementService;

    public PlacementController(PlacementService placementService) {
        this.placementService = placementService;
    }

    @Operation(
            summary = "Finalize an approved adoption application",
            description = "Creates the adoption, moves the animal to ADOPTED and records its outcome atomically."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Adoption created"),
            @ApiResponse(responseCode = "409", description = "APPLICATION_NOT_APPROVED or ALREADY_TERMINAL"),
            @ApiResponse(responseCode = "422", description = "INVALID_AMOUNT")
    })
    @PostMapping("/applications/{applicationId}/adoption")
    public ResponseEntity<AdoptionResponse> finalizeAdoption(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody FinalizeAdoptionRequest request
    ) {
        var adoption = placementService.finalizeAdoption(
                organizationId, SecurityUtils.getCurrentUserId(), applicationId, request.toCommand());
        return ResponseEntity.status(201).body(AdoptionResponse.from(adoption));
    }

    @PostMapping("/applications/{applicationId}/foster")
    public ResponseEntity<FosterAssignmentResponse> placeFoster(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody(required = false) PlaceFosterRequest request
    ) {
        var command = request != null ? request.toCommand() : new PlaceFosterRequest(null, null).toCommand();
        var assignment = placementService.placeFoster(
                organizationId, SecurityUtils.getCurrentUserId(), applicationId, command);
        return ResponseEntity.status(201).body(FosterAssignmentResponse.from(assignment));
    }

    @PostMapping("/foster-assignments/{assignmentId}/end")
    public ResponseEntity<FosterAssignmentResponse> endFoster(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("assignmentId") UUID assignmentId,
            @Valid @RequestBody(required = false) EndFosterRequest request
    ) {
        var body = request != null ? request : new EndFosterRequest(null, null, null, null);
        var assignment = placementService.endFoster(
                organizationId, SecurityUtils.getCurrentUserId(), assignmentId, body.toCommand());
        return ResponseEntity.ok(FosterAssignmentResponse.from(assignment));
    }

    @GetMapping("/foster-assignments")
    public ResponseEntity<List<FosterAssignmentResponse>> listFosterAssignments(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "status", required = false) FosterAssignmentStatus status
    ) {
        return ResponseEntity.ok(placementService.listFosterAssignments(
                        organizationId, SecurityUtils.getCurrentUserId(), status)
                .stream()
                .map(FosterAssignmentResponse::from)
                .toList());
    }

    @GetMapping("/foster-assignments/{assignmentId}")
    public ResponseEntity<FosterAssignmentResponse> getFosterAssignment(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("assignmentId") UUID assignmentId
    ) {
        return ResponseEntity.ok(FosterAssignmentResponse.from(
                placementService.getFosterAssignment(organizationId, SecurityUtils.getCurrentUserId(), assignmentId)));
    }

    @GetMapping("/adoptions")
    public ResponseEntity<List<AdoptionResponse>> listAdoptions(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(placementService.listAdoptions(organizationId, SecurityUtils.getCurrentUserId())
                .stream()
                .map(AdoptionResponse::from)
                .toList());
    }

    @GetMapping("/adoptions/{adoptionId}")
    public ResponseEntity<AdoptionResponse> getAdoption(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("adoptionId") UUID adoptionId
    ) {
        return ResponseEntity.ok(AdoptionResponse.from(
                placementService.getAdoption(organizationId, SecurityUtils.getCurrentUserId(), adoptionId)));
    }
}
