package com.fourpaws.backend.modules.animal.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.animal.application.AnimalLifecycleService;
import com.fourpaws.backend.modules.animal.application.AnimalService;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.animal.presentation.dto.AnimalResponse;
import com.fourpaws.backend.modules.animal.presentation.dto.IntakeRequest;
import com.fourpaws.backend.modules.animal.presentation.dto.IntakeResponse;
import com.fourpaws.backend.modules.animal.presentation.dto.OutcomeResponse;
import com.fourpaws.backend.modules.animal.presentation.dto.TransitionRequest;
import com.fourpaws.backend.modules.animal.presentation.dto.UpdateAnimalRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

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
@RequestMapping("/organizations/{organizationId}/animals")
public class AnimalController {

    private final AnimalService animalService;
    private final AnimalLifecycleService lifecycleService;

    public AnimalController(AnimalService animalService, AnimalLifecycleService lifecycleService) {
        this.animalService = animalService;
        this.lifecycleService = lifecycleService;
    }

    @PostMapping
    public ResponseEntity<AnimalResponse> intake(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody IntakeRequest request
    ) {
        var animal = animalService.intake(organizationId, SecurityUtils.getCurrentUserId(), request.toCommand());
        return ResponseEntity.status(201).body(AnimalResponse.from(animal));
    }

    @GetMapping
    public ResponseEntity<List<AnimalResponse>> listAnimals(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "status", required = false) AnimalStatus status
    ) {
        return ResponseEntity.ok(animalService.listAnimals(organizationId, SecurityUtils.getCurrentUserId(), status)
                .stream()
                .map(AnimalResponse::from)
                .toList());
    }

    @GetMapping("/{animalId}")
    public ResponseEntity<AnimalResponse> getAnimal(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId
    ) {
        return ResponseEntity.ok(AnimalResponse.from(
                animalService.getAnimal(organizationId, SecurityUtils.getCurrentUserId(), animalId)));
    }

    @PatchMapping("/{animalId}")
    public ResponseEntity<AnimalResponse> updateProfile(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId,
            @Valid @RequestBody UpdateAnimalRequest request
    ) {
        var animal = animalService.updateProfile(
                organizationId, SecurityUtils.getCurrentUserId(), animalId, request.toUpdate());
        return ResponseEntity.ok(AnimalResponse.from(animal));
    }

    @Operation(
            summary = "Change an animal's status",
            description = "Moves the animal along the lifecycle. Terminal targets record the outcome in the "
                    + "same transaction; leaving FOSTERED closes the active foster assignment."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transition applied"),
            @ApiResponse(responseCode = "409", description = "INVALID_TRANSITION, ALREADY_TERMINAL or CONCURRENT_MODIFICATION")
    })
    @PostMapping("/{animalId}/transitions")
    public ResponseEntity<AnimalResponse> transition(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId,
            @Valid @RequestBody TransitionRequest request
    ) {
        var animal = lifecycleService.transition(
                organizationId, SecurityUtils.getCurrentUserId(), animalId, request.toCommand());
        return ResponseEntity.ok(AnimalResponse.from(animal));
    }

    @GetMapping("/{animalId}/intake")
    public ResponseEntity<IntakeResponse> getIntake(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId
    ) {
        return ResponseEntity.ok(IntakeResponse.from(
                animalService.getIntake(organizationId, SecurityUtils.getCurrentUserId(), animalId)));
    }

    @GetMapping("/{animalId}/outcome")
    public ResponseEntity<OutcomeResponse> getOutcome(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("animalId") UUID animalId
    ) {
        return ResponseEntity.ok(OutcomeResponse.from(
                animalService.getOutcome(organizationId, SecurityUtils.getCurrentUserId(), animalId)));
    }
}
