package com.fourpaws.backend.modules.tenant.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.tenant.application.OrganizationService;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.presentation.dto.AddMemberRequest;
import com.fourpaws.backend.modules.tenant.presentation.dto.AuthorizationResponse;
import com.fourpaws.backend.modules.tenant.presentation.dto.ChangeRoleRequest;
import com.fourpaws.backend.modules.tenant.presentation.dto.CreateOrganizationRequest;
import com.fourpaws.backend.modules.tenant.presentation.dto.MemberResponse;
import com.fourpaws.backend.modules.tenant.presentation.dto.OrganizationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations")
public class OrganizationController {

    private final OrganizationService organizationService;
    private final TenantAuthorizationService authorizationService;

    public OrganizationController(
            OrganizationService organizationService,
            TenantAuthorizationService authorizationService
    ) {
        this.organizationService = organizationService;
        this.authorizationService = authorizationService;
    }

    @PostMapping
    public ResponseEntity<OrganizationResponse> createOrganization(@Valid @RequestBody CreateOrganizationRequest request) {
        var organization = organizationService.createOrganization(
                SecurityUtils.getCurrentUserId(), request.name(), request.slug(), request.settings());
        return ResponseEntity.status(201).body(OrganizationResponse.from(organization));
    }

    @GetMapping("/{organizationId}")
    public ResponseEntity<OrganizationResponse> getOrganization(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.getOrganization(organizationId, SecurityUtils.getCurrentUserId())));
    }

    @DeleteMapping("/{organizationId}")
    public ResponseEntity<Void> deleteOrganization(@PathVariable("organizationId") UUID organizationId) {
        organizationService.deleteOrganization(organizationId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Check the caller's access",
            description = "Resolves the caller's membership and compares its rank with `role`. "
                    + "Returns 403 `NOT_A_MEMBER` when the caller has no membership."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "ALLOWED or DENIED"),
            @ApiResponse(responseCode = "403", description = "NOT_A_MEMBER")
    })
    @GetMapping("/{organizationId}/authorization")
    public ResponseEntity<AuthorizationResponse> authorize(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "role", defaultValue = "READONLY") MembershipRole role
    ) {
        var decision = authorizationService.authorize(SecurityUtils.getCurrentUserId(), organizationId, role);
        return ResponseEntity.ok(new AuthorizationResponse(role.name(), decision.name()));
    }

    @GetMapping("/{organizationId}/members")
    public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(organizationService.listMembers(organizationId, SecurityUtils.getCurrentUserId())
                .stream()
                .map(MemberResponse::from)
                .toList());
    }

    @PostMapping("/{organizationId}/members")
    public ResponseEntity<MemberResponse> addMember(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody AddMemberRequest request
    ) {
        var membership = organizationService.addMember(
                organizationId, SecurityUtils.getCurrentUserId(), request.email(), request.role());
        return ResponseEntity.status(201).body(MemberResponse.from(membership));
    }

    @PatchMapping("/{organizationId}/members/{userId}")
    public ResponseEntity<MemberResponse> changeRole(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody ChangeRoleRequest request
    ) {
        var membership = organizationService.changeRole(
                organizationId, SecurityUtils.getCurrentUserId(), userId, request.role());
        return ResponseEntity.ok(MemberResponse.from(membership));
    }

    @DeleteMapping("/{organizationId}/members/{userId}")
    public ResponseEntity<Void> removeMember(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("userId") UUID userId
    ) {
        organizationService.removeMember(organizationId, SecurityUtils.getCurrentUserId(), userId);
        return ResponseEntity.noContent().build();
    }
}
