package com.fourpaws.backend.modules.audit.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.presentation.dto.AuditEntryResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}/audit-log")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Operation(summary = "List audit entries", description = "Newest first. ADMIN only.")
    @GetMapping
    public ResponseEntity<List<AuditEntryResponse>> listEntries(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "entityType", required = false) String entityType,
            @RequestParam(name = "entityId", required = false) UUID entityId,
            @RequestParam(name = "limit", defaultValue = "50") int limit
    ) {
        return ResponseEntity.ok(auditLogService.listEntries(
                        organizationId, SecurityUtils.getCurrentUserId(), entityType, entityId, limit)
                .stream()
                .map(AuditEntryResponse::from)
                .toList());
    }
}
