package com.fourpaws.backend.modules.metrics.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.metrics.application.MetricsService;
import com.fourpaws.backend.modules.metrics.application.MetricsService.DashboardSummary;
import com.fourpaws.backend.modules.metrics.application.MetricsService.ShelterReport;
import com.fourpaws.backend.modules.metrics.presentation.dto.MonthlyCountResponse;
import com.fourpaws.backend.modules.metrics.presentation.dto.SpeciesCountResponse;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}/metrics")
public class MetricsController {

    private final MetricsService metricsService;

    public MetricsController(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardSummary> dashboard(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(metricsService.dashboard(organizationId, SecurityUtils.getCurrentUserId(), asOf));
    }

    @GetMapping("/species")
    public ResponseEntity<List<SpeciesCountResponse>> speciesDistribution(
            @PathVariable("organizationId") UUID organizationId
    ) {
        return ResponseEntity.ok(metricsService.speciesDistribution(organizationId, SecurityUtils.getCurrentUserId())
                .entrySet()
                .stream()
                .map(entry -> new SpeciesCountResponse(entry.getKey(), entry.getValue()))
                .toList());
    }

    @GetMapping("/intake-trend")
    public ResponseEntity<List<MonthlyCountResponse>> monthlyIntake(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "months", defaultValue = "12") int months,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(metricsService.monthlyIntake(organizationId, SecurityUtils.getCurrentUserId(), months, asOf)
                .entrySet()
                .stream()
                .map(entry -> new MonthlyCountResponse(entry.getKey().toString(), entry.getValue()))
                .toList());
    }

    @GetMapping("/pipeline")
    public ResponseEntity<Map<PipelineStage, Long>> pipelineStages(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(metricsService.pipelineStages(organizationId, SecurityUtils.getCurrentUserId()));
    }

    @Operation(
            summary = "Outcome and compliance report",
            description = "Live-release rate, medical compliance, average length of stay and adoptions for a date window."
    )
    @GetMapping("/report")
    public ResponseEntity<ShelterReport> report(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(metricsService.report(organizationId, SecurityUtils.getCurrentUserId(), from, to, asOf));
    }
}
