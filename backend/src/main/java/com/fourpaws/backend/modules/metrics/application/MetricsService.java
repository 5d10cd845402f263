package com.fourpaws.backend.modules.metrics.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.animal.domain.AnimalStatus;
import com.fourpaws.backend.modules.animal.domain.Intake;
import com.fourpaws.backend.modules.animal.domain.Outcome;
import com.fourpaws.backend.modules.animal.domain.OutcomeType;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.IntakeRepository;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.OutcomeRepository;
import com.fourpaws.backend.modules.medical.domain.MedicalTaskStatus;
import com.fourpaws.backend.modules.medical.infrastructure.persistence.MedicalTaskRepository;
import com.fourpaws.backend.modules.metrics.domain.ShelterRates;
import com.fourpaws.backend.modules.pipeline.domain.ApplicationStatus;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;
import com.fourpaws.backend.modules.pipeline.infrastructure.persistence.ApplicationRepository;
import com.fourpaws.backend.modules.placement.infrastructure.persistence.AdoptionRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-side aggregates, recomputed on every call from current rows.
 */
@Service
@Transactional(readOnly = true)
public class MetricsService {

    private static final Set<AnimalStatus> IN_CARE = EnumSet.of(
            AnimalStatus.AVAILABLE, AnimalStatus.HOLD, AnimalStatus.FOSTERED);
    private static final int MAX_TREND_MONTHS = 36;

    private final AnimalRepository animalRepository;
    private final IntakeRepository intakeRepository;
    private final OutcomeRepository outcomeRepository;
    private final MedicalTaskRepository medicalTaskRepository;
    private final ApplicationRepository applicationRepository;
    private final AdoptionRepository adoptionRepository;
    private final TenantAuthorizationService authorizationService;
    private final Clock clock;

    public MetricsService(
            AnimalRepository animalRepository,
            IntakeRepository intakeRepository,
            OutcomeRepository outcomeRepository,
            MedicalTaskRepository medicalTaskRepository,
            ApplicationRepository applicationRepository,
            AdoptionRepository adoptionRepository,
            TenantAuthorizationService authorizationService,
            Clock clock
    ) {
        this.animalRepository = animalRepository;
        this.intakeRepository = intakeRepository;
        this.outcomeRepository = outcomeRepository;
        this.medicalTaskRepository = medicalTaskRepository;
        this.applicationRepository = applicationRepository;
        this.adoptionRepository = adoptionRepository;
        this.authorizationService = authorizationService;
        this.clock = clock;
    }

    public DashboardSummary dashboard(UUID organizationId, UUID actorId, LocalDate asOf) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        LocalDate day = asOf != null ? asOf : LocalDate.now(clock);
        Set<MedicalTaskStatus> terminal = MedicalTaskStatus.terminalStatuses();
        return new DashboardSummary(
                day,
                animalRepository.countByOrganizationIdAndStatusIn(organizationId, IN_CARE),
                animalRepository.countByOrganizationIdAndStatus(organizationId, AnimalStatus.AVAILABLE),
                animalRepository.countByOrganizationIdAndStatus(organizationId, AnimalStatus.HOLD),
                animalRepository.countByOrganizationIdAndStatus(organizationId, AnimalStatus.FOSTERED),
                medicalTaskRepository.countByOrganizationIdAndStatusNotInAndDueDateBefore(organizationId, terminal, day),
                medicalTaskRepository.countByOrganizationIdAndStatusNotInAndDueDate(organizationId, terminal, day),
                applicationRepository.countByOrganizationIdAndStatus(organizationId, ApplicationStatus.RECEIVED)
                        + applicationRepository.countByOrganizationIdAndStatus(organizationId, ApplicationStatus.REVIEW)
        );
    }

    /**
     * Animals currently in care, by species.
     */
    public Map<String, Long> speciesDistribution(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        Map<String, Long> distribution = new LinkedHashMap<>();
        animalRepository.countBySpecies(organizationId, IN_CARE)
                .forEach(row -> distribution.put(row.getSpecies(), row.getTotal()));
        return distribution;
    }

    /**
     * Intakes per month for the {@code months} months ending with the month of {@code asOf}.
     */
    public Map<YearMonth, Long> monthlyIntake(UUID organizationId, UUID actorId, int months, LocalDate asOf) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (months < 1 || months > MAX_TREND_MONTHS) {
            throw new ProblemException(ErrorCode.INVALID_REQUEST, "months must be between 1 and " + MAX_TREND_MONTHS);
        }
        YearMonth last = YearMonth.from(asOf != null ? asOf : LocalDate.now(clock));
        YearMonth first = last.minusMonths(months - 1L);
        List<LocalDate> dates = intakeRepository
                .findByOrganizationIdAndIntakeDateBetween(organizationId, first.atDay(1), last.atEndOfMonth())
                .stream()
                .map(Intake::getIntakeDate)
                .toList();
        return ShelterRates.countByMonth(dates, first, last);
    }

    public Map<PipelineStage, Long> pipelineStages(UUID organizationId, UUID actorId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        Map<PipelineStage, Long> stages = new EnumMap<>(PipelineStage.class);
        stages.put(PipelineStage.RECEIVED,
                applicationRepository.countByOrganizationIdAndStatus(organizationId, ApplicationStatus.RECEIVED));
        stages.put(PipelineStage.REVIEW,
                applicationRepository.countByOrganizationIdAndStatus(organizationId, ApplicationStatus.REVIEW));
        stages.put(PipelineStage.APPROVED, applicationRepository
                .countByOrganizationIdAndStatusAndFinalizedAtIsNull(organizationId, ApplicationStatus.APPROVED));
        stages.put(PipelineStage.COMPLETED, applicationRepository
                .countByOrganizationIdAndStatusAndFinalizedAtIsNotNull(organizationId, ApplicationStatus.APPROVED));
        return stages;
    }

    /**
     * Outcome and compliance figures for the window {@code [from, to]}; compliance counts
     * tasks due in the window, judged as of {@code asOf}.
     */
    public ShelterReport report(UUID organizationId, UUID actorId, LocalDate from, LocalDate to, LocalDate asOf) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (from == null || to == null || to.isBefore(from)) {
            throw new ProblemException(ErrorCode.INVALID_REQUEST, "a window with from <= to is required");
        }
        LocalDate evaluatedAt = asOf != null ? asOf : LocalDate.now(clock);

        List<Outcome> outcomes = outcomeRepository.findInWindowWithAnimal(organizationId, from, to);
        List<OutcomeType> types = outcomes.stream().map(Outcome::getType).toList();
        Map<OutcomeType, Long> byType = new EnumMap<>(OutcomeType.class);
        for (OutcomeType type : OutcomeType.values()) {
            byType.put(type, types.stream().filter(type::equals).count());
        }
        List<ShelterRates.Stay> stays = outcomes.stream()
                .map(outcome -> new ShelterRates.Stay(outcome.getAnimal().getIntakeDate(), outcome.getOutcomeDate()))
                .toList();

        long completed = medicalTaskRepository.countByOrganizationIdAndStatusAndDueDateBetween(
                organizationId, MedicalTaskStatus.COMPLETED, from, to);
        long missed = medicalTaskRepository.countMissed(
                organizationId, MedicalTaskStatus.terminalStatuses(), from, to, evaluatedAt);

        return new ShelterReport(
                from,
                to,
                evaluatedAt,
                outcomes.size(),
                byType,
                ShelterRates.liveReleaseRate(types),
                completed,
                missed,
                ShelterRates.complianceRate(completed, missed),
                ShelterRates.averageDays(stays),
                adoptionRepository.countByOrganizationIdAndAdoptionDateBetween(organizationId, from, to)
        );
    }

    public record DashboardSummary(
            LocalDate asOf,
            long inCare,
            long available,
            long hold,
            long fostered,
            long overdueTasks,
            long dueTodayTasks,
            long openApplications
    ) {
    }

    public record ShelterReport(
            LocalDate from,
            LocalDate to,
            LocalDate asOf,
            long outcomes,
            Map<OutcomeType, Long> outcomesByType,
            BigDecimal liveReleaseRate,
            long completedTasks,
            long missedTasks,
            BigDecimal complianceRate,
            BigDecimal averageLengthOfStayDays,
            long adoptions
    ) {
    }
}
