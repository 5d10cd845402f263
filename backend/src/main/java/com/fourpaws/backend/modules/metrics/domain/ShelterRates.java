package com.fourpaws.backend.modules.metrics.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fourpaws.backend.modules.animal.domain.OutcomeType;

/**
 * Report arithmetic over already-loaded rows. Rates are null when their denominator is zero.
 */
public final class ShelterRates {

    private static final int SCALE = 4;

    private ShelterRates() {
    }

    public static BigDecimal liveReleaseRate(Collection<OutcomeType> outcomes) {
        long live = outcomes.stream().filter(OutcomeType::isLiveRelease).count();
        return ratio(live, outcomes.size());
    }

    /**
     * completed / (completed + missed).
     */
    public static BigDecimal complianceRate(long completed, long missed) {
        return ratio(completed, completed + missed);
    }

    public static BigDecimal averageDays(Collection<Stay> stays) {
        if (stays.isEmpty()) {
            return null;
        }
        long totalDays = stays.stream()
                .mapToLong(stay -> Math.max(0, ChronoUnit.DAYS.between(stay.from(), stay.to())))
                .sum();
        return BigDecimal.valueOf(totalDays).divide(BigDecimal.valueOf(stays.size()), 1, RoundingMode.HALF_UP);
    }

    /**
     * Counts dates per calendar month for every month in {@code [first, last]}, including
     * empty months.
     */
    public static Map<YearMonth, Long> countByMonth(Collection<LocalDate> dates, YearMonth first, YearMonth last) {
        Map<YearMonth, Long> buckets = new LinkedHashMap<>();
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            buckets.put(month, 0L);
        }
        for (LocalDate date : dates) {
            buckets.computeIfPresent(YearMonth.from(date), (month, count) -> count + 1);
        }
        return buckets;
    }

    private static BigDecimal ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return null;
        }
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), SCALE, RoundingMode.HALF_UP);
    }

    public record Stay(LocalDate from, LocalDate to) {
    }
}
