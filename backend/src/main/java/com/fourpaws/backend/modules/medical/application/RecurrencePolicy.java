package com.fourpaws.backend.modules.medical.application;

import java.time.LocalDate;
import java.time.Period;
import java.util.Optional;

import com.fourpaws.backend.modules.medical.domain.MedicalTaskType;

import org.springframework.stereotype.Component;

@Component
public class RecurrencePolicy {

    private final MedicalRecurrenceProperties properties;

    public RecurrencePolicy(MedicalRecurrenceProperties properties) {
        this.properties = properties;
    }

    public Period intervalFor(MedicalTaskType type) {
        return switch (type) {
            case VACCINE -> properties.getVaccine();
            case CHECKUP -> properties.getCheckup();
            case EXAM -> properties.getExam();
            case TREATMENT -> properties.getTreatment();
            case SURGERY, OTHER -> properties.getDefaultInterval();
        };
    }

    /**
     * Due date of the follow-up for a task completed on {@code completedOn}; empty when
     * recurrence is switched off or the configured interval is zero.
     */
    public Optional<LocalDate> nextDueDate(MedicalTaskType type, LocalDate completedOn) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        Period interval = intervalFor(type);
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return Optional.empty();
        }
        return Optional.of(completedOn.plus(interval));
    }
}
