package com.fourpaws.backend.modules.medical.application;

import java.time.Period;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Follow-up intervals per task type, bound from {@code shelter.medical.recurrence.*}.
 *
 * <pre>
 * shelter:
 *   medical:
 *     recurrence:
 *       enabled: true
 *       vaccine: P12M
 *       default-interval: P30D
 * </pre>
 */
@ConfigurationProperties(prefix = "shelter.medical.recurrence")
public class MedicalRecurrenceProperties {

    private boolean enabled = true;
    private Period vaccine = Period.ofMonths(12);
    private Period checkup = Period.ofMonths(6);
    private Period exam = Period.ofMonths(3);
    private Period treatment = Period.ofDays(7);
    // surgery and other
    private Period defaultInterval = Period.ofDays(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Period getVaccine() {
        return vaccine;
    }

    public void setVaccine(Period vaccine) {
        this.vaccine = vaccine;
    }

    public Period getCheckup() {
        return checkup;
    }

    public void setCheckup(Period checkup) {
        this.checkup = checkup;
    }

    public Period getExam() {
        return exam;
    }

    public void setExam(Period exam) {
        this.exam = exam;
    }

    public Period getTreatment() {
        return treatment;
    }

    public void setTreatment(Period treatment) {
        this.treatment = treatment;
    }

    public Period getDefaultInterval() {
        return defaultInterval;
    }

    public void setDefaultInterval(Period defaultInterval) {
        this.defaultInterval = defaultInterval;
    }
}
