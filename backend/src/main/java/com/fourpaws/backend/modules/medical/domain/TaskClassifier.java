package com.fourpaws.backend.modules.medical.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Due-state of a task, computed at read time and never stored. Comparison is by calendar date
 * only, so a task due today is never overdue before the day is over.
 */
public final class TaskClassifier {

    private TaskClassifier() {
    }

    public static TaskClassification classify(MedicalTask task, LocalDate asOf) {
        return classify(task.getStatus(), task.getDueDate(), asOf);
    }

    public static TaskClassification classify(MedicalTaskStatus status, LocalDate dueDate, LocalDate asOf) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(dueDate, "dueDate");
        Objects.requireNonNull(asOf, "asOf");
        if (status == MedicalTaskStatus.COMPLETED) {
            return TaskClassification.COMPLETED;
        }
        if (status == MedicalTaskStatus.CANCELLED) {
            return TaskClassification.CANCELLED;
        }
        if (dueDate.isBefore(asOf)) {
            return TaskClassification.OVERDUE;
        }
        return dueDate.isEqual(asOf) ? TaskClassification.DUE_TODAY : TaskClassification.UPCOMING;
    }
}
