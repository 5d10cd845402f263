package com.fourpaws.backend.modules.medical.domain;

import java.util.EnumSet;
import java.util.Set;

public enum MedicalTaskStatus {
    SCHEDULED,
    IN_PROGRESS,
    PENDING_REVIEW,
    ON_HOLD,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static Set<MedicalTaskStatus> terminalStatuses() {
        return EnumSet.of(COMPLETED, CANCELLED);
    }
}
