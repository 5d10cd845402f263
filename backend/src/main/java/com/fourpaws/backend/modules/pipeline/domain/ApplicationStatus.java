package com.fourpaws.backend.modules.pipeline.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review pipeline. Decided states never move again; there is no reopen.
 */
public enum ApplicationStatus {
    RECEIVED,
    REVIEW,
    APPROVED,
    DENIED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == APPROVED || this == DENIED || this == WITHDRAWN;
    }

    public Set<ApplicationStatus> allowedTargets() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(REVIEW, WITHDRAWN);
            case REVIEW -> EnumSet.of(APPROVED, DENIED, WITHDRAWN);
            default -> EnumSet.noneOf(ApplicationStatus.class);
        };
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        return allowedTargets().contains(target);
    }
}
