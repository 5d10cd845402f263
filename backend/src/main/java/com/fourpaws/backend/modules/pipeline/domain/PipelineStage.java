package com.fourpaws.backend.modules.pipeline.domain;

import java.util.Optional;

/**
 * Board columns. An approved application moves to COMPLETED once it has been finalized into
 * an adoption or foster placement; denied and withdrawn applications are not on the board.
 */
public enum PipelineStage {
    RECEIVED,
    REVIEW,
    APPROVED,
    COMPLETED;

    public static Optional<PipelineStage> of(ApplicationStatus status, boolean finalized) {
        return switch (status) {
            case RECEIVED -> Optional.of(RECEIVED);
            case REVIEW -> Optional.of(REVIEW);
            case APPROVED -> Optional.of(finalized ? COMPLETED : APPROVED);
            case DENIED, WITHDRAWN -> Optional.empty();
        };
    }
}
