package com.fourpaws.backend.modules.medical.application;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch completion. {@code reason} is an {@code ErrorCode} name, or
 * {@link #STORE_FAILURE} when the database rejected the item for another reason.
 */
public record BatchCompletionResult(int updated, List<Failure> failures) {

    public static final String STORE_FAILURE = "STORE_FAILURE";

    public record Failure(UUID taskId, String reason) {
    }
}
