package com.fourpaws.backend.modules.medical.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.modules.medical.application.BatchCompletionResult;

public record BatchCompletionResponse(int updated, List<FailureResponse> failures) {

    public static BatchCompletionResponse from(BatchCompletionResult result) {
        return new BatchCompletionResponse(
                result.updated(),
                result.failures().stream()
                        .map(failure -> new FailureResponse(failure.taskId(), failure.reason()))
                        .toList()
        );
    }

    public record FailureResponse(UUID taskId, String reason) {
    }
}
