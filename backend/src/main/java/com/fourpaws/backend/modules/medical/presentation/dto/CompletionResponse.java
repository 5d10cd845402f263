package com.fourpaws.backend.modules.medical.presentation.dto;

import com.fourpaws.backend.modules.medical.application.MedicalTaskService.CompletionResult;
import com.fourpaws.backend.modules.medical.domain.TaskClassification;

public record CompletionResponse(
        MedicalTaskResponse task,
        MedicalRecordResponse record,
        MedicalTaskResponse followUp
) {

    public static CompletionResponse from(CompletionResult result, TaskClassification followUpClassification) {
        return new CompletionResponse(
                MedicalTaskResponse.from(result.task(), TaskClassification.COMPLETED.name()),
                MedicalRecordResponse.from(result.record()),
                result.followUp() != null
                        ? MedicalTaskResponse.from(result.followUp(), followUpClassification.name())
                        : null
        );
    }
}
