package com.fourpaws.backend.modules.pipeline.presentation.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fourpaws.backend.modules.pipeline.domain.AnimalApplication;
import com.fourpaws.backend.modules.pipeline.domain.PipelineStage;

public record PipelineBoardResponse(Map<String, List<ApplicationResponse>> columns) {

    public static PipelineBoardResponse from(Map<PipelineStage, List<AnimalApplication>> board) {
        Map<String, List<ApplicationResponse>> columns = new LinkedHashMap<>();
        board.forEach((stage, applications) -> columns.put(stage.name(),
                applications.stream().map(ApplicationResponse::from).toList()));
        return new PipelineBoardResponse(columns);
    }
}
