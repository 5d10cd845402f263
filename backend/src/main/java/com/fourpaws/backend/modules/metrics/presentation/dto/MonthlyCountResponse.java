package com.fourpaws.backend.modules.metrics.presentation.dto;

public record MonthlyCountResponse(String month, long count) {
}
