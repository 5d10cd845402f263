package com.fourpaws.backend.modules.metrics.presentation.dto;

public record SpeciesCountResponse(String species, long count) {
}
