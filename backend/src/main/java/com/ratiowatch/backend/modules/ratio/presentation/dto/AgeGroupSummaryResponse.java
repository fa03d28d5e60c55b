package com.ratiowatch.backend.modules.ratio.presentation.dto;

public record AgeGroupSummaryResponse(String ageGroup, Integer requiredRatio, ComplianceStatsResponse stats) {
}
