package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.time.LocalDate;

public record DailySummaryResponse(LocalDate date, ComplianceStatsResponse stats) {
}
