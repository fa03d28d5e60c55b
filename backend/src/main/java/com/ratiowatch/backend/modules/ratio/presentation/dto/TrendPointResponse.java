package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TrendPointResponse(
        LocalDate date,
        int totalSnapshots,
        int compliantCount,
        BigDecimal complianceRate,
        BigDecimal avgCompliancePercent,
        long totalStaff,
        long totalChildren
) {
}
