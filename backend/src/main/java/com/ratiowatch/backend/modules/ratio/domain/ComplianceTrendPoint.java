package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ComplianceTrendPoint(
        LocalDate date,
        int totalSnapshots,
        int compliantCount,
        BigDecimal complianceRate,
        BigDecimal avgCompliancePercent,
        long totalStaff,
        long totalChildren
) {
}
