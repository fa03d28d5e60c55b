package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalTime;

public record ComplianceStatsResponse(
        int totalSnapshots,
        int compliantCount,
        int nonCompliantCount,
        int alertsSent,
        BigDecimal minCompliancePercent,
        BigDecimal avgCompliancePercent,
        BigDecimal maxCompliancePercent,
        BigDecimal avgStaffCount,
        BigDecimal avgChildCount,
        LocalTime firstSnapshotTime,
        LocalTime lastSnapshotTime,
        BigDecimal complianceRate
) {
}
