package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Aggregate over a set of snapshots. An empty set yields zeros, null times and a 100% rate.
 */
public record ComplianceStats(
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
