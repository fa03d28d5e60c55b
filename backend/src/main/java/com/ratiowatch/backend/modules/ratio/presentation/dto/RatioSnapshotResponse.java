package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

public record RatioSnapshotResponse(
        UUID id,
        UUID periodId,
        LocalDate snapshotDate,
        LocalTime snapshotTime,
        String ageGroup,
        String roomName,
        int staffCount,
        int childCount,
        int requiredRatio,
        BigDecimal actualRatio,
        boolean ratioUnbounded,
        boolean compliant,
        BigDecimal compliancePercent,
        boolean roomChildCountApproximate,
        boolean alertSent,
        OffsetDateTime alertSentAt,
        String notes,
        boolean automatic,
        UUID recordedBy,
        OffsetDateTime createdAt
) {
}
