package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * {@code actualRatio} is {@code null} exactly when {@code ratioUnbounded} is set.
 */
public record RatioEvaluationResponse(
        String ageGroup,
        String roomName,
        int staffCount,
        int childCount,
        int requiredRatio,
        BigDecimal actualRatio,
        boolean ratioUnbounded,
        boolean compliant,
        BigDecimal compliancePercent,
        int staffNeeded,
        int additionalCapacity,
        boolean roomChildCountApproximate,
        LocalDateTime calculatedAt
) {
}
