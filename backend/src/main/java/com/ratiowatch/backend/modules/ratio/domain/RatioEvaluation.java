package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record RatioEvaluation(
        String ageGroup,
        String roomName,
        int staffCount,
        int childCount,
        int requiredRatio,
        ActualRatio actualRatio,
        boolean compliant,
        BigDecimal compliancePercent,
        int staffNeeded,
        int additionalCapacity,
        boolean roomChildCountApproximate,
        LocalDateTime calculatedAt
) {

    public boolean isAtWarningLevel(BigDecimal thresholdPercent) {
        return compliant && compliancePercent.compareTo(thresholdPercent) >= 0;
    }
}
