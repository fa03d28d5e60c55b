package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;

public record MonitorEntryResponse(
        String ageGroup,
        int staffCount,
        int childCount,
        int requiredRatio,
        BigDecimal actualRatio,
        boolean ratioUnbounded,
        boolean compliant,
        BigDecimal compliancePercent,
        int staffNeeded,
        int additionalCapacity,
        boolean warning,
        boolean breach
) {
}
