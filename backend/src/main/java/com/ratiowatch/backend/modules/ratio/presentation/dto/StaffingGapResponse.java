package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record StaffingGapResponse(
        LocalDate date,
        LocalTime time,
        int totalStaffNeeded,
        boolean overallCompliant,
        List<RatioEvaluationResponse> details
) {
}
