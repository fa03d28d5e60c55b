package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record MonitorResponse(
        LocalDate date,
        LocalTime time,
        boolean stale,
        LocalDate dataAsOfDate,
        LocalTime dataAsOf,
        List<MonitorEntryResponse> entries,
        DailySummaryResponse summary
) {
}
