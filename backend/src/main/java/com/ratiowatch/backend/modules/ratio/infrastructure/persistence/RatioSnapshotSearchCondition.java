package com.ratiowatch.backend.modules.ratio.infrastructure.persistence;

import java.time.LocalDate;
import java.util.UUID;

public record RatioSnapshotSearchCondition(
        UUID schoolPeriodId,
        LocalDate date,
        LocalDate dateFrom,
        LocalDate dateTo,
        String ageGroup,
        String roomName,
        Boolean compliant,
        Boolean automatic,
        Boolean alertSent
) {

    public static RatioSnapshotSearchCondition forPeriod(UUID schoolPeriodId) {
        return new RatioSnapshotSearchCondition(schoolPeriodId, null, null, null, null, null, null, null, null);
    }
}
