package com.ratiowatch.backend.modules.ratio.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Natural key of a snapshot. A {@code null} room means "all rooms of the age group".
 */
public record SnapshotKey(
        UUID schoolPeriodId,
        String ageGroup,
        String roomName,
        LocalDate snapshotDate,
        LocalTime snapshotTime
) {

    @Override
    public String toString() {
        return ageGroup + "@" + (roomName == null ? "*" : roomName) + " " + snapshotDate + "T" + snapshotTime
                + " (period " + schoolPeriodId + ")";
    }
}
