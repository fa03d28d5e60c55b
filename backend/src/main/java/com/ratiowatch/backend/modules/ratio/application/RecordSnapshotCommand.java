package com.ratiowatch.backend.modules.ratio.application;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * @param roomName {@code null} records the age group across all rooms
 * @param actorId  opaque id of whoever triggered the recording, {@code null} for the scheduler
 */
public record RecordSnapshotCommand(
        UUID periodId,
        String ageGroup,
        LocalDate date,
        LocalTime time,
        String roomName,
        UUID actorId,
        boolean automatic,
        String notes
) {
}
