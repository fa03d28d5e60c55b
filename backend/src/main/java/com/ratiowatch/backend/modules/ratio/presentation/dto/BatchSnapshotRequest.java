package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.validation.constraints.NotNull;

public record BatchSnapshotRequest(
        @NotNull LocalDate date,
        @NotNull LocalTime time
) {
}
