package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RecordSnapshotRequest(
        @NotBlank @Size(max = 32) String ageGroup,
        @NotNull LocalDate date,
        @NotNull LocalTime time,
        @Size(max = 100) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String roomName,
        @Size(max = 1000) String notes
) {
}
