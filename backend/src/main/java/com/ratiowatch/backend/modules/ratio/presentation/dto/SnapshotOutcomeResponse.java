package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.UUID;

public record SnapshotOutcomeResponse(
        String status,
        UUID snapshotId,
        String errorCode,
        String message
) {
}
