package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.Map;

public record SnapshotBatchResponse(
        long recorded,
        long duplicate,
        long failed,
        Map<String, SnapshotOutcomeResponse> outcomes
) {
}
