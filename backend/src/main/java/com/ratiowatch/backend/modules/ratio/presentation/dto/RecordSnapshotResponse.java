package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.UUID;

public record RecordSnapshotResponse(UUID snapshotId) {
}
