package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.List;

public record RatioSnapshotListResponse(
        List<RatioSnapshotResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
