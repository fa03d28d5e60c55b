package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.List;

public record RoomListResponse(List<String> rooms) {
}
