package com.ratiowatch.backend.modules.ratio.presentation.dto;

public record RetentionResponse(int days, int deleted) {
}
