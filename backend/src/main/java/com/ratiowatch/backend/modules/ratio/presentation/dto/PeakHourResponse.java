package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.math.BigDecimal;

public record PeakHourResponse(int hour, int totalSnapshots, int nonCompliantCount, BigDecimal nonComplianceRate) {
}
