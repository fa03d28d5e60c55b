package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;

public record PeakHourStat(int hour, int totalSnapshots, int nonCompliantCount, BigDecimal nonComplianceRate) {
}
