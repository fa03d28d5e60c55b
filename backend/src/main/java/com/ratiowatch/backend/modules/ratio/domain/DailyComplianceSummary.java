package com.ratiowatch.backend.modules.ratio.domain;

import java.time.LocalDate;

public record DailyComplianceSummary(LocalDate date, ComplianceStats stats) {
}
