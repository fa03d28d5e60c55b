package com.ratiowatch.backend.modules.ratio.domain;

import static com.ratiowatch.backend.support.TestReflection.setField;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ComplianceReportAggregatorTest {

    private static final UUID PERIOD_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);

    private final RatioCalculator calculator = new RatioCalculator(new RatioPolicy(List.of(
            new AgeGroupRule("INFANT", 5, 0, 18),
            new AgeGroupRule("TODDLER", 8, 18, 36)
    )));

    @Test
    @DisplayName("a day without snapshots is reported as fully compliant")
    void emptyDay() {
        DailyComplianceSummary summary = ComplianceReportAggregator.dailySummary(DAY, List.of());

        ComplianceStats stats = summary.stats();
        assertThat(stats.totalSnapshots()).isZero();
        assertThat(stats.compliantCount()).isZero();
        assertThat(stats.nonCompliantCount()).isZero();
        assertThat(stats.alertsSent()).isZero();
        assertThat(stats.avgCompliancePercent()).isEqualByComparingTo("0");
        assertThat(stats.firstSnapshotTime()).isNull();
        assertThat(stats.lastSnapshotTime()).isNull();
        assertThat(stats.complianceRate()).isEqualByComparingTo("100");
    }

    @Test
    void dailySummaryAggregatesOneDay() {
        RatioSnapshot morning = snapshot("TODDLER", DAY, LocalTime.of(9, 0), 2, 15);
        RatioSnapshot noon = snapshot("TODDLER", DAY, LocalTime.of(12, 0), 1, 12);
        RatioSnapshot afternoon = snapshot("INFANT", DAY, LocalTime.of(15, 30), 1, 4);
        RatioSnapshot otherDay = snapshot("INFANT", DAY.plusDays(1), LocalTime.of(9, 0), 0, 3);
        setField(noon, "alertSent", true);
        setField(noon, "alertSentAt", OffsetDateTime.parse("2025-03-01T12:01:00Z"));

        ComplianceStats stats = ComplianceReportAggregator
                .dailySummary(DAY, List.of(morning, noon, afternoon, otherDay))
                .stats();

        assertThat(stats.totalSnapshots()).isEqualTo(3);
        assertThat(stats.compliantCount()).isEqualTo(2);
        assertThat(stats.nonCompliantCount()).isEqualTo(1);
        assertThat(stats.alertsSent()).isEqualTo(1);
        assertThat(stats.minCompliancePercent()).isEqualByComparingTo("80.00");
        assertThat(stats.maxCompliancePercent()).isEqualByComparingTo("150.00");
        // (93.75 + 150.00 + 80.00) / 3
        assertThat(stats.avgCompliancePercent()).isEqualByComparingTo("107.92");
        assertThat(stats.avgStaffCount()).isEqualByComparingTo("1.33");
        assertThat(stats.avgChildCount()).isEqualByComparingTo("10.33");
        assertThat(stats.firstSnapshotTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(stats.lastSnapshotTime()).isEqualTo(LocalTime.of(15, 30));
        assertThat(stats.complianceRate()).isEqualByComparingTo("66.67");
    }

    @Test
    void summaryByAgeGroupIsOrderedAndCarriesConfiguredRatio() {
        List<RatioSnapshot> snapshots = List.of(
                snapshot("TODDLER", DAY, LocalTime.of(9, 0), 2, 15),
                snapshot("INFANT", DAY, LocalTime.of(9, 0), 1, 4),
                snapshot("INFANT", DAY, LocalTime.of(10, 0), 0, 2)
        );
        RatioPolicy infantsOnly = new RatioPolicy(List.of(new AgeGroupRule("INFANT", 5, 0, 18)));

        List<AgeGroupComplianceSummary> rows = ComplianceReportAggregator.summaryByAgeGroup(snapshots, infantsOnly);

        assertThat(rows).extracting(AgeGroupComplianceSummary::ageGroup).containsExactly("INFANT", "TODDLER");
        assertThat(rows.get(0).requiredRatio()).isEqualTo(5);
        assertThat(rows.get(0).stats().totalSnapshots()).isEqualTo(2);
        assertThat(rows.get(0).stats().complianceRate()).isEqualByComparingTo("50.00");
        assertThat(rows.get(1).requiredRatio()).isNull();
    }

    @Test
    void trendHasOneRowPerDateAscending() {
        List<RatioSnapshot> snapshots = List.of(
                snapshot("TODDLER", DAY.plusDays(2), LocalTime.of(9, 0), 1, 12),
                snapshot("TODDLER", DAY, LocalTime.of(9, 0), 2, 15),
                snapshot("INFANT", DAY, LocalTime.of(9, 0), 1, 5)
        );

        List<ComplianceTrendPoint> trend = ComplianceReportAggregator.trend(snapshots);

        assertThat(trend).extracting(ComplianceTrendPoint::date).containsExactly(DAY, DAY.plusDays(2));
        assertThat(trend.get(0).totalSnapshots()).isEqualTo(2);
        assertThat(trend.get(0).complianceRate()).isEqualByComparingTo("100");
        assertThat(trend.get(0).totalStaff()).isEqualTo(3);
        assertThat(trend.get(0).totalChildren()).isEqualTo(20);
        assertThat(trend.get(1).complianceRate()).isEqualByComparingTo("0");
    }

    @Test
    void peakHoursRankByNonComplianceRateThenHour() {
        List<RatioSnapshot> snapshots = List.of(
                snapshot("TODDLER", DAY, LocalTime.of(15, 0), 1, 12),
                snapshot("INFANT", DAY, LocalTime.of(15, 30), 1, 4),
                snapshot("TODDLER", DAY, LocalTime.of(9, 0), 1, 12),
                snapshot("TODDLER", DAY, LocalTime.of(8, 0), 2, 3),
                snapshot("TODDLER", DAY.plusDays(1), LocalTime.of(16, 0), 0, 2)
        );

        List<PeakHourStat> hours = ComplianceReportAggregator.peakNonComplianceHours(snapshots);

        assertThat(hours).extracting(PeakHourStat::hour).containsExactly(9, 16, 15, 8);
        assertThat(hours.get(2).totalSnapshots()).isEqualTo(2);
        assertThat(hours.get(2).nonComplianceRate()).isEqualByComparingTo("50.00");
    }

    private RatioSnapshot snapshot(String ageGroup, LocalDate date, LocalTime time, int staff, int children) {
        RatioEvaluation evaluation = calculator.evaluate(ageGroup, staff, children);
        return RatioSnapshot.record(PERIOD_ID, date, time, evaluation, true, null, null);
    }
}
