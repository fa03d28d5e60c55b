package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Folds loaded snapshots into report rows. No I/O; callers decide which snapshots to load.
 */
public final class ComplianceReportAggregator {

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    private static final BigDecimal FULL_RATE = HUNDRED.setScale(SCALE);

    private ComplianceReportAggregator() {
    }

    public static ComplianceStats stats(List<RatioSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return new ComplianceStats(0, 0, 0, 0, ZERO, ZERO, ZERO, ZERO, ZERO, null, null, FULL_RATE);
        }
        int total = snapshots.size();
        int compliant = 0;
        int alertsSent = 0;
        long staffSum = 0;
        long childSum = 0;
        BigDecimal percentSum = BigDecimal.ZERO;
        BigDecimal minPercent = null;
        BigDecimal maxPercent = null;
        LocalTime first = null;
        LocalTime last = null;

        for (RatioSnapshot snapshot : snapshots) {
            if (snapshot.isCompliant()) {
                compliant++;
            }
            if (snapshot.isAlertSent()) {
                alertsSent++;
            }
            staffSum += snapshot.getStaffCount();
            childSum += snapshot.getChildCount();
            BigDecimal percent = snapshot.getCompliancePercent();
            percentSum = percentSum.add(percent);
            minPercent = minPercent == null || percent.compareTo(minPercent) < 0 ? percent : minPercent;
            maxPercent = maxPercent == null || percent.compareTo(maxPercent) > 0 ? percent : maxPercent;
            LocalTime time = snapshot.getSnapshotTime();
            first = first == null || time.isBefore(first) ? time : first;
            last = last == null || time.isAfter(last) ? time : last;
        }

        return new ComplianceStats(
                total,
                compliant,
                total - compliant,
                alertsSent,
                minPercent.setScale(SCALE, RoundingMode.HALF_UP),
                average(percentSum, total),
                maxPercent.setScale(SCALE, RoundingMode.HALF_UP),
                average(BigDecimal.valueOf(staffSum), total),
                average(BigDecimal.valueOf(childSum), total),
                first,
                last,
                rate(compliant, total)
        );
    }

    public static DailyComplianceSummary dailySummary(LocalDate date, List<RatioSnapshot> snapshots) {
        List<RatioSnapshot> ofDay = snapshots.stream()
                .filter(snapshot -> date.equals(snapshot.getSnapshotDate()))
                .toList();
        return new DailyComplianceSummary(date, stats(ofDay));
    }

    public static List<AgeGroupComplianceSummary> summaryByAgeGroup(List<RatioSnapshot> snapshots, RatioPolicy policy) {
        Map<String, List<RatioSnapshot>> byGroup = snapshots.stream()
                .collect(Collectors.groupingBy(RatioSnapshot::getAgeGroup, TreeMap::new, Collectors.toList()));
        List<AgeGroupComplianceSummary> rows = new ArrayList<>(byGroup.size());
        byGroup.forEach((ageGroup, group) -> rows.add(new AgeGroupComplianceSummary(
                ageGroup,
                policy == null ? null : policy.requiredRatio(ageGroup).orElse(null),
                stats(group)
        )));
        return rows;
    }

    public static List<ComplianceTrendPoint> trend(List<RatioSnapshot> snapshots) {
        Map<LocalDate, List<RatioSnapshot>> byDate = snapshots.stream()
                .collect(Collectors.groupingBy(RatioSnapshot::getSnapshotDate, TreeMap::new, Collectors.toList()));
        List<ComplianceTrendPoint> points = new ArrayList<>(byDate.size());
        byDate.forEach((date, group) -> {
            int total = group.size();
            int compliant = (int) group.stream().filter(RatioSnapshot::isCompliant).count();
            BigDecimal percentSum = group.stream()
                    .map(RatioSnapshot::getCompliancePercent)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            points.add(new ComplianceTrendPoint(
                    date,
                    total,
                    compliant,
                    rate(compliant, total),
                    average(percentSum, total),
                    group.stream().mapToLong(RatioSnapshot::getStaffCount).sum(),
                    group.stream().mapToLong(RatioSnapshot::getChildCount).sum()
            ));
        });
        return points;
    }

    public static List<PeakHourStat> peakNonComplianceHours(List<RatioSnapshot> snapshots) {
        Map<Integer, List<RatioSnapshot>> byHour = snapshots.stream()
                .collect(Collectors.groupingBy(snapshot -> snapshot.getSnapshotTime().getHour(), TreeMap::new,
                        Collectors.toList()));
        List<PeakHourStat> rows = new ArrayList<>(byHour.size());
        byHour.forEach((hour, group) -> {
            int total = group.size();
            int nonCompliant = (int) group.stream().filter(snapshot -> !snapshot.isCompliant()).count();
            rows.add(new PeakHourStat(hour, total, nonCompliant, percentage(nonCompliant, total)));
        });
        rows.sort(Comparator.comparing(PeakHourStat::nonComplianceRate).reversed()
                .thenComparingInt(PeakHourStat::hour));
        return rows;
    }

    private static BigDecimal rate(int compliant, int total) {
        return total == 0 ? FULL_RATE : percentage(compliant, total);
    }

    private static BigDecimal percentage(int part, int total) {
        if (total == 0) {
            return ZERO;
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal average(BigDecimal sum, int count) {
        if (count == 0) {
            return ZERO;
        }
        return sum.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }
}
