package com.ratiowatch.backend.modules.ratio.presentation.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.data.domain.Page;

import com.ratiowatch.backend.modules.ratio.application.ComplianceReportService.StaffingGap;
import com.ratiowatch.backend.modules.ratio.application.RatioMonitorService.MonitorEntry;
import com.ratiowatch.backend.modules.ratio.application.RatioMonitorService.MonitorView;
import com.ratiowatch.backend.modules.ratio.application.SnapshotBatchResult;
import com.ratiowatch.backend.modules.ratio.application.SnapshotOutcome;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupComplianceSummary;
import com.ratiowatch.backend.modules.ratio.domain.ComplianceStats;
import com.ratiowatch.backend.modules.ratio.domain.ComplianceTrendPoint;
import com.ratiowatch.backend.modules.ratio.domain.DailyComplianceSummary;
import com.ratiowatch.backend.modules.ratio.domain.PeakHourStat;
import com.ratiowatch.backend.modules.ratio.domain.RatioEvaluation;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

public final class RatioDtoMapper {

    private RatioDtoMapper() {
    }

    public static RatioEvaluationResponse toEvaluationResponse(RatioEvaluation evaluation) {
        return new RatioEvaluationResponse(
                evaluation.ageGroup(),
                evaluation.roomName(),
                evaluation.staffCount(),
                evaluation.childCount(),
                evaluation.requiredRatio(),
                evaluation.actualRatio().toStoredValue(),
                evaluation.actualRatio().isUnbounded(),
                evaluation.compliant(),
                evaluation.compliancePercent(),
                evaluation.staffNeeded(),
                evaluation.additionalCapacity(),
                evaluation.roomChildCountApproximate(),
                evaluation.calculatedAt()
        );
    }

    public static List<RatioEvaluationResponse> toEvaluationResponses(List<RatioEvaluation> evaluations) {
        return evaluations.stream().map(RatioDtoMapper::toEvaluationResponse).toList();
    }

    public static RatioSnapshotResponse toSnapshotResponse(RatioSnapshot snapshot) {
        return new RatioSnapshotResponse(
                snapshot.getId(),
                snapshot.getSchoolPeriodId(),
                snapshot.getSnapshotDate(),
                snapshot.getSnapshotTime(),
                snapshot.getAgeGroup(),
                snapshot.getRoomName(),
                snapshot.getStaffCount(),
                snapshot.getChildCount(),
                snapshot.getRequiredRatio(),
                snapshot.getActualRatio().toStoredValue(),
                snapshot.getActualRatio().isUnbounded(),
                snapshot.isCompliant(),
                snapshot.getCompliancePercent(),
                snapshot.isRoomChildCountApproximate(),
                snapshot.isAlertSent(),
                snapshot.getAlertSentAt(),
                snapshot.getNotes(),
                snapshot.isAutomatic(),
                snapshot.getRecordedBy(),
                snapshot.getCreatedAt()
        );
    }

    public static List<RatioSnapshotResponse> toSnapshotResponses(List<RatioSnapshot> snapshots) {
        return snapshots.stream().map(RatioDtoMapper::toSnapshotResponse).toList();
    }

    public static RatioSnapshotListResponse toSnapshotListResponse(Page<RatioSnapshot> page) {
        return new RatioSnapshotListResponse(
                toSnapshotResponses(page.getContent()),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }

    public static SnapshotBatchResponse toBatchResponse(SnapshotBatchResult result) {
        Map<String, SnapshotOutcomeResponse> outcomes = new LinkedHashMap<>();
        result.outcomes().forEach((key, outcome) -> outcomes.put(key, toOutcomeResponse(outcome)));
        return new SnapshotBatchResponse(
                result.recordedCount(),
                result.duplicateCount(),
                result.failedCount(),
                outcomes
        );
    }

    private static SnapshotOutcomeResponse toOutcomeResponse(SnapshotOutcome outcome) {
        return new SnapshotOutcomeResponse(
                outcome.status().name(),
                outcome.snapshotId(),
                outcome.errorCode(),
                outcome.message()
        );
    }

    public static ComplianceStatsResponse toStatsResponse(ComplianceStats stats) {
        return new ComplianceStatsResponse(
                stats.totalSnapshots(),
                stats.compliantCount(),
                stats.nonCompliantCount(),
                stats.alertsSent(),
                stats.minCompliancePercent(),
                stats.avgCompliancePercent(),
                stats.maxCompliancePercent(),
                stats.avgStaffCount(),
                stats.avgChildCount(),
                stats.firstSnapshotTime(),
                stats.lastSnapshotTime(),
                stats.complianceRate()
        );
    }

    public static DailySummaryResponse toDailySummaryResponse(DailyComplianceSummary summary) {
        return new DailySummaryResponse(summary.date(), toStatsResponse(summary.stats()));
    }

    public static List<AgeGroupSummaryResponse> toAgeGroupSummaryResponses(List<AgeGroupComplianceSummary> rows) {
        return rows.stream()
                .map(row -> new AgeGroupSummaryResponse(row.ageGroup(), row.requiredRatio(), toStatsResponse(row.stats())))
                .toList();
    }

    public static List<TrendPointResponse> toTrendResponses(List<ComplianceTrendPoint> points) {
        return points.stream()
                .map(point -> new TrendPointResponse(
                        point.date(),
                        point.totalSnapshots(),
                        point.compliantCount(),
                        point.complianceRate(),
                        point.avgCompliancePercent(),
                        point.totalStaff(),
                        point.totalChildren()
                ))
                .toList();
    }

    public static List<PeakHourResponse> toPeakHourResponses(List<PeakHourStat> rows) {
        return rows.stream()
                .map(row -> new PeakHourResponse(row.hour(), row.totalSnapshots(), row.nonCompliantCount(),
                        row.nonComplianceRate()))
                .toList();
    }

    public static StaffingGapResponse toStaffingGapResponse(StaffingGap gap) {
        return new StaffingGapResponse(
                gap.date(),
                gap.time(),
                gap.totalStaffNeeded(),
                gap.overallCompliant(),
                toEvaluationResponses(gap.details())
        );
    }

    public static MonitorResponse toMonitorResponse(MonitorView view) {
        List<MonitorEntryResponse> entries = view.entries().stream()
                .map(RatioDtoMapper::toMonitorEntryResponse)
                .toList();
        return new MonitorResponse(
                view.date(),
                view.time(),
                view.stale(),
                view.dataAsOfDate(),
                view.dataAsOf(),
                entries,
                toDailySummaryResponse(view.summary())
        );
    }

    private static MonitorEntryResponse toMonitorEntryResponse(MonitorEntry entry) {
        return new MonitorEntryResponse(
                entry.ageGroup(),
                entry.staffCount(),
                entry.childCount(),
                entry.requiredRatio(),
                entry.actualRatio().toStoredValue(),
                entry.actualRatio().isUnbounded(),
                entry.compliant(),
                entry.compliancePercent(),
                entry.staffNeeded(),
                entry.additionalCapacity(),
                entry.warning(),
                entry.breach()
        );
    }
}
