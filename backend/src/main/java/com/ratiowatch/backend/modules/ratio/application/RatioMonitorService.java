package com.ratiowatch.backend.modules.ratio.application;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.domain.ActualRatio;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.DailyComplianceSummary;
import com.ratiowatch.backend.modules.ratio.domain.PresenceDataUnavailableException;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioEvaluation;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Live ratio board. Nothing is persisted here; when presence data cannot be read the board
 * falls back to the latest recorded snapshots of the most recent day that has any, and says so.
 * Must stay non-transactional: a failed presence read would mark an outer transaction rollback-only.
 */
@Service
public class RatioMonitorService {

    private static final Logger log = LoggerFactory.getLogger(RatioMonitorService.class);

    private final PresenceCounter presenceCounter;
    private final RatioCalculator ratioCalculator;
    private final RatioSnapshotService ratioSnapshotService;
    private final RatioAlertService ratioAlertService;
    private final ComplianceReportService complianceReportService;

    public RatioMonitorService(
            PresenceCounter presenceCounter,
            RatioCalculator ratioCalculator,
            RatioSnapshotService ratioSnapshotService,
            RatioAlertService ratioAlertService,
            ComplianceReportService complianceReportService
    ) {
        this.presenceCounter = presenceCounter;
        this.ratioCalculator = ratioCalculator;
        this.ratioSnapshotService = ratioSnapshotService;
        this.ratioAlertService = ratioAlertService;
        this.complianceReportService = complianceReportService;
    }

    public List<RatioEvaluation> currentRatios(UUID periodId, LocalDate date, LocalTime time) {
        LocalTime at = time.truncatedTo(ChronoUnit.SECONDS);
        List<RatioEvaluation> evaluations = new ArrayList<>();
        for (AgeGroupRule rule : ratioCalculator.getPolicy().ageGroups()) {
            evaluations.add(ratioCalculator.evaluate(
                    rule.code(),
                    null,
                    presenceCounter.count(periodId, rule.code(), date, at, null),
                    date.atTime(at)
            ));
        }
        return evaluations;
    }

    /**
     * Rooms scheduled with an age group outside the policy are left off the board.
     */
    public List<RatioEvaluation> currentRatiosByRoom(UUID periodId, LocalDate date, LocalTime time) {
        LocalTime at = time.truncatedTo(ChronoUnit.SECONDS);
        List<RatioEvaluation> evaluations = new ArrayList<>();
        for (ScheduledRoom room : presenceCounter.scheduledRoomAssignments(periodId, date, at)) {
            if (ratioCalculator.getPolicy().find(room.ageGroup()).isEmpty()) {
                log.debug("Room '{}' scheduled for unconfigured age group {}", room.roomName(), room.ageGroup());
                continue;
            }
            evaluations.add(ratioCalculator.evaluate(
                    room.ageGroup(),
                    room.roomName(),
                    presenceCounter.count(periodId, room.ageGroup(), date, at, room.roomName()),
                    date.atTime(at)
            ));
        }
        return evaluations;
    }

    public MonitorView monitor(UUID periodId, LocalDate date, LocalTime time) {
        BigDecimal threshold = ratioAlertService.resolveThreshold(null);
        DailyComplianceSummary summary = complianceReportService.dailySummary(periodId, date);
        try {
            List<MonitorEntry> entries = currentRatios(periodId, date, time).stream()
                    .map(evaluation -> MonitorEntry.fromEvaluation(evaluation, threshold))
                    .toList();
            return new MonitorView(date, time.truncatedTo(ChronoUnit.SECONDS), false, null, null, entries, summary);
        } catch (PresenceDataUnavailableException ex) {
            log.warn("Presence data unavailable for period {}, serving latest snapshots", periodId);
            List<RatioSnapshot> latest = ratioSnapshotService.latestByAgeGroupOnOrBefore(periodId, date);
            LocalDate dataAsOfDate = latest.isEmpty() ? null : latest.get(0).getSnapshotDate();
            LocalTime dataAsOf = latest.stream()
                    .map(RatioSnapshot::getSnapshotTime)
                    .max(Comparator.naturalOrder())
                    .orElse(null);
            List<MonitorEntry> entries = latest.stream()
                    .map(snapshot -> MonitorEntry.fromSnapshot(snapshot, threshold))
                    .toList();
            return new MonitorView(date, time.truncatedTo(ChronoUnit.SECONDS), true, dataAsOfDate, dataAsOf,
                    entries, summary);
        }
    }

    /**
     * @param dataAsOfDate day of the snapshots shown when {@code stale}; may precede {@code date}
     * @param dataAsOf     time of the snapshots shown when {@code stale}, otherwise {@code null}
     */
    public record MonitorView(
            LocalDate date,
            LocalTime time,
            boolean stale,
            LocalDate dataAsOfDate,
            LocalTime dataAsOf,
            List<MonitorEntry> entries,
            DailyComplianceSummary summary
    ) {
    }

    public record MonitorEntry(
            String ageGroup,
            int staffCount,
            int childCount,
            int requiredRatio,
            ActualRatio actualRatio,
            boolean compliant,
            BigDecimal compliancePercent,
            int staffNeeded,
            int additionalCapacity,
            boolean warning,
            boolean breach
    ) {

        static MonitorEntry fromEvaluation(RatioEvaluation evaluation, BigDecimal threshold) {
            return new MonitorEntry(
                    evaluation.ageGroup(),
                    evaluation.staffCount(),
                    evaluation.childCount(),
                    evaluation.requiredRatio(),
                    evaluation.actualRatio(),
                    evaluation.compliant(),
                    evaluation.compliancePercent(),
                    evaluation.staffNeeded(),
                    evaluation.additionalCapacity(),
                    evaluation.isAtWarningLevel(threshold),
                    !evaluation.compliant()
            );
        }

        static MonitorEntry fromSnapshot(RatioSnapshot snapshot, BigDecimal threshold) {
            int staff = snapshot.getStaffCount();
            int children = snapshot.getChildCount();
            int required = snapshot.getRequiredRatio();
            boolean compliant = snapshot.isCompliant();
            int staffNeeded = compliant ? 0 : (children + required - 1) / required - staff;
            int additionalCapacity = compliant && staff > 0 ? Math.max(0, staff * required - children) : 0;
            return new MonitorEntry(
                    snapshot.getAgeGroup(),
                    staff,
                    children,
                    required,
                    snapshot.getActualRatio(),
                    compliant,
                    snapshot.getCompliancePercent(),
                    staffNeeded,
                    additionalCapacity,
                    compliant && snapshot.getCompliancePercent().compareTo(threshold) >= 0,
                    !compliant
            );
        }
    }
}
