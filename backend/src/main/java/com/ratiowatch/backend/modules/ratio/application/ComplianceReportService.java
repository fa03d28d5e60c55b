package com.ratiowatch.backend.modules.ratio.application;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.domain.AgeGroupComplianceSummary;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.ComplianceReportAggregator;
import com.ratiowatch.backend.modules.ratio.domain.ComplianceTrendPoint;
import com.ratiowatch.backend.modules.ratio.domain.DailyComplianceSummary;
import com.ratiowatch.backend.modules.ratio.domain.InvalidRatioParametersException;
import com.ratiowatch.backend.modules.ratio.domain.PeakHourStat;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioEvaluation;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class ComplianceReportService {

    private final RatioSnapshotRepository ratioSnapshotRepository;
    private final PresenceCounter presenceCounter;
    private final RatioCalculator ratioCalculator;

    public ComplianceReportService(
            RatioSnapshotRepository ratioSnapshotRepository,
            PresenceCounter presenceCounter,
            RatioCalculator ratioCalculator
    ) {
        this.ratioSnapshotRepository = ratioSnapshotRepository;
        this.presenceCounter = presenceCounter;
        this.ratioCalculator = ratioCalculator;
    }

    public DailyComplianceSummary dailySummary(UUID periodId, LocalDate date) {
        requirePeriod(periodId);
        if (date == null) {
            throw new InvalidRatioParametersException("date is required");
        }
        return ComplianceReportAggregator.dailySummary(date, ratioSnapshotRepository.findByPeriodAndDate(periodId, date));
    }

    public List<AgeGroupComplianceSummary> summaryByAgeGroup(UUID periodId, LocalDate from, LocalDate to) {
        List<RatioSnapshot> snapshots = loadRange(periodId, from, to);
        return ComplianceReportAggregator.summaryByAgeGroup(snapshots, ratioCalculator.getPolicy());
    }

    public List<ComplianceTrendPoint> trend(UUID periodId, LocalDate from, LocalDate to) {
        return ComplianceReportAggregator.trend(loadRange(periodId, from, to));
    }

    public List<PeakHourStat> peakNonComplianceHours(UUID periodId, LocalDate from, LocalDate to) {
        return ComplianceReportAggregator.peakNonComplianceHours(loadRange(periodId, from, to));
    }

    public List<RatioSnapshot> roomHistory(UUID periodId, String roomName, LocalDate from, LocalDate to) {
        requirePeriod(periodId);
        requireRange(from, to);
        if (!StringUtils.hasText(roomName)) {
            throw new InvalidRatioParametersException("roomName must not be blank");
        }
        return ratioSnapshotRepository.findRoomHistory(periodId, roomName, from, to);
    }

    /**
     * Live evaluation of every configured age group and the extra staff the breaches call for.
     */
    public StaffingGap staffingGap(UUID periodId, LocalDate date, LocalTime time) {
        LocalTime at = time.truncatedTo(ChronoUnit.SECONDS);
        List<RatioEvaluation> details = new ArrayList<>();
        for (AgeGroupRule rule : ratioCalculator.getPolicy().ageGroups()) {
            details.add(ratioCalculator.evaluate(
                    rule.code(),
                    null,
                    presenceCounter.count(periodId, rule.code(), date, at, null),
                    date.atTime(at)
            ));
        }
        int totalStaffNeeded = details.stream().mapToInt(RatioEvaluation::staffNeeded).sum();
        boolean overallCompliant = details.stream().allMatch(RatioEvaluation::compliant);
        return new StaffingGap(date, at, totalStaffNeeded, overallCompliant, details);
    }

    private List<RatioSnapshot> loadRange(UUID periodId, LocalDate from, LocalDate to) {
        requirePeriod(periodId);
        requireRange(from, to);
        return ratioSnapshotRepository.findByPeriodAndDateRange(periodId, from, to);
    }

    private static void requirePeriod(UUID periodId) {
        if (periodId == null) {
            throw new InvalidRatioParametersException("periodId is required");
        }
    }

    private static void requireRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new InvalidRatioParametersException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new InvalidRatioParametersException("from must not be after to");
        }
    }

    public record StaffingGap(
            LocalDate date,
            LocalTime time,
            int totalStaffNeeded,
            boolean overallCompliant,
            List<RatioEvaluation> details
    ) {
    }
}
