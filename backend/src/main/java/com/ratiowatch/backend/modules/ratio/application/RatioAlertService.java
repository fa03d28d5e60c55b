package com.ratiowatch.backend.modules.ratio.application;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;
import com.ratiowatch.backend.modules.ratio.domain.InvalidRatioParametersException;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Selects snapshots that need a notification. Delivery belongs to the caller, which
 * acknowledges through {@link #markAlertSent(UUID)}.
 */
@Service
@Transactional(readOnly = true)
public class RatioAlertService {

    private static final BigDecimal MAX_THRESHOLD = BigDecimal.valueOf(100);

    private final RatioSnapshotRepository ratioSnapshotRepository;
    private final RatioSnapshotService ratioSnapshotService;
    private final RatioProperties ratioProperties;

    public RatioAlertService(
            RatioSnapshotRepository ratioSnapshotRepository,
            RatioSnapshotService ratioSnapshotService,
            RatioProperties ratioProperties
    ) {
        this.ratioSnapshotRepository = ratioSnapshotRepository;
        this.ratioSnapshotService = ratioSnapshotService;
        this.ratioProperties = ratioProperties;
    }

    public List<RatioSnapshot> snapshotsNeedingAlert(UUID periodId, LocalDate date) {
        requirePeriodAndDate(periodId, date);
        return ratioSnapshotRepository.findPendingAlerts(periodId, date);
    }

    /**
     * Compliant snapshots whose utilisation is at or above {@code thresholdPercent}
     * (configured default when {@code null}).
     */
    public List<RatioSnapshot> snapshotsAtWarningLevel(UUID periodId, LocalDate date, BigDecimal thresholdPercent) {
        requirePeriodAndDate(periodId, date);
        BigDecimal threshold = resolveThreshold(thresholdPercent);
        return ratioSnapshotRepository.findAtWarningLevel(periodId, date, threshold);
    }

    @Transactional
    public RatioSnapshot markAlertSent(UUID snapshotId) {
        return ratioSnapshotService.markAlertSent(snapshotId);
    }

    public BigDecimal resolveThreshold(BigDecimal thresholdPercent) {
        BigDecimal threshold = thresholdPercent != null
                ? thresholdPercent
                : ratioProperties.getAlert().getWarningThresholdPercent();
        if (threshold.signum() <= 0 || threshold.compareTo(MAX_THRESHOLD) > 0) {
            throw new InvalidRatioParametersException("threshold must be greater than 0 and at most 100");
        }
        return threshold;
    }

    private static void requirePeriodAndDate(UUID periodId, LocalDate date) {
        if (periodId == null || date == null) {
            throw new InvalidRatioParametersException("periodId and date are required");
        }
    }
}
