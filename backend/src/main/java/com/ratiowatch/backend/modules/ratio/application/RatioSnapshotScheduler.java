package com.ratiowatch.backend.modules.ratio.application;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic automatic recording for the configured periods. Missed or failed runs are not retried.
 */
@Service
@ConditionalOnProperty(prefix = "ratio.scheduler", name = "enabled", havingValue = "true")
public class RatioSnapshotScheduler {

    private static final Logger log = LoggerFactory.getLogger(RatioSnapshotScheduler.class);

    private final RatioSnapshotService ratioSnapshotService;
    private final RatioProperties ratioProperties;
    private final Clock clock;

    public RatioSnapshotScheduler(
            RatioSnapshotService ratioSnapshotService,
            RatioProperties ratioProperties,
            Clock clock
    ) {
        this.ratioSnapshotService = ratioSnapshotService;
        this.ratioProperties = ratioProperties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${ratio.scheduler.interval:PT30M}", initialDelayString = "${ratio.scheduler.interval:PT30M}")
    public void recordScheduledSnapshots() {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        for (UUID periodId : ratioProperties.getScheduler().getPeriodIds()) {
            try {
                SnapshotBatchResult result = ratioSnapshotService.recordAll(
                        periodId, now.toLocalDate(), now.toLocalTime(), null, true);
                if (result.failedCount() > 0) {
                    log.warn("[RATIO][Batch] period={} at={} failed={} outcomes={}",
                            periodId, now, result.failedCount(), result.outcomes());
                }
            } catch (RuntimeException ex) {
                log.warn("[RATIO][Batch] period={} at={} aborted: {}", periodId, now, ex.getMessage(), ex);
            }
        }
    }
}
