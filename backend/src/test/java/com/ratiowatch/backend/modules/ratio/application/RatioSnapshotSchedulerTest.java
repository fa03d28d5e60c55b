package com.ratiowatch.backend.modules.ratio.application;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RatioSnapshotSchedulerTest {

    private static final UUID FIRST_PERIOD = UUID.randomUUID();
    private static final UUID SECOND_PERIOD = UUID.randomUUID();
    private static final LocalDate DAY = LocalDate.of(2025, 3, 3);
    private static final LocalTime MINUTE = LocalTime.of(10, 30);

    @Mock
    private RatioSnapshotService ratioSnapshotService;

    private RatioSnapshotScheduler scheduler;

    @BeforeEach
    void setUp() {
        RatioProperties properties = new RatioProperties();
        properties.getScheduler().setPeriodIds(List.of(FIRST_PERIOD, SECOND_PERIOD));
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-03T10:30:47Z").toInstant(), ZoneOffset.UTC);
        scheduler = new RatioSnapshotScheduler(ratioSnapshotService, properties, clock);
    }

    @Test
    void recordsEveryConfiguredPeriodAtTheCurrentMinute() {
        when(ratioSnapshotService.recordAll(eq(FIRST_PERIOD), eq(DAY), eq(MINUTE), isNull(), eq(true)))
                .thenReturn(new SnapshotBatchResult(Map.of("INFANT", SnapshotOutcome.recorded(UUID.randomUUID()))));
        when(ratioSnapshotService.recordAll(eq(SECOND_PERIOD), eq(DAY), eq(MINUTE), isNull(), eq(true)))
                .thenReturn(new SnapshotBatchResult(Map.of("INFANT", SnapshotOutcome.failed("PRESENCE_DATA_UNAVAILABLE", "down"))));

        scheduler.recordScheduledSnapshots();

        verify(ratioSnapshotService).recordAll(FIRST_PERIOD, DAY, MINUTE, null, true);
        verify(ratioSnapshotService).recordAll(SECOND_PERIOD, DAY, MINUTE, null, true);
    }

    @Test
    void oneFailingPeriodDoesNotStopTheNext() {
        when(ratioSnapshotService.recordAll(eq(FIRST_PERIOD), eq(DAY), eq(MINUTE), isNull(), eq(true)))
                .thenThrow(new IllegalStateException("boom"));
        when(ratioSnapshotService.recordAll(eq(SECOND_PERIOD), eq(DAY), eq(MINUTE), isNull(), eq(true)))
                .thenReturn(new SnapshotBatchResult(Map.of()));

        scheduler.recordScheduledSnapshots();

        verify(ratioSnapshotService).recordAll(SECOND_PERIOD, DAY, MINUTE, null, true);
    }
}
