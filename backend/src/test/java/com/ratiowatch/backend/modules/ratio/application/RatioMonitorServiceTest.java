package com.ratiowatch.backend.modules.ratio.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.application.RatioMonitorService.MonitorEntry;
import com.ratiowatch.backend.modules.ratio.application.RatioMonitorService.MonitorView;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.ComplianceReportAggregator;
import com.ratiowatch.backend.modules.ratio.domain.PresenceCount;
import com.ratiowatch.backend.modules.ratio.domain.PresenceDataUnavailableException;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioEvaluation;
import com.ratiowatch.backend.modules.ratio.domain.RatioPolicy;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RatioMonitorServiceTest {

    private static final UUID PERIOD_ID = UUID.randomUUID();
    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);
    private static final LocalTime TEN = LocalTime.of(10, 0);

    @Mock
    private PresenceCounter presenceCounter;

    @Mock
    private RatioSnapshotService ratioSnapshotService;

    @Mock
    private RatioAlertService ratioAlertService;

    @Mock
    private ComplianceReportService complianceReportService;

    private RatioCalculator ratioCalculator;
    private RatioMonitorService ratioMonitorService;

    @BeforeEach
    void setUp() {
        ratioCalculator = new RatioCalculator(new RatioPolicy(List.of(
                new AgeGroupRule("INFANT", 5, 0, 18),
                new AgeGroupRule("TODDLER", 8, 18, 36)
        )));
        ratioMonitorService = new RatioMonitorService(
                presenceCounter,
                ratioCalculator,
                ratioSnapshotService,
                ratioAlertService,
                complianceReportService
        );
    }

    @Test
    void monitorShowsLiveEvaluationsWithWarningFlags() {
        stubBoard();
        when(presenceCounter.count(eq(PERIOD_ID), anyString(), eq(DAY), eq(TEN), isNull()))
                .thenAnswer(invocation -> "INFANT".equals(invocation.getArgument(1))
                        ? PresenceCount.of(1, 5)
                        : PresenceCount.of(1, 9));

        MonitorView view = ratioMonitorService.monitor(PERIOD_ID, DAY, TEN);

        assertThat(view.stale()).isFalse();
        assertThat(view.dataAsOfDate()).isNull();
        assertThat(view.dataAsOf()).isNull();
        assertThat(view.entries()).extracting(MonitorEntry::ageGroup).containsExactly("INFANT", "TODDLER");

        MonitorEntry infant = view.entries().get(0);
        assertThat(infant.compliant()).isTrue();
        assertThat(infant.warning()).isTrue();
        assertThat(infant.breach()).isFalse();

        MonitorEntry toddler = view.entries().get(1);
        assertThat(toddler.compliant()).isFalse();
        assertThat(toddler.breach()).isTrue();
        assertThat(toddler.staffNeeded()).isEqualTo(1);
    }

    @Test
    @DisplayName("presence outage falls back to the latest snapshots marked stale")
    void monitorFallsBackToLatestSnapshots() {
        stubBoard();
        when(presenceCounter.count(eq(PERIOD_ID), eq("INFANT"), eq(DAY), eq(TEN), isNull()))
                .thenThrow(new PresenceDataUnavailableException("Presence data unavailable", null));
        RatioSnapshot infant = RatioSnapshot.record(PERIOD_ID, DAY, LocalTime.of(9, 0),
                ratioCalculator.evaluate("INFANT", 0, 2), true, null, null);
        RatioSnapshot toddler = RatioSnapshot.record(PERIOD_ID, DAY, LocalTime.of(9, 30),
                ratioCalculator.evaluate("TODDLER", 2, 10), true, null, null);
        when(ratioSnapshotService.latestByAgeGroupOnOrBefore(PERIOD_ID, DAY)).thenReturn(List.of(infant, toddler));

        MonitorView view = ratioMonitorService.monitor(PERIOD_ID, DAY, TEN);

        assertThat(view.stale()).isTrue();
        assertThat(view.dataAsOfDate()).isEqualTo(DAY);
        assertThat(view.dataAsOf()).isEqualTo(LocalTime.of(9, 30));
        assertThat(view.entries()).hasSize(2);
        MonitorEntry unstaffed = view.entries().get(0);
        assertThat(unstaffed.actualRatio().isUnbounded()).isTrue();
        assertThat(unstaffed.breach()).isTrue();
        assertThat(unstaffed.staffNeeded()).isEqualTo(1);
        assertThat(view.entries().get(1).compliant()).isTrue();
        assertThat(view.entries().get(1).additionalCapacity()).isEqualTo(6);
    }

    @Test
    @DisplayName("an outage before the first snapshot of the day shows the previous day's board")
    void monitorFallsBackToEarlierDayWhenTodayHasNoSnapshots() {
        stubBoard();
        when(presenceCounter.count(eq(PERIOD_ID), eq("INFANT"), eq(DAY), eq(TEN), isNull()))
                .thenThrow(new PresenceDataUnavailableException("Presence data unavailable", null));
        LocalDate previousDay = DAY.minusDays(1);
        RatioSnapshot lastOfYesterday = RatioSnapshot.record(PERIOD_ID, previousDay, LocalTime.of(17, 30),
                ratioCalculator.evaluate("TODDLER", 1, 3), true, null, null);
        when(ratioSnapshotService.latestByAgeGroupOnOrBefore(PERIOD_ID, DAY)).thenReturn(List.of(lastOfYesterday));

        MonitorView view = ratioMonitorService.monitor(PERIOD_ID, DAY, TEN);

        assertThat(view.stale()).isTrue();
        assertThat(view.date()).isEqualTo(DAY);
        assertThat(view.dataAsOfDate()).isEqualTo(previousDay);
        assertThat(view.dataAsOf()).isEqualTo(LocalTime.of(17, 30));
        assertThat(view.entries()).extracting(MonitorEntry::ageGroup).containsExactly("TODDLER");
    }

    @Test
    void monitorWithoutAnySnapshotsIsStaleAndEmpty() {
        stubBoard();
        when(presenceCounter.count(eq(PERIOD_ID), eq("INFANT"), eq(DAY), eq(TEN), isNull()))
                .thenThrow(new PresenceDataUnavailableException("Presence data unavailable", null));
        when(ratioSnapshotService.latestByAgeGroupOnOrBefore(PERIOD_ID, DAY)).thenReturn(List.of());

        MonitorView view = ratioMonitorService.monitor(PERIOD_ID, DAY, TEN);

        assertThat(view.stale()).isTrue();
        assertThat(view.dataAsOfDate()).isNull();
        assertThat(view.dataAsOf()).isNull();
        assertThat(view.entries()).isEmpty();
    }

    @Test
    void roomBoardSkipsUnconfiguredAgeGroups() {
        when(presenceCounter.scheduledRoomAssignments(PERIOD_ID, DAY, TEN)).thenReturn(List.of(
                new ScheduledRoom("Bumblebees", "TODDLER"),
                new ScheduledRoom("Rainbow", "MIXED")
        ));
        when(presenceCounter.count(PERIOD_ID, "TODDLER", DAY, TEN, "Bumblebees"))
                .thenReturn(new PresenceCount(1, 6, true));

        List<RatioEvaluation> evaluations = ratioMonitorService.currentRatiosByRoom(PERIOD_ID, DAY, TEN);

        assertThat(evaluations).singleElement().satisfies(evaluation -> {
            assertThat(evaluation.roomName()).isEqualTo("Bumblebees");
            assertThat(evaluation.roomChildCountApproximate()).isTrue();
        });
        verify(presenceCounter, never()).count(any(), eq("MIXED"), any(), any(), any());
    }

    private void stubBoard() {
        when(ratioAlertService.resolveThreshold(null)).thenReturn(new BigDecimal("90"));
        when(complianceReportService.dailySummary(PERIOD_ID, DAY))
                .thenReturn(ComplianceReportAggregator.dailySummary(DAY, List.of()));
    }
}
