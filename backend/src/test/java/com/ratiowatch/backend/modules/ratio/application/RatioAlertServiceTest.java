package com.ratiowatch.backend.modules.ratio.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;
import com.ratiowatch.backend.modules.ratio.domain.InvalidRatioParametersException;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RatioAlertServiceTest {

    private static final UUID PERIOD_ID = UUID.randomUUID();
    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);

    @Mock
    private RatioSnapshotRepository ratioSnapshotRepository;

    @Mock
    private RatioSnapshotService ratioSnapshotService;

    private RatioProperties ratioProperties;
    private RatioAlertService ratioAlertService;

    @BeforeEach
    void setUp() {
        ratioProperties = new RatioProperties();
        ratioAlertService = new RatioAlertService(ratioSnapshotRepository, ratioSnapshotService, ratioProperties);
    }

    @Test
    void warningLevelUsesConfiguredDefaultThreshold() {
        ratioProperties.getAlert().setWarningThresholdPercent(new BigDecimal("85"));
        when(ratioSnapshotRepository.findAtWarningLevel(PERIOD_ID, DAY, new BigDecimal("85"))).thenReturn(List.of());

        assertThat(ratioAlertService.snapshotsAtWarningLevel(PERIOD_ID, DAY, null)).isEmpty();
    }

    @Test
    void thresholdMustBeWithinPercentRange() {
        assertThat(ratioAlertService.resolveThreshold(new BigDecimal("100"))).isEqualByComparingTo("100");
        assertThatThrownBy(() -> ratioAlertService.resolveThreshold(BigDecimal.ZERO))
                .isInstanceOf(InvalidRatioParametersException.class);
        assertThatThrownBy(() -> ratioAlertService.resolveThreshold(new BigDecimal("100.01")))
                .isInstanceOf(InvalidRatioParametersException.class);
        verify(ratioSnapshotRepository, never()).findAtWarningLevel(any(), any(), any());
    }

    @Test
    void pendingAlertsRequirePeriodAndDate() {
        assertThatThrownBy(() -> ratioAlertService.snapshotsNeedingAlert(null, DAY))
                .isInstanceOf(InvalidRatioParametersException.class);
        assertThatThrownBy(() -> ratioAlertService.snapshotsNeedingAlert(PERIOD_ID, null))
                .isInstanceOf(InvalidRatioParametersException.class);
    }

    @Test
    void markAlertSentDelegatesToSnapshotService() {
        UUID snapshotId = UUID.randomUUID();

        ratioAlertService.markAlertSent(snapshotId);

        verify(ratioSnapshotService).markAlertSent(snapshotId);
    }
}
