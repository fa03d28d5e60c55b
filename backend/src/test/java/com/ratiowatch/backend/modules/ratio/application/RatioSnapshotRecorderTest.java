package com.ratiowatch.backend.modules.ratio.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.DuplicateSnapshotException;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioPolicy;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class RatioSnapshotRecorderTest {

    @Mock
    private RatioSnapshotRepository ratioSnapshotRepository;

    private RatioSnapshotRecorder ratioSnapshotRecorder;
    private RatioSnapshot snapshot;

    @BeforeEach
    void setUp() {
        ratioSnapshotRecorder = new RatioSnapshotRecorder(ratioSnapshotRepository);
        RatioCalculator calculator = new RatioCalculator(new RatioPolicy(List.of(new AgeGroupRule("TODDLER", 8, 18, 36))));
        snapshot = RatioSnapshot.record(
                UUID.randomUUID(),
                LocalDate.of(2025, 3, 1),
                LocalTime.of(10, 0),
                calculator.evaluate("TODDLER", 2, 15),
                false,
                null,
                null
        );
    }

    @Test
    void returnsSavedSnapshot() {
        when(ratioSnapshotRepository.saveAndFlush(snapshot)).thenReturn(snapshot);

        assertThat(ratioSnapshotRecorder.insert(snapshot)).isSameAs(snapshot);
    }

    @Test
    void translatesSnapshotKeyViolationToDuplicate() {
        when(ratioSnapshotRepository.saveAndFlush(snapshot)).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new RuntimeException("ERROR: duplicate key value violates unique constraint \"uq_ratio_snapshot_key\"")
        ));

        assertThatThrownBy(() -> ratioSnapshotRecorder.insert(snapshot))
                .isInstanceOfSatisfying(DuplicateSnapshotException.class,
                        ex -> assertThat(ex.getKey()).isEqualTo(snapshot.key()));
    }

    @Test
    void rethrowsOtherIntegrityViolations() {
        DataIntegrityViolationException violation = new DataIntegrityViolationException(
                "could not execute statement",
                new RuntimeException("ERROR: new row violates check constraint \"ck_ratio_snapshot_counts\"")
        );
        when(ratioSnapshotRepository.saveAndFlush(snapshot)).thenThrow(violation);

        assertThatThrownBy(() -> ratioSnapshotRecorder.insert(snapshot)).isSameAs(violation);
    }
}
