package com.ratiowatch.backend.modules.ratio;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.application.PresenceCounter;
import com.ratiowatch.backend.modules.ratio.application.ScheduledRoom;
import com.ratiowatch.backend.support.AbstractPostgresIntegrationTest;
import com.ratiowatch.backend.support.TestPresenceFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PresenceCounterIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 3);
    private static final LocalTime TEN = LocalTime.of(10, 0);

    @Autowired
    private PresenceCounter presenceCounter;

    @Autowired
    private TestPresenceFactory testPresenceFactory;

    private UUID periodId;

    @BeforeEach
    void setUp() {
        periodId = UUID.randomUUID();
    }

    @Test
    void staffOnBreakClockedOutOrCancelledAreNotCounted() {
        testPresenceFactory.staffOnDuty(periodId, DAY, "TODDLER", "Bumblebees");
        testPresenceFactory.staffOnOpenBreak(periodId, DAY, "TODDLER", "Bumblebees");
        testPresenceFactory.staffClockedOut(periodId, DAY, "TODDLER", "Bumblebees");
        testPresenceFactory.staffWithCancelledSchedule(periodId, DAY, "TODDLER", "Bumblebees");

        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "TODDLER", DAY, TEN, null)).isEqualTo(1);
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "TODDLER", DAY, TEN, "Bumblebees")).isEqualTo(1);
        assertThat(presenceCounter.scheduledRoomAssignments(periodId, DAY, TEN))
                .containsExactly(new ScheduledRoom("Bumblebees", "TODDLER"));
    }

    @Test
    @DisplayName("a schedule ending exactly at the snapshot time still counts, one starting after it does not")
    void scheduleWindowIsInclusiveAtBothEnds() {
        testPresenceFactory.staffScheduled(periodId, DAY, "INFANT", "Sunflowers", LocalTime.of(7, 0), TEN);
        testPresenceFactory.staffScheduled(periodId, DAY, "INFANT", "Sunflowers", TEN, LocalTime.of(15, 0));
        testPresenceFactory.staffScheduled(periodId, DAY, "INFANT", "Sunflowers", LocalTime.of(10, 1), LocalTime.of(15, 0));
        testPresenceFactory.staffScheduled(periodId, DAY, "INFANT", "Sunflowers", LocalTime.of(7, 0), LocalTime.of(9, 59));

        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "INFANT", DAY, TEN, null)).isEqualTo(2);
    }

    @Test
    void staffCountIsScopedToTheRequestedRoom() {
        testPresenceFactory.staffOnDuty(periodId, DAY, "PRESCHOOL", "Owls");
        testPresenceFactory.staffOnDuty(periodId, DAY, "PRESCHOOL", "Owls");
        testPresenceFactory.staffOnDuty(periodId, DAY, "PRESCHOOL", "Foxes");

        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "PRESCHOOL", DAY, TEN, null)).isEqualTo(3);
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "PRESCHOOL", DAY, TEN, "Owls")).isEqualTo(2);
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "PRESCHOOL", DAY, TEN, "Foxes")).isEqualTo(1);
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "PRESCHOOL", DAY, TEN, "Hedgehogs")).isZero();
    }

    @Test
    @DisplayName("free-text schedule labels resolve to the same age group for room lookup and staff count")
    void unnormalizedScheduleLabelIsCounted() {
        testPresenceFactory.staffOnDuty(periodId, DAY, "School Age", "Kestrels");

        assertThat(presenceCounter.scheduledRoomAssignments(periodId, DAY, TEN))
                .containsExactly(new ScheduledRoom("Kestrels", "SCHOOL_AGE"));
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "SCHOOL_AGE", DAY, TEN, "Kestrels")).isEqualTo(1);
        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "SCHOOL_AGE", DAY, TEN, null)).isEqualTo(1);
    }

    @Test
    void checkedOutChildrenAreNotCounted() {
        testPresenceFactory.childrenCheckedIn(periodId, DAY, 24, 2);
        testPresenceFactory.childrenCheckedOut(periodId, DAY, 24, 3);

        assertThat(presenceCounter.childCountForAgeGroup(periodId, "TODDLER", DAY, TEN, null)).isEqualTo(2);
    }

    @Test
    void otherPeriodsAndDaysAreIgnored() {
        testPresenceFactory.staffOnDuty(UUID.randomUUID(), DAY, "TODDLER", "Bumblebees");
        testPresenceFactory.staffOnDuty(periodId, DAY.plusDays(1), "TODDLER", "Bumblebees");
        testPresenceFactory.childrenCheckedIn(UUID.randomUUID(), DAY, 24, 4);

        assertThat(presenceCounter.staffCountForAgeGroup(periodId, "TODDLER", DAY, TEN, null)).isZero();
        assertThat(presenceCounter.childCountForAgeGroup(periodId, "TODDLER", DAY, TEN, null)).isZero();
    }
}
