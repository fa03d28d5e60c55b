package com.ratiowatch.backend.modules.ratio.infrastructure.persistence;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RatioSnapshotRepository extends JpaRepository<RatioSnapshot, UUID>, RatioSnapshotRepositoryCustom {

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate = :date
             order by s.snapshotTime desc, s.ageGroup asc
            """)
    List<RatioSnapshot> findByPeriodAndDate(
            @Param("periodId") UUID periodId,
            @Param("date") LocalDate date
    );

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate between :from and :to
             order by s.snapshotDate asc, s.snapshotTime asc
            """)
    List<RatioSnapshot> findByPeriodAndDateRange(
            @Param("periodId") UUID periodId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate = :date
               and s.compliant = false
               and s.alertSent = false
             order by s.snapshotTime desc, s.ageGroup asc
            """)
    List<RatioSnapshot> findPendingAlerts(
            @Param("periodId") UUID periodId,
            @Param("date") LocalDate date
    );

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate = :date
               and s.compliant = true
               and s.compliancePercent >= :threshold
             order by s.snapshotTime desc, s.ageGroup asc
            """)
    List<RatioSnapshot> findAtWarningLevel(
            @Param("periodId") UUID periodId,
            @Param("date") LocalDate date,
            @Param("threshold") BigDecimal threshold
    );

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.compliant = false
               and s.snapshotDate between :from and :to
             order by s.snapshotDate desc, s.snapshotTime desc
            """)
    List<RatioSnapshot> findNonCompliant(
            @Param("periodId") UUID periodId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    /**
     * Room-less snapshots carrying the latest time of the day for their age group.
     */
    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate = :date
               and s.roomName is null
               and s.snapshotTime = (
                    select max(s2.snapshotTime) from RatioSnapshot s2
                     where s2.schoolPeriodId = s.schoolPeriodId
                       and s2.snapshotDate = s.snapshotDate
                       and s2.ageGroup = s.ageGroup
                       and s2.roomName is null)
             order by s.ageGroup asc
            """)
    List<RatioSnapshot> findLatestByAgeGroup(
            @Param("periodId") UUID periodId,
            @Param("date") LocalDate date
    );

    @Query("""
            select max(s.snapshotDate) from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.snapshotDate <= :date
               and s.roomName is null
            """)
    Optional<LocalDate> findLatestSnapshotDate(
            @Param("periodId") UUID periodId,
            @Param("date") LocalDate date
    );

    @Query("""
            select s from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.roomName = :roomName
               and s.snapshotDate between :from and :to
             order by s.snapshotDate desc, s.snapshotTime desc
            """)
    List<RatioSnapshot> findRoomHistory(
            @Param("periodId") UUID periodId,
            @Param("roomName") String roomName,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    @Query("""
            select distinct s.roomName from RatioSnapshot s
             where s.schoolPeriodId = :periodId
               and s.roomName is not null
             order by s.roomName asc
            """)
    List<String> findDistinctRoomNames(@Param("periodId") UUID periodId);

    boolean existsBySchoolPeriodIdAndAgeGroupAndRoomNameAndSnapshotDateAndSnapshotTime(
            UUID schoolPeriodId,
            String ageGroup,
            String roomName,
            LocalDate snapshotDate,
            LocalTime snapshotTime
    );

    boolean existsBySchoolPeriodIdAndAgeGroupAndRoomNameIsNullAndSnapshotDateAndSnapshotTime(
            UUID schoolPeriodId,
            String ageGroup,
            LocalDate snapshotDate,
            LocalTime snapshotTime
    );

    /**
     * Sets the alert flag only while it is still clear, so concurrent acknowledgements keep the first stamp.
     *
     * @return 1 when this call set the flag, 0 when it was already set or the snapshot does not exist
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RatioSnapshot s
               set s.alertSent = true, s.alertSentAt = :sentAt
             where s.id = :id
               and s.alertSent = false
            """)
    int markAlertSentIfPending(@Param("id") UUID id, @Param("sentAt") OffsetDateTime sentAt);

    @Modifying
    @Query("delete from RatioSnapshot s where s.snapshotDate < :cutoff")
    int deleteBySnapshotDateBefore(@Param("cutoff") LocalDate cutoff);
}
