package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.presence.domain.StaffScheduleStatus;
import com.ratiowatch.backend.modules.presence.domain.StaffTimeEntry;
import com.ratiowatch.backend.modules.presence.domain.StaffTimeEntryStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffTimeEntryRepository extends JpaRepository<StaffTimeEntry, UUID> {

    /**
     * Staff clocked in, not on an open break, and inside a non-cancelled schedule at {@code atTime}.
     * Age-group labels are returned as stored; callers match them against normalized codes.
     */
    @Query("""
            select distinct t.personId as personId, s.ageGroup as ageGroup, s.roomName as roomName
              from StaffTimeEntry t, StaffSchedule s
             where s.personId = t.personId
               and s.workDate = t.workDate
               and s.schoolPeriodId = t.schoolPeriodId
               and t.schoolPeriodId = :periodId
               and t.workDate = :workDate
               and t.clockInAt is not null
               and t.clockOutAt is null
               and t.status = :entryStatus
               and (t.breakStartAt is null or t.breakEndAt is not null)
               and s.ageGroup is not null
               and s.startTime <= :atTime
               and s.endTime >= :atTime
               and s.status <> :cancelled
            """)
    List<OnDutyStaff> findStaffOnDuty(
            @Param("periodId") UUID periodId,
            @Param("workDate") LocalDate workDate,
            @Param("atTime") LocalTime atTime,
            @Param("entryStatus") StaffTimeEntryStatus entryStatus,
            @Param("cancelled") StaffScheduleStatus cancelled
    );
}
