package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.presence.domain.StaffSchedule;
import com.ratiowatch.backend.modules.presence.domain.StaffScheduleStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffScheduleRepository extends JpaRepository<StaffSchedule, UUID> {

    @Query("""
            select distinct s.roomName as roomName, s.ageGroup as ageGroup
              from StaffSchedule s
             where s.schoolPeriodId = :periodId
               and s.workDate = :workDate
               and s.startTime <= :atTime
               and s.endTime >= :atTime
               and s.status <> :cancelled
               and s.roomName is not null
               and s.ageGroup is not null
             order by s.roomName, s.ageGroup
            """)
    List<ScheduledRoomAssignment> findScheduledRoomAssignments(
            @Param("periodId") UUID periodId,
            @Param("workDate") LocalDate workDate,
            @Param("atTime") LocalTime atTime,
            @Param("cancelled") StaffScheduleStatus cancelled
    );
}
