package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.presence.domain.CareAttendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CareAttendanceRepository extends JpaRepository<CareAttendance, UUID> {

    @Query("""
            select distinct c.id as childId, c.dateOfBirth as dateOfBirth
              from CareAttendance a
              join a.child c
             where a.schoolPeriodId = :periodId
               and a.attendanceDate = :attendanceDate
               and a.checkInAt is not null
               and a.checkOutAt is null
            """)
    List<OpenCheckIn> findOpenCheckIns(
            @Param("periodId") UUID periodId,
            @Param("attendanceDate") LocalDate attendanceDate
    );
}
