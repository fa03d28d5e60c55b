package com.ratiowatch.backend.modules.presence.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Clock-in record kept by the staffing system. Read here only to decide who is on the floor.
 */
@Entity
@Table(name = "staff_time_entry")
public class StaffTimeEntry {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "person_id", nullable = false, columnDefinition = "uuid")
    private UUID personId;

    @Column(name = "school_period_id", nullable = false, columnDefinition = "uuid")
    private UUID schoolPeriodId;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "clock_in_at")
    private OffsetDateTime clockInAt;

    @Column(name = "clock_out_at")
    private OffsetDateTime clockOutAt;

    @Column(name = "break_start_at")
    private OffsetDateTime breakStartAt;

    @Column(name = "break_end_at")
    private OffsetDateTime breakEndAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private StaffTimeEntryStatus status = StaffTimeEntryStatus.ACTIVE;

    public UUID getId() {
        return id;
    }

    public UUID getPersonId() {
        return personId;
    }

    public void setPersonId(UUID personId) {
        this.personId = personId;
    }

    public UUID getSchoolPeriodId() {
        return schoolPeriodId;
    }

    public void setSchoolPeriodId(UUID schoolPeriodId) {
        this.schoolPeriodId = schoolPeriodId;
    }

    public LocalDate getWorkDate() {
        return workDate;
    }

    public void setWorkDate(LocalDate workDate) {
        this.workDate = workDate;
    }

    public OffsetDateTime getClockInAt() {
        return clockInAt;
    }

    public void setClockInAt(OffsetDateTime clockInAt) {
        this.clockInAt = clockInAt;
    }

    public OffsetDateTime getClockOutAt() {
        return clockOutAt;
    }

    public void setClockOutAt(OffsetDateTime clockOutAt) {
        this.clockOutAt = clockOutAt;
    }

    public OffsetDateTime getBreakStartAt() {
        return breakStartAt;
    }

    public void setBreakStartAt(OffsetDateTime breakStartAt) {
        this.breakStartAt = breakStartAt;
    }

    public OffsetDateTime getBreakEndAt() {
        return breakEndAt;
    }

    public void setBreakEndAt(OffsetDateTime breakEndAt) {
        this.breakEndAt = breakEndAt;
    }

    public StaffTimeEntryStatus getStatus() {
        return status;
    }

    public void setStatus(StaffTimeEntryStatus status) {
        this.status = status;
    }
}
