package com.ratiowatch.backend.modules.presence.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "staff_schedule")
public class StaffSchedule {

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

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "room_name", length = 100)
    private String roomName;

    // policy code, or MIXED for multi-age rooms
    @Column(name = "age_group", length = 32)
    private String ageGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private StaffScheduleStatus status = StaffScheduleStatus.SCHEDULED;

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

    public LocalTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalTime startTime) {
        this.startTime = startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalTime endTime) {
        this.endTime = endTime;
    }

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public String getAgeGroup() {
        return ageGroup;
    }

    public void setAgeGroup(String ageGroup) {
        this.ageGroup = ageGroup;
    }

    public StaffScheduleStatus getStatus() {
        return status;
    }

    public void setStatus(StaffScheduleStatus status) {
        this.status = status;
    }
}
