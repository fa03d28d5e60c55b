package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.ratiowatch.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Point-in-time compliance evidence. Rows are write-once; the alert acknowledgement is the
 * only state that changes after insert, and only from unsent to sent.
 */
@Entity
@Table(name = "ratio_snapshot")
public class RatioSnapshot extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "school_period_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID schoolPeriodId;

    @Column(name = "snapshot_date", nullable = false, updatable = false)
    private LocalDate snapshotDate;

    @Column(name = "snapshot_time", nullable = false, updatable = false)
    private LocalTime snapshotTime;

    @Column(name = "age_group", nullable = false, updatable = false, length = 32)
    private String ageGroup;

    @Column(name = "room_name", updatable = false, length = 100)
    private String roomName;

    @Column(name = "staff_count", nullable = false, updatable = false)
    private int staffCount;

    @Column(name = "child_count", nullable = false, updatable = false)
    private int childCount;

    @Column(name = "required_ratio", nullable = false, updatable = false)
    private int requiredRatio;

    // null when children are present with no staff
    @Column(name = "actual_ratio", updatable = false, precision = 7, scale = 2)
    private BigDecimal actualRatio;

    @Column(name = "is_compliant", nullable = false, updatable = false)
    private boolean compliant;

    @Column(name = "compliance_percent", nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal compliancePercent;

    @Column(name = "room_child_count_approximate", nullable = false, updatable = false)
    private boolean roomChildCountApproximate;

    @Column(name = "alert_sent", nullable = false)
    private boolean alertSent;

    @Column(name = "alert_sent_at")
    private OffsetDateTime alertSentAt;

    @Column(name = "notes", updatable = false, length = 1000)
    private String notes;

    @Column(name = "is_automatic", nullable = false, updatable = false)
    private boolean automatic;

    @Column(name = "recorded_by", updatable = false, columnDefinition = "uuid")
    private UUID recordedBy;

    protected RatioSnapshot() {
    }

    public static RatioSnapshot record(
            UUID schoolPeriodId,
            LocalDate snapshotDate,
            LocalTime snapshotTime,
            RatioEvaluation evaluation,
            boolean automatic,
            UUID recordedBy,
            String notes
    ) {
        Objects.requireNonNull(schoolPeriodId, "schoolPeriodId must not be null");
        Objects.requireNonNull(snapshotDate, "snapshotDate must not be null");
        Objects.requireNonNull(snapshotTime, "snapshotTime must not be null");
        Objects.requireNonNull(evaluation, "evaluation must not be null");

        RatioSnapshot snapshot = new RatioSnapshot();
        snapshot.schoolPeriodId = schoolPeriodId;
        snapshot.snapshotDate = snapshotDate;
        snapshot.snapshotTime = snapshotTime;
        snapshot.ageGroup = evaluation.ageGroup();
        snapshot.roomName = evaluation.roomName();
        snapshot.staffCount = evaluation.staffCount();
        snapshot.childCount = evaluation.childCount();
        snapshot.requiredRatio = evaluation.requiredRatio();
        snapshot.actualRatio = evaluation.actualRatio().toStoredValue();
        snapshot.compliant = evaluation.compliant();
        snapshot.compliancePercent = evaluation.compliancePercent();
        snapshot.roomChildCountApproximate = evaluation.roomChildCountApproximate();
        snapshot.automatic = automatic;
        snapshot.recordedBy = recordedBy;
        snapshot.notes = notes;
        return snapshot;
    }

    public SnapshotKey key() {
        return new SnapshotKey(schoolPeriodId, ageGroup, roomName, snapshotDate, snapshotTime);
    }

    public UUID getId() {
        return id;
    }

    public UUID getSchoolPeriodId() {
        return schoolPeriodId;
    }

    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    public LocalTime getSnapshotTime() {
        return snapshotTime;
    }

    public String getAgeGroup() {
        return ageGroup;
    }

    public String getRoomName() {
        return roomName;
    }

    public int getStaffCount() {
        return staffCount;
    }

    public int getChildCount() {
        return childCount;
    }

    public int getRequiredRatio() {
        return requiredRatio;
    }

    public ActualRatio getActualRatio() {
        return ActualRatio.fromStored(actualRatio);
    }

    public boolean isCompliant() {
        return compliant;
    }

    public BigDecimal getCompliancePercent() {
        return compliancePercent;
    }

    public boolean isRoomChildCountApproximate() {
        return roomChildCountApproximate;
    }

    public boolean isAlertSent() {
        return alertSent;
    }

    public OffsetDateTime getAlertSentAt() {
        return alertSentAt;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isAutomatic() {
        return automatic;
    }

    public UUID getRecordedBy() {
        return recordedBy;
    }
}
