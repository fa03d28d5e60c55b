package com.ratiowatch.backend.modules.presence.domain;

public enum StaffScheduleStatus {
    SCHEDULED,
    CONFIRMED,
    COMPLETED,
    CANCELLED,
    NO_SHOW
}
