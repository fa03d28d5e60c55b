package com.ratiowatch.backend.modules.presence.domain;

public enum StaffTimeEntryStatus {
    ACTIVE,
    COMPLETED,
    ADJUSTED,
    CANCELLED
}
