package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

public interface ScheduledRoomAssignment {

    String getRoomName();

    String getAgeGroup();
}
