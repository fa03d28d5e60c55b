package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.util.UUID;

/**
 * One on-duty staff member with the schedule they are covering. {@code ageGroup} is the raw
 * schedule label.
 */
public interface OnDutyStaff {

    UUID getPersonId();

    String getAgeGroup();

    String getRoomName();
}
