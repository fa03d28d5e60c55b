package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.time.LocalDate;
import java.util.UUID;

public interface OpenCheckIn {

    UUID getChildId();

    LocalDate getDateOfBirth();
}
