package com.ratiowatch.backend.modules.ratio.application;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import com.ratiowatch.backend.modules.presence.domain.StaffScheduleStatus;
import com.ratiowatch.backend.modules.presence.domain.StaffTimeEntryStatus;
import com.ratiowatch.backend.modules.presence.infrastructure.persistence.CareAttendanceRepository;
import com.ratiowatch.backend.modules.presence.infrastructure.persistence.OnDutyStaff;
import com.ratiowatch.backend.modules.presence.infrastructure.persistence.OpenCheckIn;
import com.ratiowatch.backend.modules.presence.infrastructure.persistence.StaffScheduleRepository;
import com.ratiowatch.backend.modules.presence.infrastructure.persistence.StaffTimeEntryRepository;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.InvalidRatioParametersException;
import com.ratiowatch.backend.modules.ratio.domain.PresenceCount;
import com.ratiowatch.backend.modules.ratio.domain.PresenceDataUnavailableException;
import com.ratiowatch.backend.modules.ratio.domain.RatioPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Counts who is physically present at an instant, from the attendance and staffing records.
 * A failed read surfaces as {@link PresenceDataUnavailableException}, never as a zero count.
 */
@Service
@Transactional(readOnly = true)
public class PresenceCounter {

    private static final Logger log = LoggerFactory.getLogger(PresenceCounter.class);

    private final StaffTimeEntryRepository staffTimeEntryRepository;
    private final StaffScheduleRepository staffScheduleRepository;
    private final CareAttendanceRepository careAttendanceRepository;
    private final RatioPolicy ratioPolicy;

    public PresenceCounter(
            StaffTimeEntryRepository staffTimeEntryRepository,
            StaffScheduleRepository staffScheduleRepository,
            CareAttendanceRepository careAttendanceRepository,
            RatioPolicy ratioPolicy
    ) {
        this.staffTimeEntryRepository = staffTimeEntryRepository;
        this.staffScheduleRepository = staffScheduleRepository;
        this.careAttendanceRepository = careAttendanceRepository;
        this.ratioPolicy = ratioPolicy;
    }

    /**
     * Attendance rows carry no room, so children can only be counted per age group.
     */
    public boolean roomChildCountingSupported() {
        return false;
    }

    public PresenceCount count(UUID periodId, String ageGroup, LocalDate date, LocalTime time, String roomName) {
        int staff = staffCountForAgeGroup(periodId, ageGroup, date, time, roomName);
        int children = childCountForAgeGroup(periodId, ageGroup, date, time, roomName);
        boolean approximate = roomName != null && !roomChildCountingSupported();
        return new PresenceCount(staff, children, approximate);
    }

    /**
     * Distinct staff on duty whose schedule label normalizes to the age group, matching
     * {@link #scheduledRoomAssignments} so "School Age" and "SCHOOL_AGE" count alike.
     */
    public int staffCountForAgeGroup(UUID periodId, String ageGroup, LocalDate date, LocalTime time, String roomName) {
        validate(periodId, date, time, roomName);
        AgeGroupRule rule = ratioPolicy.require(ageGroup);
        List<OnDutyStaff> onDuty = read("staff on duty",
                () -> staffTimeEntryRepository.findStaffOnDuty(
                        periodId, date, time, StaffTimeEntryStatus.ACTIVE, StaffScheduleStatus.CANCELLED));
        return (int) onDuty.stream()
                .filter(staff -> rule.code().equals(AgeGroupRule.normalizeCode(staff.getAgeGroup())))
                .filter(staff -> roomName == null || roomName.equals(staff.getRoomName()))
                .map(OnDutyStaff::getPersonId)
                .distinct()
                .count();
    }

    /**
     * Children checked in and not yet checked out on {@code date}, whose age in whole months
     * falls in the age group's bracket. {@code time} only bounds the call; attendance is open or closed.
     */
    public int childCountForAgeGroup(UUID periodId, String ageGroup, LocalDate date, LocalTime time, String roomName) {
        validate(periodId, date, time, roomName);
        AgeGroupRule rule = ratioPolicy.require(ageGroup);
        if (roomName != null) {
            log.debug("Child count for room '{}' approximated by age group {} count", roomName, rule.code());
        }
        List<OpenCheckIn> openCheckIns = read("open check-ins",
                () -> careAttendanceRepository.findOpenCheckIns(periodId, date));
        return (int) openCheckIns.stream()
                .filter(checkIn -> checkIn.getDateOfBirth() != null)
                .filter(checkIn -> rule.includesAgeInMonths(ChronoUnit.MONTHS.between(checkIn.getDateOfBirth(), date)))
                .map(OpenCheckIn::getChildId)
                .distinct()
                .count();
    }

    public List<ScheduledRoom> scheduledRoomAssignments(UUID periodId, LocalDate date, LocalTime time) {
        validate(periodId, date, time, null);
        return read("scheduled rooms",
                () -> staffScheduleRepository.findScheduledRoomAssignments(
                        periodId, date, time, StaffScheduleStatus.CANCELLED))
                .stream()
                .map(row -> new ScheduledRoom(row.getRoomName(), AgeGroupRule.normalizeCode(row.getAgeGroup())))
                .distinct()
                .toList();
    }

    private static void validate(UUID periodId, LocalDate date, LocalTime time, String roomName) {
        if (periodId == null) {
            throw new InvalidRatioParametersException("periodId is required");
        }
        if (date == null || time == null) {
            throw new InvalidRatioParametersException("date and time are required");
        }
        if (roomName != null && roomName.isBlank()) {
            throw new InvalidRatioParametersException("roomName must not be blank");
        }
    }

    private static <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            log.warn("Presence data unavailable while reading {}: {}", what, ex.getMessage());
            throw new PresenceDataUnavailableException("Presence data unavailable (" + what + ")", ex);
        }
    }
}
