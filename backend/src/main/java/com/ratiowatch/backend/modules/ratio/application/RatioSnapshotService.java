package com.ratiowatch.backend.modules.ratio.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import com.ratiowatch.backend.global.config.RatioProperties;
import com.ratiowatch.backend.global.error.ProblemException;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.DuplicateSnapshotException;
import com.ratiowatch.backend.modules.ratio.domain.InvalidRatioParametersException;
import com.ratiowatch.backend.modules.ratio.domain.PresenceCount;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioEvaluation;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;
import com.ratiowatch.backend.modules.ratio.domain.SnapshotKey;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotSearchCondition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records compliance snapshots and answers queries over them.
 * Writes go through {@link RatioSnapshotRecorder} so every entry of a batch commits or fails on its own.
 */
@Service
public class RatioSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(RatioSnapshotService.class);
    private static final String INTERNAL_ERROR = "internal_error";

    private final PresenceCounter presenceCounter;
    private final RatioCalculator ratioCalculator;
    private final RatioSnapshotRecorder ratioSnapshotRecorder;
    private final RatioSnapshotRepository ratioSnapshotRepository;
    private final RatioProperties ratioProperties;
    private final Clock clock;

    public RatioSnapshotService(
            PresenceCounter presenceCounter,
            RatioCalculator ratioCalculator,
            RatioSnapshotRecorder ratioSnapshotRecorder,
            RatioSnapshotRepository ratioSnapshotRepository,
            RatioProperties ratioProperties,
            Clock clock
    ) {
        this.presenceCounter = presenceCounter;
        this.ratioCalculator = ratioCalculator;
        this.ratioSnapshotRecorder = ratioSnapshotRecorder;
        this.ratioSnapshotRepository = ratioSnapshotRepository;
        this.ratioProperties = ratioProperties;
        this.clock = clock;
    }

    /**
     * Counts presence, evaluates and inserts one snapshot.
     *
     * @return id of the new snapshot
     * @throws DuplicateSnapshotException when the key already exists
     */
    public UUID record(RecordSnapshotCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (command.periodId() == null) {
            throw new InvalidRatioParametersException("periodId is required");
        }
        if (command.date() == null || command.time() == null) {
            throw new InvalidRatioParametersException("date and time are required");
        }
        String roomName = command.roomName();
        if (roomName != null && roomName.isBlank()) {
            throw new InvalidRatioParametersException("roomName must not be blank");
        }

        AgeGroupRule rule = ratioCalculator.getPolicy().require(command.ageGroup());
        LocalTime time = command.time().truncatedTo(ChronoUnit.SECONDS);

        PresenceCount presence = presenceCounter.count(command.periodId(), rule.code(), command.date(), time, roomName);
        RatioEvaluation evaluation = ratioCalculator.evaluate(
                rule.code(),
                roomName,
                presence,
                command.date().atTime(time)
        );

        RatioSnapshot snapshot = RatioSnapshot.record(
                command.periodId(),
                command.date(),
                time,
                evaluation,
                command.automatic(),
                command.actorId(),
                command.notes()
        );
        RatioSnapshot saved = ratioSnapshotRecorder.insert(snapshot);
        log.debug("Recorded ratio snapshot {} for {} compliant={}", saved.getId(), saved.key(), saved.isCompliant());
        return saved.getId();
    }

    /**
     * One room-less snapshot per configured age group, in policy order.
     */
    public SnapshotBatchResult recordAll(UUID periodId, LocalDate date, LocalTime time, UUID actorId, boolean automatic) {
        Map<String, SnapshotOutcome> outcomes = new LinkedHashMap<>();
        for (String ageGroup : ratioCalculator.getPolicy().ageGroupCodes()) {
            RecordSnapshotCommand command = new RecordSnapshotCommand(
                    periodId, ageGroup, date, time, null, actorId, automatic, null);
            outcomes.put(ageGroup, attempt(command));
        }
        SnapshotBatchResult result = new SnapshotBatchResult(outcomes);
        log.info("Recorded age-group snapshots period={} at {}T{} recorded={} duplicate={} failed={}",
                periodId, date, time, result.recordedCount(), result.duplicateCount(), result.failedCount());
        return result;
    }

    /**
     * One snapshot per scheduled (room, age group) pair. Rooms holding several age groups are
     * keyed {@code room/AGE_GROUP}.
     */
    public SnapshotBatchResult recordByRoom(UUID periodId, LocalDate date, LocalTime time, UUID actorId, boolean automatic) {
        List<ScheduledRoom> rooms = presenceCounter.scheduledRoomAssignments(periodId, date, time);
        Map<String, Long> groupsPerRoom = rooms.stream()
                .collect(Collectors.groupingBy(ScheduledRoom::roomName, Collectors.counting()));

        Map<String, SnapshotOutcome> outcomes = new LinkedHashMap<>();
        for (ScheduledRoom room : rooms) {
            String key = groupsPerRoom.get(room.roomName()) > 1
                    ? room.roomName() + "/" + room.ageGroup()
                    : room.roomName();
            RecordSnapshotCommand command = new RecordSnapshotCommand(
                    periodId, room.ageGroup(), date, time, room.roomName(), actorId, automatic, null);
            outcomes.put(key, attempt(command));
        }
        SnapshotBatchResult result = new SnapshotBatchResult(outcomes);
        log.info("Recorded room snapshots period={} at {}T{} recorded={} duplicate={} failed={}",
                periodId, date, time, result.recordedCount(), result.duplicateCount(), result.failedCount());
        return result;
    }

    private SnapshotOutcome attempt(RecordSnapshotCommand command) {
        try {
            return SnapshotOutcome.recorded(record(command));
        } catch (DuplicateSnapshotException ex) {
            log.debug("Skipped duplicate snapshot {}", ex.getKey());
            return SnapshotOutcome.duplicate(ex.getCode(), ex.getDetailMessage());
        } catch (ProblemException ex) {
            log.warn("Snapshot for {} room={} failed: {}", command.ageGroup(), command.roomName(), ex.getMessage());
            return SnapshotOutcome.failed(ex.getCode(), ex.getDetailMessage());
        } catch (RuntimeException ex) {
            log.warn("Snapshot for {} room={} failed unexpectedly", command.ageGroup(), command.roomName(), ex);
            return SnapshotOutcome.failed(INTERNAL_ERROR, ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public Page<RatioSnapshot> search(RatioSnapshotSearchCondition condition, Pageable pageable) {
        if (condition.schoolPeriodId() == null) {
            throw new InvalidRatioParametersException("periodId is required");
        }
        if (condition.dateFrom() != null && condition.dateTo() != null
                && condition.dateFrom().isAfter(condition.dateTo())) {
            throw new InvalidRatioParametersException("dateFrom must not be after dateTo");
        }
        return ratioSnapshotRepository.searchSnapshots(condition, pageable);
    }

    @Transactional(readOnly = true)
    public RatioSnapshot getSnapshot(UUID snapshotId) {
        return ratioSnapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    @Transactional(readOnly = true)
    public List<RatioSnapshot> findByDate(UUID periodId, LocalDate date) {
        return ratioSnapshotRepository.findByPeriodAndDate(periodId, date);
    }

    /**
     * Breaches between {@code from} and {@code to}, newest first. Open bounds default to the
     * retention horizon and today.
     */
    @Transactional(readOnly = true)
    public List<RatioSnapshot> findNonCompliant(UUID periodId, LocalDate from, LocalDate to) {
        LocalDate upper = to != null ? to : LocalDate.now(clock);
        LocalDate lower = from != null ? from : upper.minusDays(ratioProperties.getRetention().getDefaultDays());
        if (lower.isAfter(upper)) {
            throw new InvalidRatioParametersException("from must not be after to");
        }
        return ratioSnapshotRepository.findNonCompliant(periodId, lower, upper);
    }

    @Transactional(readOnly = true)
    public List<RatioSnapshot> latestByAgeGroup(UUID periodId, LocalDate date) {
        return ratioSnapshotRepository.findLatestByAgeGroup(periodId, date);
    }

    /**
     * Latest room-less snapshots of the most recent day on or before {@code date} that has any.
     */
    @Transactional(readOnly = true)
    public List<RatioSnapshot> latestByAgeGroupOnOrBefore(UUID periodId, LocalDate date) {
        return ratioSnapshotRepository.findLatestSnapshotDate(periodId, date)
                .map(day -> ratioSnapshotRepository.findLatestByAgeGroup(periodId, day))
                .orElse(List.of());
    }

    @Transactional(readOnly = true)
    public List<String> distinctRooms(UUID periodId) {
        return ratioSnapshotRepository.findDistinctRoomNames(periodId);
    }

    /**
     * Read-side convenience only; recording relies on the unique constraint, not on this.
     */
    @Transactional(readOnly = true)
    public boolean snapshotExists(SnapshotKey key) {
        String ageGroup = AgeGroupRule.normalizeCode(key.ageGroup());
        if (key.roomName() == null) {
            return ratioSnapshotRepository.existsBySchoolPeriodIdAndAgeGroupAndRoomNameIsNullAndSnapshotDateAndSnapshotTime(
                    key.schoolPeriodId(), ageGroup, key.snapshotDate(), key.snapshotTime());
        }
        return ratioSnapshotRepository.existsBySchoolPeriodIdAndAgeGroupAndRoomNameAndSnapshotDateAndSnapshotTime(
                key.schoolPeriodId(), ageGroup, key.roomName(), key.snapshotDate(), key.snapshotTime());
    }

    /**
     * Idempotent: a second or concurrent call leaves the original sent time untouched.
     */
    @Transactional
    public RatioSnapshot markAlertSent(UUID snapshotId) {
        int updated = ratioSnapshotRepository.markAlertSentIfPending(snapshotId, OffsetDateTime.now(clock));
        RatioSnapshot snapshot = ratioSnapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
        if (updated > 0) {
            log.info("Alert marked sent for snapshot {}", snapshotId);
        }
        return snapshot;
    }

    @Transactional
    public int deleteOlderThan(int days) {
        if (days < 1) {
            throw new InvalidRatioParametersException("days must be at least 1");
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(days);
        int deleted = ratioSnapshotRepository.deleteBySnapshotDateBefore(cutoff);
        log.info("Deleted {} ratio snapshots dated before {}", deleted, cutoff);
        return deleted;
    }
}
