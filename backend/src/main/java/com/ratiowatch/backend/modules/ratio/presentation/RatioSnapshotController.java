package com.ratiowatch.backend.modules.ratio.presentation;

import java.time.LocalDate;
import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;
import com.ratiowatch.backend.modules.ratio.application.RatioSnapshotService;
import com.ratiowatch.backend.modules.ratio.application.RecordSnapshotCommand;
import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotSearchCondition;
import com.ratiowatch.backend.modules.ratio.presentation.dto.BatchSnapshotRequest;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioDtoMapper;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioSnapshotListResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioSnapshotResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RecordSnapshotRequest;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RecordSnapshotResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RetentionResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RoomListResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.SnapshotBatchResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ratio/snapshots")
public class RatioSnapshotController {

    static final String ACTOR_HEADER = "X-Actor-Id";
    private static final int MAX_PAGE_SIZE = 100;

    private final RatioSnapshotService ratioSnapshotService;
    private final RatioProperties ratioProperties;

    public RatioSnapshotController(RatioSnapshotService ratioSnapshotService, RatioProperties ratioProperties) {
        this.ratioSnapshotService = ratioSnapshotService;
        this.ratioProperties = ratioProperties;
    }

    @Operation(summary = "Record a snapshot", description = "Counts presence now for one age group (optionally one room) and stores the result.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Recorded"),
            @ApiResponse(responseCode = "409", description = "A snapshot with the same key already exists"),
            @ApiResponse(responseCode = "422", description = "Unknown age group or invalid body"),
            @ApiResponse(responseCode = "503", description = "Presence data unavailable")
    })
    @PostMapping
    public ResponseEntity<RecordSnapshotResponse> record(
            @RequestParam("periodId") UUID periodId,
            @RequestHeader(name = ACTOR_HEADER, required = false) UUID actorId,
            @Valid @RequestBody RecordSnapshotRequest request
    ) {
        UUID snapshotId = ratioSnapshotService.record(new RecordSnapshotCommand(
                periodId,
                request.ageGroup(),
                request.date(),
                request.time(),
                request.roomName(),
                actorId,
                false,
                request.notes()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(new RecordSnapshotResponse(snapshotId));
    }

    @Operation(summary = "Record all age groups", description = "One snapshot per configured age group. Each entry succeeds or fails on its own.")
    @PostMapping("/batch")
    public ResponseEntity<SnapshotBatchResponse> recordAll(
            @RequestParam("periodId") UUID periodId,
            @RequestHeader(name = ACTOR_HEADER, required = false) UUID actorId,
            @Valid @RequestBody BatchSnapshotRequest request
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toBatchResponse(
                ratioSnapshotService.recordAll(periodId, request.date(), request.time(), actorId, false)));
    }

    @Operation(summary = "Record all scheduled rooms", description = "One snapshot per scheduled room and age group. Each entry succeeds or fails on its own.")
    @PostMapping("/batch/rooms")
    public ResponseEntity<SnapshotBatchResponse> recordByRoom(
            @RequestParam("periodId") UUID periodId,
            @RequestHeader(name = ACTOR_HEADER, required = false) UUID actorId,
            @Valid @RequestBody BatchSnapshotRequest request
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toBatchResponse(
                ratioSnapshotService.recordByRoom(periodId, request.date(), request.time(), actorId, false)));
    }

    @Operation(summary = "Search snapshots", description = "Newest first. Page size is capped at 100.")
    @GetMapping
    public ResponseEntity<RatioSnapshotListResponse> search(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "dateFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "dateTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "ageGroup", required = false) String ageGroup,
            @RequestParam(name = "roomName", required = false) String roomName,
            @RequestParam(name = "compliant", required = false) Boolean compliant,
            @RequestParam(name = "automatic", required = false) Boolean automatic,
            @RequestParam(name = "alertSent", required = false) Boolean alertSent,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        RatioSnapshotSearchCondition condition = new RatioSnapshotSearchCondition(
                periodId,
                date,
                dateFrom,
                dateTo,
                AgeGroupRule.normalizeCode(ageGroup),
                roomName,
                compliant,
                automatic,
                alertSent
        );
        return ResponseEntity.ok(RatioDtoMapper.toSnapshotListResponse(
                ratioSnapshotService.search(condition, PageRequest.of(safePage, safeSize))));
    }

    @Operation(summary = "Rooms with recorded snapshots")
    @GetMapping("/rooms")
    public ResponseEntity<RoomListResponse> rooms(@RequestParam("periodId") UUID periodId) {
        return ResponseEntity.ok(new RoomListResponse(ratioSnapshotService.distinctRooms(periodId)));
    }

    @Operation(summary = "Get a snapshot")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No such snapshot")
    })
    @GetMapping("/{snapshotId}")
    public ResponseEntity<RatioSnapshotResponse> getSnapshot(@PathVariable("snapshotId") UUID snapshotId) {
        return ResponseEntity.ok(RatioDtoMapper.toSnapshotResponse(ratioSnapshotService.getSnapshot(snapshotId)));
    }

    @Operation(summary = "Delete old snapshots", description = "Deletes snapshots dated more than `days` days ago. Defaults to the configured retention horizon.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deleted"),
            @ApiResponse(responseCode = "400", description = "days below 1")
    })
    @DeleteMapping("/retention")
    public ResponseEntity<RetentionResponse> deleteOlderThan(
            @RequestParam(name = "days", required = false) Integer days
    ) {
        int horizon = days != null ? days : ratioProperties.getRetention().getDefaultDays();
        int deleted = ratioSnapshotService.deleteOlderThan(horizon);
        return ResponseEntity.ok(new RetentionResponse(horizon, deleted));
    }
}
