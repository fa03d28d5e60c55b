package com.ratiowatch.backend.modules.ratio.presentation;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.application.RatioAlertService;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioDtoMapper;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioSnapshotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ratio")
public class RatioAlertController {

    private final RatioAlertService ratioAlertService;
    private final Clock clock;

    public RatioAlertController(RatioAlertService ratioAlertService, Clock clock) {
        this.ratioAlertService = ratioAlertService;
        this.clock = clock;
    }

    @Operation(summary = "Breaches awaiting notification", description = "Non-compliant snapshots of the day whose alert has not been acknowledged, newest first.")
    @GetMapping("/alerts/pending")
    public ResponseEntity<List<RatioSnapshotResponse>> pending(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        return ResponseEntity.ok(RatioDtoMapper.toSnapshotResponses(ratioAlertService.snapshotsNeedingAlert(periodId, day)));
    }

    @Operation(summary = "Snapshots near the limit", description = "Compliant snapshots at or above the warning threshold percent.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Listed"),
            @ApiResponse(responseCode = "400", description = "threshold outside (0, 100]")
    })
    @GetMapping("/alerts/warnings")
    public ResponseEntity<List<RatioSnapshotResponse>> warnings(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "threshold", required = false) BigDecimal threshold
    ) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        return ResponseEntity.ok(RatioDtoMapper.toSnapshotResponses(
                ratioAlertService.snapshotsAtWarningLevel(periodId, day, threshold)));
    }

    @Operation(summary = "Acknowledge alert delivery", description = "Idempotent. The first acknowledgement time is kept.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Marked"),
            @ApiResponse(responseCode = "404", description = "No such snapshot")
    })
    @PatchMapping("/snapshots/{snapshotId}/alert-sent")
    public ResponseEntity<Void> markAlertSent(@PathVariable("snapshotId") UUID snapshotId) {
        ratioAlertService.markAlertSent(snapshotId);
        return ResponseEntity.noContent().build();
    }
}
