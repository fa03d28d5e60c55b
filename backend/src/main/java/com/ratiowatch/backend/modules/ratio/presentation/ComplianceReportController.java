package com.ratiowatch.backend.modules.ratio.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.application.ComplianceReportService;
import com.ratiowatch.backend.modules.ratio.presentation.dto.AgeGroupSummaryResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.DailySummaryResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.PeakHourResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioDtoMapper;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioSnapshotResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.TrendPointResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ratio/reports")
public class ComplianceReportController {

    private final ComplianceReportService complianceReportService;

    public ComplianceReportController(ComplianceReportService complianceReportService) {
        this.complianceReportService = complianceReportService;
    }

    @Operation(summary = "Daily compliance summary", description = "A day without snapshots reports a 100% compliance rate.")
    @GetMapping("/daily")
    public ResponseEntity<DailySummaryResponse> daily(
            @RequestParam("periodId") UUID periodId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toDailySummaryResponse(complianceReportService.dailySummary(periodId, date)));
    }

    @Operation(summary = "Compliance by age group")
    @GetMapping("/age-groups")
    public ResponseEntity<List<AgeGroupSummaryResponse>> byAgeGroup(
            @RequestParam("periodId") UUID periodId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toAgeGroupSummaryResponses(
                complianceReportService.summaryByAgeGroup(periodId, from, to)));
    }

    @Operation(summary = "Daily compliance trend", description = "One row per date that has snapshots.")
    @GetMapping("/trend")
    public ResponseEntity<List<TrendPointResponse>> trend(
            @RequestParam("periodId") UUID periodId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toTrendResponses(complianceReportService.trend(periodId, from, to)));
    }

    @Operation(summary = "Hours with the most breaches")
    @GetMapping("/peak-hours")
    public ResponseEntity<List<PeakHourResponse>> peakHours(
            @RequestParam("periodId") UUID periodId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toPeakHourResponses(
                complianceReportService.peakNonComplianceHours(periodId, from, to)));
    }

    @Operation(summary = "Snapshot history of a room", description = "Newest first.")
    @GetMapping("/rooms/{roomName}")
    public ResponseEntity<List<RatioSnapshotResponse>> roomHistory(
            @PathVariable("roomName") String roomName,
            @RequestParam("periodId") UUID periodId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toSnapshotResponses(
                complianceReportService.roomHistory(periodId, roomName, from, to)));
    }
}
