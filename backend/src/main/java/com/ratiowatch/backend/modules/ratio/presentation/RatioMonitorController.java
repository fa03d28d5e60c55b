package com.ratiowatch.backend.modules.ratio.presentation;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.ratiowatch.backend.modules.ratio.application.ComplianceReportService;
import com.ratiowatch.backend.modules.ratio.application.RatioMonitorService;
import com.ratiowatch.backend.modules.ratio.presentation.dto.MonitorResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioDtoMapper;
import com.ratiowatch.backend.modules.ratio.presentation.dto.RatioEvaluationResponse;
import com.ratiowatch.backend.modules.ratio.presentation.dto.StaffingGapResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ratio")
public class RatioMonitorController {

    private final RatioMonitorService ratioMonitorService;
    private final ComplianceReportService complianceReportService;
    private final Clock clock;

    public RatioMonitorController(
            RatioMonitorService ratioMonitorService,
            ComplianceReportService complianceReportService,
            Clock clock
    ) {
        this.ratioMonitorService = ratioMonitorService;
        this.complianceReportService = complianceReportService;
        this.clock = clock;
    }

    @Operation(summary = "Current ratios per age group", description = "Evaluates every configured age group from live presence data. Nothing is recorded.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Evaluated"),
            @ApiResponse(responseCode = "503", description = "Presence data unavailable")
    })
    @GetMapping("/current")
    public ResponseEntity<List<RatioEvaluationResponse>> currentRatios(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "time", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime time
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toEvaluationResponses(
                ratioMonitorService.currentRatios(periodId, dateOrToday(date), timeOrNow(time))));
    }

    @Operation(summary = "Current ratios per scheduled room", description = "Child counts per room are approximated by the age group count.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Evaluated"),
            @ApiResponse(responseCode = "503", description = "Presence data unavailable")
    })
    @GetMapping("/current/rooms")
    public ResponseEntity<List<RatioEvaluationResponse>> currentRatiosByRoom(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "time", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime time
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toEvaluationResponses(
                ratioMonitorService.currentRatiosByRoom(periodId, dateOrToday(date), timeOrNow(time))));
    }

    @Operation(summary = "Ratio monitor board", description = "Live ratios with warning and breach flags plus the day's summary. Falls back to the latest snapshots, flagged stale, when presence data is unavailable.")
    @GetMapping("/monitor")
    public ResponseEntity<MonitorResponse> monitor(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "time", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime time
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toMonitorResponse(
                ratioMonitorService.monitor(periodId, dateOrToday(date), timeOrNow(time))));
    }

    @Operation(summary = "Staff needed for compliance", description = "Additional staff each age group needs right now, and the total.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Evaluated"),
            @ApiResponse(responseCode = "503", description = "Presence data unavailable")
    })
    @GetMapping("/staffing-gap")
    public ResponseEntity<StaffingGapResponse> staffingGap(
            @RequestParam("periodId") UUID periodId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "time", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime time
    ) {
        return ResponseEntity.ok(RatioDtoMapper.toStaffingGapResponse(
                complianceReportService.staffingGap(periodId, dateOrToday(date), timeOrNow(time))));
    }

    private LocalDate dateOrToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }

    private LocalTime timeOrNow(LocalTime time) {
        return time != null ? time : LocalTime.now(clock);
    }
}
