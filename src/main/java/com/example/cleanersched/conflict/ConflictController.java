package com.example.cleanersched.conflict;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.schedule.ScheduleWeek;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conflicts")
public class ConflictController {

    private final ScheduleConflictService conflictService;

    public ConflictController(ScheduleConflictService conflictService) {
        this.conflictService = conflictService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Conflict>>> listConflicts(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week,
            @RequestParam(name = "severity", required = false) Severity severity,
            @RequestParam(name = "worker", required = false) String worker,
            @RequestParam(name = "assignmentId", required = false) Long assignmentId) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        List<Conflict> conflicts = conflictService.findConflicts(monday, severity, worker, assignmentId);
        Map<String, Object> meta = new HashMap<>();
        meta.put("week", monday);
        meta.put("count", conflicts.size());
        return ResponseEntity.ok(ApiResponse.success("競合一覧を取得しました", conflicts, meta));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<ConflictSummary>> summary(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        ConflictReport report = conflictService.report(monday);
        return ResponseEntity.ok(ApiResponse.success("競合の集計を取得しました", report.summary(),
                Map.of("week", monday, "hasCritical", report.hasCritical(), "hasBlocking", report.hasBlocking())));
    }

    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<ValidationResult>> validate(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week,
            @RequestParam(name = "assignmentId", required = false) Long assignmentId,
            @RequestBody ProposedChange change) {
        ValidationResult result = conflictService.validate(week, change, assignmentId);
        String message = result.canProceed() ? "変更を適用できます" : "重大な競合があるため変更を適用できません";
        return ResponseEntity.ok(ApiResponse.success(message, result));
    }
}
