package com.example.cleanersched.admin;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.roster.WorkerRepository;
import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.schedule.ScheduleWeek;
import com.example.cleanersched.site.SiteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);
    private final WorkerRepository workerRepository;
    private final SiteRepository siteRepository;
    private final AssignmentRepository assignmentRepository;
    private final ErrorLogBuffer errorLogBuffer;

    public AdminController(WorkerRepository workerRepository,
                           SiteRepository siteRepository,
                           AssignmentRepository assignmentRepository,
                           ErrorLogBuffer errorLogBuffer) {
        this.workerRepository = workerRepository;
        this.siteRepository = siteRepository;
        this.assignmentRepository = assignmentRepository;
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<SystemStatusResponse>> getSystemStatus(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        long workers = workerRepository.count();
        long activeWorkers = workerRepository.findByActiveTrueOrderByIdAsc().size();
        long sites = siteRepository.count();
        long assignments = assignmentRepository.countActiveByWeekStart(monday);
        logger.debug("status: week={} workers={} sites={} assignments={}", monday, workers, sites, assignments);
        return ResponseEntity.ok(ApiResponse.success("system status", new SystemStatusResponse(
                monday, workers, activeWorkers, sites, assignments, errorLogBuffer.recent().size())));
    }

    @GetMapping("/error-logs")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getErrorLogs(@RequestParam(name = "limit", required = false) Integer limit) {
        List<ErrorLogBuffer.Entry> list = errorLogBuffer.recent();
        if (limit != null && limit > 0 && list.size() > limit) list = list.subList(0, limit);
        Map<String, Object> resp = new HashMap<>();
        resp.put("count", list.size());
        resp.put("items", list);
        return ResponseEntity.ok(ApiResponse.success("recent error logs", resp));
    }

    @DeleteMapping("/error-logs")
    public ResponseEntity<ApiResponse<Void>> clearErrorLogs() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("error logs cleared", null));
    }

    public record SystemStatusResponse(
            LocalDate week,
            long workerCount,
            long activeWorkerCount,
            long siteCount,
            long activeAssignmentCount,
            int recentErrorCount
    ) {}
}
