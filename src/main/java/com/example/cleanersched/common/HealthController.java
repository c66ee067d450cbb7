package com.example.cleanersched.common;

import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.schedule.ScheduleWeek;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

@RestController
public class HealthController {

    private final AssignmentRepository assignmentRepository;

    public HealthController(AssignmentRepository assignmentRepository) {
        this.assignmentRepository = assignmentRepository;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        LocalDate week = ScheduleWeek.mondayOf(null);
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "currentWeek", week,
                "activeAssignments", assignmentRepository.countActiveByWeekStart(week))));
    }
}
