package com.example.cleanersched.schedule;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.conflict.ProposedChange;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/assignments")
public class AssignmentController {

    private final AssignmentService assignmentService;

    public AssignmentController(AssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Assignment>>> list(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        List<Assignment> assignments = assignmentService.list(monday);
        return ResponseEntity.ok(ApiResponse.success("割り当て一覧を取得しました", assignments,
                Map.of("week", monday, "count", assignments.size())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AssignmentService.AssignmentResult>> create(@Valid @RequestBody AssignmentRequest request) {
        AssignmentService.AssignmentResult result = assignmentService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("割り当てを登録しました", result));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<AssignmentService.AssignmentResult>> update(@PathVariable Long id,
                                                                                   @RequestBody ProposedChange change) {
        return ResponseEntity.ok(ApiResponse.success("割り当てを変更しました", assignmentService.update(id, change)));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<AssignmentService.AssignmentResult>> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("割り当てをキャンセルしました", assignmentService.cancel(id)));
    }
}
