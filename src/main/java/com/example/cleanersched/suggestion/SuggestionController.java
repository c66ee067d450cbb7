package com.example.cleanersched.suggestion;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.schedule.AssignmentService;
import com.example.cleanersched.schedule.ScheduleWeek;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/suggestions")
public class SuggestionController {

    private final SuggestionService suggestionService;

    public SuggestionController(SuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Suggestion>>> list(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        List<Suggestion> suggestions = suggestionService.suggestionsFor(monday);
        return ResponseEntity.ok(ApiResponse.success("改善提案を取得しました", suggestions,
                Map.of("week", monday, "count", suggestions.size())));
    }

    @PostMapping("/{id}/dismiss")
    public ResponseEntity<ApiResponse<Map<String, Object>>> dismiss(
            @PathVariable("id") String id,
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        boolean created = suggestionService.dismiss(week, id);
        return ResponseEntity.ok(ApiResponse.success(created ? "提案を却下しました" : "既に却下済みです",
                Map.of("id", id, "dismissed", true)));
    }

    @PostMapping("/apply")
    public ResponseEntity<ApiResponse<AssignmentService.ApplyResult>> apply(
            @RequestParam(name = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week,
            @RequestBody List<FieldChange> changes) {
        return ResponseEntity.ok(ApiResponse.success("提案を適用しました", suggestionService.apply(week, changes)));
    }
}
