package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ScheduleConflictService;
import com.example.cleanersched.schedule.AssignmentService;
import com.example.cleanersched.schedule.ScheduleWeek;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class SuggestionService {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);

    private final SuggestionEngine suggestionEngine;
    private final SuggestionDismissalRepository dismissalRepository;
    private final ScheduleConflictService conflictService;
    private final AssignmentService assignmentService;

    public SuggestionService(SuggestionEngine suggestionEngine,
                             SuggestionDismissalRepository dismissalRepository,
                             ScheduleConflictService conflictService,
                             AssignmentService assignmentService) {
        this.suggestionEngine = suggestionEngine;
        this.dismissalRepository = dismissalRepository;
        this.conflictService = conflictService;
        this.assignmentService = assignmentService;
    }

    @Transactional(readOnly = true)
    public List<Suggestion> suggestionsFor(LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        return suggestionEngine.generate(conflictService.snapshotFor(monday), dismissedIds(monday));
    }

    @Transactional(readOnly = true)
    public Set<String> dismissedIds(LocalDate week) {
        return dismissalRepository.findByWeekStart(ScheduleWeek.mondayOf(week)).stream()
                .map(SuggestionDismissal::getSuggestionId)
                .collect(Collectors.toSet());
    }

    /**
     * @return 新たに却下した場合 true、既に却下済みなら false
     */
    @Transactional
    public boolean dismiss(LocalDate week, String suggestionId) {
        if (suggestionId == null || suggestionId.isBlank()) {
            throw new IllegalArgumentException("提案IDが指定されていません");
        }
        LocalDate monday = ScheduleWeek.mondayOf(week);
        if (dismissalRepository.existsByWeekStartAndSuggestionId(monday, suggestionId)) {
            return false;
        }
        dismissalRepository.save(new SuggestionDismissal(monday, suggestionId));
        logger.info("提案を却下しました: week={} id={}", monday, suggestionId);
        return true;
    }

    @Transactional
    public AssignmentService.ApplyResult apply(LocalDate week, List<FieldChange> changes) {
        return assignmentService.applyChanges(week, changes);
    }
}
