package com.example.cleanersched.schedule;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ProposedChange;
import com.example.cleanersched.conflict.ScheduleConflictService;
import com.example.cleanersched.conflict.ValidationResult;
import com.example.cleanersched.exception.BusinessException;
import com.example.cleanersched.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 週間グリッドの割り当てを更新する。作成・変更はすべて確定前に事前検証を通す。
 */
@Service
@Transactional
public class AssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentService.class);

    private final AssignmentRepository assignmentRepository;
    private final ScheduleConflictService conflictService;

    public AssignmentService(AssignmentRepository assignmentRepository, ScheduleConflictService conflictService) {
        this.assignmentRepository = assignmentRepository;
        this.conflictService = conflictService;
    }

    @Transactional(readOnly = true)
    public List<Assignment> list(LocalDate week) {
        return assignmentRepository.findByWeekStartOrderByIdAsc(ScheduleWeek.mondayOf(week));
    }

    public AssignmentResult create(AssignmentRequest request) {
        LocalDate monday = ScheduleWeek.mondayOf(request.weekStart());
        ProposedChange change = request.toProposedChange();
        ValidationResult result = conflictService.validate(monday, change, null);
        requireProceed(result, "重大な競合があるため割り当てを登録できません");

        Assignment assignment = change.toNewAssignment(null);
        assignment.setWeekStart(monday);
        Assignment saved = assignmentRepository.save(assignment);
        logger.info("割り当てを登録しました: id={} {} {} {}", saved.getId(), monday, saved.getDay(), saved.getSiteName());
        return new AssignmentResult(saved, result.warnings());
    }

    public AssignmentResult update(Long id, ProposedChange change) {
        Assignment existing = findEditable(id);
        ValidationResult result = conflictService.validate(existing.getWeekStart(), change, id);
        requireProceed(result, "重大な競合があるため割り当てを変更できません");

        change.mergeInto(existing);
        Assignment saved = assignmentRepository.save(existing);
        logger.info("割り当てを変更しました: id={}", saved.getId());
        return new AssignmentResult(saved, result.warnings());
    }

    public AssignmentResult cancel(Long id) {
        Assignment existing = assignmentRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("割り当てが見つかりません: " + id));
        if (existing.isCancelled()) {
            return new AssignmentResult(existing, List.of());
        }
        ProposedChange change = new ProposedChange(null, null, null, null, null, null,
                AssignmentStatus.CANCELLED, null, null);
        return update(id, change);
    }

    /**
     * 解決策・提案の項目変更をまとめて適用する。1件でも重大な競合があれば何も変更しない。
     */
    public ApplyResult applyChanges(LocalDate week, List<FieldChange> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("変更内容が指定されていません");
        }
        LocalDate monday = ScheduleWeek.mondayOf(week);
        Map<Long, Assignment> targets = new LinkedHashMap<>();
        for (FieldChange change : changes) {
            targets.computeIfAbsent(change.assignmentId(), this::findEditable);
        }
        ValidationResult result = conflictService.validateChanges(monday, changes);
        requireProceed(result, "重大な競合があるため変更を適用できません");

        for (FieldChange change : changes) {
            change.applyTo(targets.get(change.assignmentId()));
        }
        List<Assignment> saved = new ArrayList<>(assignmentRepository.saveAll(targets.values()));
        logger.info("{} 件の変更を {} 件の割り当てに適用しました", changes.size(), saved.size());
        return new ApplyResult(saved, result.warnings());
    }

    private Assignment findEditable(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("割り当てIDが指定されていません");
        }
        Assignment assignment = assignmentRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("割り当てが見つかりません: " + id));
        if (assignment.getStatus() == AssignmentStatus.COMPLETED) {
            throw new BusinessException("ASSIGNMENT_COMPLETED", "完了済みの割り当ては変更できません", id);
        }
        return assignment;
    }

    private static void requireProceed(ValidationResult result, String message) {
        if (!result.canProceed()) {
            throw new ConstraintViolationException(message, result);
        }
    }

    public record AssignmentResult(Assignment assignment, List<String> warnings) {}

    public record ApplyResult(List<Assignment> assignments, List<String> warnings) {}
}
