package com.example.cleanersched.conflict;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.roster.WorkerRepository;
import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.schedule.ScheduleWeek;
import com.example.cleanersched.site.SiteRepository;
import com.example.cleanersched.vacation.Vacation;
import com.example.cleanersched.vacation.VacationLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 永続化された週間グリッドから検出エンジン用のスナップショットを組み立て、
 * 競合の照会と変更の事前検証を提供する。
 * <p>
 * 結果はキャッシュせず、リクエストごとに再計算する。
 */
@Service
@Transactional(readOnly = true)
public class ScheduleConflictService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleConflictService.class);

    private final AssignmentRepository assignmentRepository;
    private final WorkerRepository workerRepository;
    private final SiteRepository siteRepository;
    private final ConflictDetectionEngine detectionEngine;
    private final ScheduleChangeValidator validator;
    private final VacationLookup vacationLookup;
    private final ErrorLogBuffer errorLogBuffer;

    public ScheduleConflictService(AssignmentRepository assignmentRepository,
                                   WorkerRepository workerRepository,
                                   SiteRepository siteRepository,
                                   ConflictDetectionEngine detectionEngine,
                                   ScheduleChangeValidator validator,
                                   VacationLookup vacationLookup,
                                   ErrorLogBuffer errorLogBuffer) {
        this.assignmentRepository = assignmentRepository;
        this.workerRepository = workerRepository;
        this.siteRepository = siteRepository;
        this.detectionEngine = detectionEngine;
        this.validator = validator;
        this.vacationLookup = vacationLookup;
        this.errorLogBuffer = errorLogBuffer;
    }

    public ScheduleSnapshot snapshotFor(LocalDate week) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        return ScheduleSnapshot.of(
                assignmentRepository.findByWeekStartOrderByIdAsc(monday),
                workerRepository.findAllByOrderByIdAsc(),
                siteRepository.findAllByOrderByIdAsc());
    }

    public ConflictReport report(LocalDate week) {
        return detectionEngine.report(snapshotFor(week));
    }

    /**
     * 条件をすべて満たす競合。未指定の条件は絞り込まない。
     */
    public List<Conflict> findConflicts(LocalDate week, Severity severity, String workerName, Long assignmentId) {
        ConflictReport report = report(week);
        List<Conflict> result = report.conflicts();
        if (severity != null) {
            result = intersect(result, report.bySeverity(severity));
        }
        if (workerName != null && !workerName.isBlank()) {
            result = intersect(result, report.forWorker(workerName.trim()));
        }
        if (assignmentId != null) {
            result = intersect(result, report.forAssignment(assignmentId));
        }
        return result;
    }

    /**
     * 1件の作成・変更を検証し、休暇と重なる担当者があれば警告を加える（警告は変更を止めない）。
     */
    public ValidationResult validate(LocalDate week, ProposedChange change, Long existingId) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        ScheduleSnapshot snapshot = snapshotFor(monday);
        ValidationResult result = validator.validate(snapshot, change, existingId);
        Assignment target = null;
        if (existingId == null) {
            if (change != null && change.isComplete()) {
                target = change.toNewAssignment(null);
            }
        } else {
            Optional<Assignment> original = snapshot.findAssignment(existingId);
            if (original.isPresent() && change != null) {
                target = original.get().copy();
                change.mergeInto(target);
            }
        }
        return target == null ? result : result.withWarnings(vacationWarnings(monday, List.of(target)));
    }

    /**
     * 複数の項目変更をまとめて反映した仮スナップショット上で、変更対象の割り当てをそれぞれ検証する。
     *
     * @throws IllegalArgumentException 指定週に存在しない割り当てIDを含む場合
     */
    public ValidationResult validateChanges(LocalDate week, List<FieldChange> changes) {
        LocalDate monday = ScheduleWeek.mondayOf(week);
        ScheduleSnapshot hypothetical = snapshotFor(monday).withChanges(changes);
        Set<Long> ids = new LinkedHashSet<>();
        changes.forEach(c -> ids.add(c.assignmentId()));
        List<ValidationResult> results = new ArrayList<>();
        List<Assignment> changed = new ArrayList<>();
        for (Long id : ids) {
            Assignment candidate = hypothetical.findAssignment(id).orElseThrow();
            changed.add(candidate);
            results.add(validator.validateCandidate(hypothetical, candidate, true));
        }
        return ValidationResult.combine(results).withWarnings(vacationWarnings(monday, changed));
    }

    List<String> vacationWarnings(LocalDate monday, List<Assignment> assignments) {
        List<String> warnings = new ArrayList<>();
        for (Assignment assignment : assignments) {
            if (assignment.getDay() == null || assignment.isCancelled()) {
                continue;
            }
            LocalDate date = ScheduleWeek.dateOf(monday, assignment.getDay());
            for (String workerName : assignment.assignedWorkers()) {
                try {
                    Optional<Vacation> vacation = vacationLookup.find(workerName, date);
                    vacation.ifPresent(v -> warnings.add(workerName + " は " + date + " に休暇予定です"
                            + (v.getReason() == null || v.getReason().isBlank() ? "" : "（" + v.getReason() + "）")));
                } catch (RuntimeException e) {
                    logger.warn("休暇情報の取得に失敗しました: {} {}", workerName, date, e);
                    errorLogBuffer.addError("VacationLookup", "休暇情報の取得に失敗しました: " + workerName, e);
                }
            }
        }
        return warnings;
    }

    private static List<Conflict> intersect(List<Conflict> base, List<Conflict> filter) {
        return base.stream().filter(filter::contains).toList();
    }
}
