package com.example.cleanersched.conflict;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 割り当ての作成・変更を確定前に検証する。
 * <p>
 * 仮のスナップショットを組み立ててダブルブッキング・時間重複・セキュリティの3検出器を再実行し、
 * 対象の割り当てに関わる競合だけを返す。CRITICAL / HIGH があれば {@code canProceed = false}。
 * 変更内容に曜日・顧客・現場がそろっていない場合（メモのみの変更など）は検証しない。
 * 検証自体が失敗した場合は変更を止めない（フェイルオープン）。
 */
@Service
public class ScheduleChangeValidator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleChangeValidator.class);

    /** 新規作成時の仮ID */
    public static final long PLACEHOLDER_ID = -1L;

    static final String INCOMPLETE_WARNING = "検証を完了できませんでした";

    private final ConflictDetectionEngine engine;
    private final ErrorLogBuffer errorLogBuffer;

    @Autowired
    public ScheduleChangeValidator(ConflictDetectionEngine engine, ErrorLogBuffer errorLogBuffer) {
        this.engine = engine;
        this.errorLogBuffer = errorLogBuffer;
    }

    public ScheduleChangeValidator(ConflictDetectionEngine engine) {
        this(engine, null);
    }

    /**
     * @param existingId 既存割り当ての変更なら元のID、新規作成なら null
     */
    public ValidationResult validate(ScheduleSnapshot snapshot, ProposedChange change, Long existingId) {
        try {
            if (snapshot == null || change == null) {
                return ValidationResult.permissive();
            }
            if (!change.isComplete()) {
                logger.debug("曜日・顧客・現場が未指定のため検証を省略します");
                return ValidationResult.permissive();
            }
            if (existingId == null) {
                Assignment candidate = change.toNewAssignment(PLACEHOLDER_ID);
                candidate.setWeekStart(snapshot.assignments().isEmpty() ? null
                        : snapshot.assignments().get(0).getWeekStart());
                List<Assignment> hypothetical = new ArrayList<>(snapshot.assignments());
                hypothetical.add(candidate);
                return validateCandidate(snapshot.withAssignments(hypothetical), candidate, false);
            }

            var original = snapshot.findAssignment(existingId);
            if (original.isEmpty()) {
                logger.debug("変更元の割り当て {} がスナップショットに無いため検証を省略します", existingId);
                return ValidationResult.permissive();
            }
            Assignment candidate = original.get().copy();
            change.mergeInto(candidate);
            List<Assignment> hypothetical = new ArrayList<>(snapshot.assignments().size());
            for (Assignment assignment : snapshot.assignments()) {
                hypothetical.add(assignment.isSameAs(original.get()) ? candidate : assignment);
            }
            return validateCandidate(snapshot.withAssignments(hypothetical), candidate, true);
        } catch (RuntimeException e) {
            return failOpen(e);
        }
    }

    /**
     * 組み立て済みの仮スナップショット上で、1件の割り当てに関わる競合を判定する。
     *
     * @param edit 既存割り当ての変更か。変更の場合、関係型の競合は他の割り当てを含むものだけ数える。
     */
    public ValidationResult validateCandidate(ScheduleSnapshot hypothetical, Assignment candidate, boolean edit) {
        try {
            List<Conflict> relevant = new ArrayList<>();
            for (Conflict conflict : engine.detectConflicts(hypothetical, ConflictDetectionEngine.GATE_TYPES)) {
                boolean involved = conflict.affectedAssignments().stream().anyMatch(a -> a.isSameAs(candidate));
                if (!involved) {
                    continue;
                }
                if (edit && conflict.type().isRelational() && !conflict.involvesOtherThan(candidate.getId())) {
                    continue;
                }
                relevant.add(conflict);
            }
            return classify(relevant);
        } catch (RuntimeException e) {
            return failOpen(e);
        }
    }

    private ValidationResult classify(List<Conflict> conflicts) {
        long blocking = conflicts.stream().filter(c -> c.severity().isBlocking()).count();
        long minor = conflicts.size() - blocking;
        List<String> warnings = new ArrayList<>();
        if (minor > 0) {
            warnings.add("この変更で軽微なスケジュール上の問題が " + minor + " 件発生します");
        }
        logger.debug("変更検証: 競合={} ブロック={} 軽微={}", conflicts.size(), blocking, minor);
        return new ValidationResult(!conflicts.isEmpty(), conflicts, blocking == 0, warnings);
    }

    private ValidationResult failOpen(RuntimeException e) {
        logger.error("変更の事前検証に失敗しました", e);
        if (errorLogBuffer != null) {
            errorLogBuffer.addError("ScheduleChangeValidator", "変更の事前検証に失敗しました", e);
        }
        return ValidationResult.incomplete(INCOMPLETE_WARNING);
    }
}
