package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 現場の要求クリアランスに満たない清掃員が割り当てられている状態を検出する。
 * <p>
 * 台帳に無い現場、要求クリアランスの無い現場、名簿に無い清掃員は判定しない。
 */
public class SecurityAccessDetector implements ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(SecurityAccessDetector.class);

    @Override
    public ConflictType type() {
        return ConflictType.SECURITY_ACCESS;
    }

    @Override
    public List<Conflict> detect(ScheduleIndex index) {
        ScheduleSnapshot snapshot = index.snapshot();
        List<Conflict> conflicts = new ArrayList<>();
        for (Assignment assignment : snapshot.activeAssignments()) {
            Optional<Clearance> required = snapshot.requiredClearance(assignment);
            if (required.isEmpty()) {
                continue;
            }
            List<String> unauthorized = new ArrayList<>();
            for (String workerName : assignment.assignedWorkers()) {
                snapshot.findWorker(workerName)
                        .filter(w -> !w.effectiveClearance().satisfies(required.get()))
                        .ifPresent(w -> unauthorized.add(workerName));
            }
            if (unauthorized.isEmpty()) {
                continue;
            }
            logger.debug("セキュリティアクセス違反: {} {} 要求={}", assignment.getId(), unauthorized, required.get());
            conflicts.add(new Conflict(
                    "security-access-" + assignment.getId(),
                    ConflictType.SECURITY_ACCESS,
                    Severity.CRITICAL,
                    "セキュリティアクセス違反",
                    String.join("、", unauthorized) + " は " + assignment.getSiteName()
                            + " に必要なクリアランス（" + required.get() + "）を持っていません",
                    List.of(assignment),
                    resolutionsFor(snapshot, assignment, required.get(), unauthorized),
                    ConflictType.SECURITY_ACCESS.impactFor(1)));
        }
        return conflicts;
    }

    // 対象者が1名ならその1名だけを差し替え、複数名なら担当者全体を置き換える
    private List<Resolution> resolutionsFor(ScheduleSnapshot snapshot, Assignment assignment,
                                            Clearance required, List<String> unauthorized) {
        String replaced = unauthorized.size() == 1 ? unauthorized.get(0) : null;
        List<Resolution> resolutions = new ArrayList<>();
        for (Worker worker : snapshot.activeWorkers()) {
            if (resolutions.size() >= Resolution.MAX_PER_CONFLICT) {
                break;
            }
            if (!worker.effectiveClearance().satisfies(required) || assignment.hasWorker(worker.getName())) {
                continue;
            }
            resolutions.add(new Resolution(
                    "security-reassign-" + assignment.getId() + "-" + worker.getName(),
                    ResolutionType.REASSIGN,
                    worker.getName() + " に再割り当て",
                    "権限の無い清掃員を " + worker.getName() + "（" + worker.effectiveClearance() + "）に交代",
                    List.of(FieldChange.reassign(assignment.getId(), replaced, worker.getName())),
                    new EstimatedBenefit(0, 0, 30)));
        }
        return resolutions;
    }
}
