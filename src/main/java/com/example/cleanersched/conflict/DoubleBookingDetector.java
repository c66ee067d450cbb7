package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 同じ清掃員が同じ曜日に複数の割り当てを持っている状態を検出する。
 */
public class DoubleBookingDetector implements ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(DoubleBookingDetector.class);
    private static final int ALTERNATIVES_PER_ASSIGNMENT = 2;

    @Override
    public ConflictType type() {
        return ConflictType.DOUBLE_BOOKING;
    }

    @Override
    public List<Conflict> detect(ScheduleIndex index) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Map.Entry<WorkerDay, List<Assignment>> group : index.groups().entrySet()) {
            List<Assignment> assignments = group.getValue();
            if (assignments.size() < 2) {
                continue;
            }
            WorkerDay key = group.getKey();
            int size = assignments.size();
            logger.debug("ダブルブッキング検出: {} {}件", key.label(), size);
            conflicts.add(new Conflict(
                    "double-booking-" + key.key(),
                    ConflictType.DOUBLE_BOOKING,
                    size > 2 ? Severity.CRITICAL : Severity.HIGH,
                    "ダブルブッキング",
                    key.label() + " に " + size + " 件の割り当てがあります",
                    assignments,
                    resolutionsFor(index, key, assignments),
                    ConflictType.DOUBLE_BOOKING.impactFor(size)));
        }
        return conflicts;
    }

    // 先頭以外の割り当てを、その日に空いている有資格者へ振り替える
    private List<Resolution> resolutionsFor(ScheduleIndex index, WorkerDay key, List<Assignment> assignments) {
        List<Resolution> resolutions = new ArrayList<>();
        for (int i = 1; i < assignments.size(); i++) {
            Assignment assignment = assignments.get(i);
            List<Worker> candidates = index.freeQualifiedWorkers(assignment);
            for (Worker candidate : candidates.subList(0, Math.min(ALTERNATIVES_PER_ASSIGNMENT, candidates.size()))) {
                if (resolutions.size() >= Resolution.MAX_PER_CONFLICT) {
                    return resolutions;
                }
                resolutions.add(new Resolution(
                        "reassign-" + assignment.getId() + "-" + candidate.getName(),
                        ResolutionType.REASSIGN,
                        candidate.getName() + " に再割り当て",
                        assignment.getSiteName() + " の担当を " + key.workerName() + " から " + candidate.getName() + " に変更",
                        List.of(FieldChange.reassign(assignment.getId(), key.workerName(), candidate.getName())),
                        new EstimatedBenefit(30, 50, 20)));
            }
        }
        return resolutions;
    }
}
