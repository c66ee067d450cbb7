package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.Assignment;

/**
 * 複数名で担当する割り当ての時間数を清掃員ごとに按分する方針。
 */
@FunctionalInterface
public interface WorkloadAttribution {

    /** 担当人数で均等割り */
    WorkloadAttribution EVEN_SPLIT = (assignment, workerName) -> {
        int count = assignment.assignedWorkers().size();
        return count == 0 ? 0.0 : assignment.hoursOrZero() / count;
    };

    double hoursFor(Assignment assignment, String workerName);
}
