package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.Assignment;

import java.util.List;
import java.util.Objects;

/**
 * 検出された競合。検出のたびに新しく生成され、永続化されない。
 * <p>
 * 解決策が空の場合は「自動で解消できない」ことを表す（採用・教育などの人手対応が必要）。
 */
public record Conflict(
        String id,
        ConflictType type,
        Severity severity,
        String title,
        String description,
        List<Assignment> affectedAssignments,
        List<Resolution> resolutions,
        EstimatedImpact impact
) {

    public Conflict {
        affectedAssignments = affectedAssignments == null ? List.of() : List.copyOf(affectedAssignments);
        resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
        impact = impact == null ? EstimatedImpact.NONE : impact;
    }

    public List<Long> affectedAssignmentIds() {
        return affectedAssignments.stream().map(Assignment::getId).toList();
    }

    public boolean involvesAssignment(Long assignmentId) {
        return affectedAssignments.stream().anyMatch(a -> Objects.equals(a.getId(), assignmentId));
    }

    /**
     * 指定割り当て以外の割り当ても含むか
     */
    public boolean involvesOtherThan(Long assignmentId) {
        return affectedAssignments.stream().anyMatch(a -> !Objects.equals(a.getId(), assignmentId));
    }

    public boolean involvesWorker(String workerName) {
        return affectedAssignments.stream().anyMatch(a -> a.hasWorker(workerName));
    }
}
