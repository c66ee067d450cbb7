package com.example.cleanersched.conflict;

import java.util.List;

/**
 * 1回の検出結果と、その絞り込み。
 */
public final class ConflictReport {

    private final List<Conflict> conflicts;

    public ConflictReport(List<Conflict> conflicts) {
        this.conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public List<Conflict> conflicts() {
        return conflicts;
    }

    public ConflictSummary summary() {
        return ConflictSummary.of(conflicts);
    }

    public List<Conflict> forAssignment(Long assignmentId) {
        return conflicts.stream().filter(c -> c.involvesAssignment(assignmentId)).toList();
    }

    public List<Conflict> forWorker(String workerName) {
        return conflicts.stream().filter(c -> c.involvesWorker(workerName)).toList();
    }

    public List<Conflict> bySeverity(Severity severity) {
        return conflicts.stream().filter(c -> c.severity() == severity).toList();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public boolean hasCritical() {
        return conflicts.stream().anyMatch(c -> c.severity() == Severity.CRITICAL);
    }

    public boolean hasBlocking() {
        return conflicts.stream().anyMatch(c -> c.severity().isBlocking());
    }
}
