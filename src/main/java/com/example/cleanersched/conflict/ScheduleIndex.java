package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * スナップショットのキャンセル以外の割り当てを 清掃員×曜日 で束ねた索引。
 * <p>
 * 呼び出しごとに作り直し、インスタンスを共有しない。
 * 同じ割り当てが同じグループに二重に入ることはない。
 */
public final class ScheduleIndex {

    private final ScheduleSnapshot snapshot;
    private final Map<WorkerDay, List<Assignment>> groups = new LinkedHashMap<>();
    private final Map<DayOfWeek, List<Assignment>> byDay = new LinkedHashMap<>();

    private ScheduleIndex(ScheduleSnapshot snapshot) {
        this.snapshot = snapshot;
        for (Assignment assignment : snapshot.activeAssignments()) {
            if (assignment.getDay() == null) {
                continue;
            }
            addUnique(byDay.computeIfAbsent(assignment.getDay(), d -> new ArrayList<>()), assignment);
            for (String workerName : assignment.assignedWorkers()) {
                WorkerDay key = new WorkerDay(workerName, assignment.getDay());
                addUnique(groups.computeIfAbsent(key, k -> new ArrayList<>()), assignment);
            }
        }
    }

    public static ScheduleIndex of(ScheduleSnapshot snapshot) {
        return new ScheduleIndex(snapshot);
    }

    public ScheduleSnapshot snapshot() {
        return snapshot;
    }

    public Map<WorkerDay, List<Assignment>> groups() {
        return Collections.unmodifiableMap(groups);
    }

    public List<Assignment> assignmentsOf(String workerName, DayOfWeek day) {
        return groups.getOrDefault(new WorkerDay(workerName, day), List.of());
    }

    public List<Assignment> assignmentsOn(DayOfWeek day) {
        return byDay.getOrDefault(day, List.of());
    }

    /**
     * 指定日に {@code except} 以外の割り当てが無いか
     */
    public boolean isFreeFor(String workerName, DayOfWeek day, Assignment except) {
        for (Assignment other : assignmentsOf(workerName, day)) {
            if (!other.isSameAs(except)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 割り当てを引き受けられる清掃員（名簿順）。
     * 稼働中で、その日は他に割り当てが無く、現場のクリアランスを満たし、まだ担当していない者。
     */
    public List<Worker> freeQualifiedWorkers(Assignment target) {
        List<Worker> result = new ArrayList<>();
        for (Worker worker : snapshot.activeWorkers()) {
            if (target.hasWorker(worker.getName())) {
                continue;
            }
            if (!isFreeFor(worker.getName(), target.getDay(), target)) {
                continue;
            }
            if (!snapshot.canServe(worker, target)) {
                continue;
            }
            result.add(worker);
        }
        return result;
    }

    private static void addUnique(List<Assignment> list, Assignment assignment) {
        for (Assignment existing : list) {
            if (existing.isSameAs(assignment)) {
                return;
            }
        }
        list.add(assignment);
    }
}
