package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 稼働中の清掃員ごとの週間負荷と、平均からの偏り。
 * <p>
 * 平均は割り当ての無い清掃員も含めた稼働中全員で取る。
 * 名簿に無い、または非稼働の清掃員の時間は集計しない。
 */
public final class WorkloadBalance {

    private final Map<String, WorkerLoad> loads;
    private final double mean;
    private final double threshold;

    private WorkloadBalance(Map<String, WorkerLoad> loads, double mean, double threshold) {
        this.loads = loads;
        this.mean = mean;
        this.threshold = threshold;
    }

    public static WorkloadBalance of(ScheduleSnapshot snapshot, WorkloadAttribution attribution, double threshold) {
        Map<String, Double> hours = new LinkedHashMap<>();
        Map<String, List<Assignment>> entries = new LinkedHashMap<>();
        for (Worker worker : snapshot.activeWorkers()) {
            hours.putIfAbsent(worker.getName(), 0.0);
            entries.putIfAbsent(worker.getName(), new ArrayList<>());
        }
        for (Assignment assignment : snapshot.activeAssignments()) {
            for (String workerName : assignment.assignedWorkers()) {
                if (!hours.containsKey(workerName)) {
                    continue;
                }
                hours.merge(workerName, attribution.hoursFor(assignment, workerName), Double::sum);
                entries.get(workerName).add(assignment);
            }
        }
        Map<String, WorkerLoad> loads = new LinkedHashMap<>();
        hours.forEach((name, h) -> loads.put(name, new WorkerLoad(name, h, List.copyOf(entries.get(name)))));
        double mean = loads.isEmpty() ? 0.0
                : loads.values().stream().mapToDouble(WorkerLoad::hours).sum() / loads.size();
        return new WorkloadBalance(loads, mean, threshold);
    }

    public double mean() {
        return mean;
    }

    public List<WorkerLoad> loads() {
        return List.copyOf(loads.values());
    }

    public List<WorkerLoad> overloaded() {
        double limit = mean * (1 + threshold);
        return loads.values().stream().filter(l -> l.hours() > limit).toList();
    }

    public List<WorkerLoad> underloaded() {
        double limit = mean * (1 - threshold);
        return loads.values().stream().filter(l -> l.hours() < limit).toList();
    }

    public boolean isImbalanced() {
        return !overloaded().isEmpty() && !underloaded().isEmpty();
    }

    /**
     * 過負荷者の割り当てのうち、移し先がその日空いていて現場に入れる最初のもの
     */
    public static Optional<Assignment> firstTransferable(ScheduleIndex index, WorkerLoad from, String targetName,
                                                         Predicate<Assignment> eligible) {
        Optional<Worker> target = index.snapshot().findWorker(targetName);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        for (Assignment assignment : from.assignments()) {
            if (!eligible.test(assignment) || assignment.hasWorker(targetName)) {
                continue;
            }
            if (!index.assignmentsOf(targetName, assignment.getDay()).isEmpty()) {
                continue;
            }
            if (!index.snapshot().canServe(target.get(), assignment)) {
                continue;
            }
            return Optional.of(assignment);
        }
        return Optional.empty();
    }

    public record WorkerLoad(String workerName, double hours, List<Assignment> assignments) {
    }
}
