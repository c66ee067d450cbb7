package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.WorkerDay;
import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.schedule.ScheduleWeek;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 営業日ごとの割り当て件数を平準化する。
 * <p>
 * 件数が平均より多い日から少ない日へ、担当者がその日に他の作業を持っていない割り当てを移す。
 * 1件移すごとに件数を更新し、同じ割り当てを二度動かさない。
 */
public class DayUtilizationHeuristic implements OptimizationHeuristic {

    static final int LIMIT = 2;

    private final List<DayOfWeek> workingDays;
    private final double threshold;

    public DayUtilizationHeuristic(List<DayOfWeek> workingDays, double threshold) {
        this.workingDays = List.copyOf(workingDays);
        this.threshold = threshold;
    }

    @Override
    public SuggestionKind kind() {
        return SuggestionKind.DAY_UTILIZATION;
    }

    @Override
    public List<Suggestion> propose(ScheduleIndex index) {
        List<Suggestion> suggestions = new ArrayList<>();
        if (workingDays.isEmpty()) {
            return suggestions;
        }
        Map<DayOfWeek, Integer> counts = new EnumMap<>(DayOfWeek.class);
        int total = 0;
        for (DayOfWeek day : workingDays) {
            int count = index.assignmentsOn(day).size();
            counts.put(day, count);
            total += count;
        }
        double mean = (double) total / workingDays.size();
        double upper = mean * (1 + threshold);
        double lower = mean * (1 - threshold);

        Set<WorkerDay> added = new HashSet<>();
        for (DayOfWeek busyDay : workingDays) {
            for (Assignment assignment : index.assignmentsOn(busyDay)) {
                if (suggestions.size() >= LIMIT) {
                    return suggestions;
                }
                if (counts.get(busyDay) <= upper) {
                    break;
                }
                if (!assignment.isMovable()) {
                    continue;
                }
                DayOfWeek target = findTarget(index, assignment, counts, lower, added);
                if (target == null) {
                    continue;
                }
                counts.merge(busyDay, -1, Integer::sum);
                counts.merge(target, 1, Integer::sum);
                assignment.assignedWorkers().forEach(w -> added.add(new WorkerDay(w, target)));
                suggestions.add(new Suggestion(
                        "day-" + assignment.getId() + "-" + target,
                        SuggestionKind.DAY_UTILIZATION,
                        "曜日の稼働を平準化",
                        assignment.getSiteName() + " を " + ScheduleWeek.label(busyDay) + " から "
                                + ScheduleWeek.label(target) + " に移動",
                        SuggestionPriority.DAY_UTILIZATION,
                        ImpactTier.LOW,
                        null,
                        List.of(FieldChange.moveToDay(assignment.getId(), target)),
                        new EstimatedSavings(10, 0)));
            }
        }
        return suggestions;
    }

    private DayOfWeek findTarget(ScheduleIndex index, Assignment assignment, Map<DayOfWeek, Integer> counts,
                                 double lower, Set<WorkerDay> added) {
        for (DayOfWeek day : workingDays) {
            if (counts.get(day) >= lower) {
                continue;
            }
            boolean free = assignment.assignedWorkers().stream().allMatch(w ->
                    index.assignmentsOf(w, day).isEmpty() && !added.contains(new WorkerDay(w, day)));
            if (free) {
                return day;
            }
        }
        return null;
    }
}
