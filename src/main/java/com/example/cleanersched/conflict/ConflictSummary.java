package com.example.cleanersched.conflict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 競合一覧の集計値
 */
public record ConflictSummary(
        int total,
        Map<Severity, Integer> countsBySeverity,
        int totalTimeWasted,
        int totalCostIncrease,
        double averageEfficiencyLoss
) {

    public static ConflictSummary of(List<Conflict> conflicts) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        int time = 0;
        int cost = 0;
        int efficiency = 0;
        for (Conflict conflict : conflicts) {
            counts.merge(conflict.severity(), 1, Integer::sum);
            time += conflict.impact().timeWasted();
            cost += conflict.impact().costIncrease();
            efficiency += conflict.impact().efficiencyLoss();
        }
        double average = conflicts.isEmpty() ? 0.0 : (double) efficiency / conflicts.size();
        return new ConflictSummary(conflicts.size(), Collections.unmodifiableMap(counts), time, cost, average);
    }

    public int count(Severity severity) {
        return countsBySeverity.getOrDefault(severity, 0);
    }
}
