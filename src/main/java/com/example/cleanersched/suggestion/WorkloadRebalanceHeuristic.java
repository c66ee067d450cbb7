package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.WorkloadAttribution;
import com.example.cleanersched.conflict.WorkloadBalance;
import com.example.cleanersched.conflict.WorkloadBalance.WorkerLoad;
import com.example.cleanersched.schedule.Assignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 競合検出より緩いしきい値で業務量の偏りを見て、過負荷者の割り当てを稼働不足者へ移す提案を出す。
 * 移すのは予定状態かつ定期でない割り当てのみ。
 */
public class WorkloadRebalanceHeuristic implements OptimizationHeuristic {

    static final int LIMIT = 2;

    private final WorkloadAttribution attribution;
    private final double threshold;

    public WorkloadRebalanceHeuristic(WorkloadAttribution attribution, double threshold) {
        this.attribution = attribution;
        this.threshold = threshold;
    }

    @Override
    public SuggestionKind kind() {
        return SuggestionKind.WORKLOAD_REBALANCE;
    }

    @Override
    public List<Suggestion> propose(ScheduleIndex index) {
        WorkloadBalance balance = WorkloadBalance.of(index.snapshot(), attribution, threshold);
        List<WorkerLoad> underloaded = balance.underloaded();
        List<Suggestion> suggestions = new ArrayList<>();
        if (underloaded.isEmpty()) {
            return suggestions;
        }
        for (WorkerLoad over : balance.overloaded()) {
            if (suggestions.size() >= LIMIT) {
                break;
            }
            for (WorkerLoad under : underloaded) {
                Optional<Assignment> movable =
                        WorkloadBalance.firstTransferable(index, over, under.workerName(), Assignment::isMovable);
                if (movable.isEmpty()) {
                    continue;
                }
                Assignment assignment = movable.get();
                suggestions.add(new Suggestion(
                        "workload-" + assignment.getId() + "-" + under.workerName(),
                        SuggestionKind.WORKLOAD_REBALANCE,
                        "業務量の平準化",
                        assignment.getSiteName() + "（" + assignment.hoursOrZero() + "時間）を "
                                + over.workerName() + " から " + under.workerName() + " に移す",
                        SuggestionPriority.WORKLOAD_REBALANCE,
                        ImpactTier.MEDIUM,
                        null,
                        List.of(FieldChange.reassign(assignment.getId(), over.workerName(), under.workerName())),
                        new EstimatedSavings(0, 25)));
                break;
            }
        }
        return suggestions;
    }
}
