package com.example.cleanersched.conflict;

import com.example.cleanersched.conflict.WorkloadBalance.WorkerLoad;
import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 稼働中清掃員の週間時間が平均から大きく外れている状態を検出する。
 * 過負荷と稼働不足が同時にいる場合のみ1件の競合として報告する。
 */
public class WorkloadImbalanceDetector implements ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadImbalanceDetector.class);

    private final WorkloadAttribution attribution;
    private final double threshold;

    public WorkloadImbalanceDetector(WorkloadAttribution attribution, double threshold) {
        this.attribution = attribution;
        this.threshold = threshold;
    }

    @Override
    public ConflictType type() {
        return ConflictType.WORKLOAD_IMBALANCE;
    }

    @Override
    public List<Conflict> detect(ScheduleIndex index) {
        WorkloadBalance balance = WorkloadBalance.of(index.snapshot(), attribution, threshold);
        if (!balance.isImbalanced()) {
            return List.of();
        }
        List<WorkerLoad> overloaded = balance.overloaded();
        List<WorkerLoad> underloaded = balance.underloaded();
        logger.debug("業務量の偏り検出: 過負荷={} 稼働不足={} 平均={}", overloaded.size(), underloaded.size(), balance.mean());

        Map<Object, Assignment> affected = new LinkedHashMap<>();
        for (WorkerLoad load : overloaded) load.assignments().forEach(a -> affected.putIfAbsent(identity(a), a));
        for (WorkerLoad load : underloaded) load.assignments().forEach(a -> affected.putIfAbsent(identity(a), a));

        return List.of(new Conflict(
                "workload-imbalance",
                ConflictType.WORKLOAD_IMBALANCE,
                Severity.MEDIUM,
                "業務量の偏り",
                overloaded.size() + " 名が過負荷、" + underloaded.size() + " 名が稼働不足です（平均 "
                        + String.format("%.1f", balance.mean()) + " 時間）",
                new ArrayList<>(affected.values()),
                resolutionsFor(index, overloaded, underloaded),
                ConflictType.WORKLOAD_IMBALANCE.impactFor(overloaded.size())));
    }

    private List<Resolution> resolutionsFor(ScheduleIndex index, List<WorkerLoad> overloaded, List<WorkerLoad> underloaded) {
        List<Resolution> resolutions = new ArrayList<>();
        for (WorkerLoad over : overloaded) {
            for (WorkerLoad under : underloaded) {
                if (resolutions.size() >= Resolution.MAX_PER_CONFLICT) {
                    return resolutions;
                }
                var transferable = WorkloadBalance.firstTransferable(index, over, under.workerName(), a -> !a.isCancelled());
                transferable.ifPresent(a -> resolutions.add(new Resolution(
                        "rebalance-" + a.getId() + "-" + under.workerName(),
                        ResolutionType.REASSIGN,
                        "業務量を平準化",
                        a.getSiteName() + " を " + over.workerName() + " から " + under.workerName() + " に移す",
                        List.of(FieldChange.reassign(a.getId(), over.workerName(), under.workerName())),
                        new EstimatedBenefit(0, 25, 15))));
            }
        }
        return resolutions;
    }

    private static Object identity(Assignment assignment) {
        return assignment.getId() != null ? assignment.getId() : assignment;
    }
}
