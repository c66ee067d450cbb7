package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1人の清掃員が同じ日に複数の顧客間を移動している状態を検出する。
 * 地理情報は持たないため、顧客数を移動コストの代わりに使う。
 */
public class RoutingInefficiencyDetector implements ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(RoutingInefficiencyDetector.class);

    private static final Comparator<Assignment> BY_START =
            Comparator.comparing(Assignment::getStartTime, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LocalTime groupingStart;

    public RoutingInefficiencyDetector(int groupingStartHour) {
        this.groupingStart = LocalTime.of(groupingStartHour, 0);
    }

    @Override
    public ConflictType type() {
        return ConflictType.ROUTING_INEFFICIENCY;
    }

    @Override
    public List<Conflict> detect(ScheduleIndex index) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Map.Entry<WorkerDay, List<Assignment>> group : index.groups().entrySet()) {
            List<Assignment> assignments = group.getValue();
            if (assignments.size() < 2) {
                continue;
            }
            Map<String, List<Assignment>> byClient = new LinkedHashMap<>();
            for (Assignment assignment : assignments) {
                byClient.computeIfAbsent(assignment.getClientName(), c -> new ArrayList<>()).add(assignment);
            }
            if (byClient.size() < 2) {
                continue;
            }
            WorkerDay key = group.getKey();
            logger.debug("移動非効率検出: {} 顧客数={}", key.label(), byClient.size());
            conflicts.add(new Conflict(
                    "routing-" + key.key(),
                    ConflictType.ROUTING_INEFFICIENCY,
                    Severity.LOW,
                    "非効率な移動",
                    key.label() + " は " + byClient.size() + " 件の顧客間を移動します",
                    assignments,
                    resolutionsFor(key, byClient),
                    ConflictType.ROUTING_INEFFICIENCY.impactFor(byClient.size())));
        }
        return conflicts;
    }

    // 同じ顧客の作業を開始時刻順に詰めて、業務開始時刻から連続で並べる
    private List<Resolution> resolutionsFor(WorkerDay key, Map<String, List<Assignment>> byClient) {
        List<Resolution> resolutions = new ArrayList<>();
        for (Map.Entry<String, List<Assignment>> entry : byClient.entrySet()) {
            List<Assignment> clientAssignments = entry.getValue();
            if (clientAssignments.size() < 2) {
                continue;
            }
            if (resolutions.size() >= Resolution.MAX_PER_CONFLICT) {
                break;
            }
            List<FieldChange> changes = new ArrayList<>();
            LocalTime slot = groupingStart;
            for (Assignment assignment : clientAssignments.stream().sorted(BY_START).toList()) {
                changes.add(FieldChange.reschedule(assignment.getId(), slot));
                slot = slot.plusMinutes(Math.round(assignment.hoursOrZero() * 60));
            }
            int extra = clientAssignments.size() - 1;
            resolutions.add(new Resolution(
                    "group-" + key.key() + "-" + entry.getKey(),
                    ResolutionType.RESCHEDULE,
                    entry.getKey() + " の作業をまとめる",
                    entry.getKey() + " の " + clientAssignments.size() + " 件を " + groupingStart + " から連続で実施",
                    changes,
                    new EstimatedBenefit(extra * 20, extra * 15, 10)));
        }
        return resolutions;
    }
}
