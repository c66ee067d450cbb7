package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.site.Site;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 1週間分の割り当て・清掃員名簿・現場台帳の読み取り専用スナップショット。
 * <p>
 * 検出エンジンはこのスナップショットだけを参照し、要素を変更しない。
 * 仮の変更を評価する場合は {@link #withAssignments(List)} で差し替えた複製を作る。
 */
public final class ScheduleSnapshot {

    private final List<Assignment> assignments;
    private final List<Worker> workers;
    private final List<Site> sites;
    private final Map<String, Worker> workersByName;
    private final Map<String, Site> sitesByKey;

    private ScheduleSnapshot(List<Assignment> assignments, List<Worker> workers, List<Site> sites) {
        this.assignments = withoutNulls(assignments);
        this.workers = withoutNulls(workers);
        this.sites = withoutNulls(sites);
        this.workersByName = new LinkedHashMap<>();
        for (Worker worker : this.workers) {
            if (worker.getName() != null) {
                workersByName.putIfAbsent(worker.getName().trim(), worker);
            }
        }
        this.sitesByKey = new LinkedHashMap<>();
        for (Site site : this.sites) {
            sitesByKey.putIfAbsent(siteKey(site.getClientName(), site.getSiteName()), site);
        }
    }

    public static ScheduleSnapshot of(Collection<Assignment> assignments,
                                      Collection<Worker> workers,
                                      Collection<Site> sites) {
        return new ScheduleSnapshot(
                assignments == null ? List.of() : new ArrayList<>(assignments),
                workers == null ? List.of() : new ArrayList<>(workers),
                sites == null ? List.of() : new ArrayList<>(sites));
    }

    public static ScheduleSnapshot empty() {
        return of(List.of(), List.of(), List.of());
    }

    public ScheduleSnapshot withAssignments(List<Assignment> replacement) {
        return new ScheduleSnapshot(replacement == null ? List.of() : replacement, workers, sites);
    }

    /**
     * 変更を反映した複製スナップショット。変更対象の割り当てだけを複製し、元の割り当ては変更しない。
     *
     * @throws IllegalArgumentException 存在しない割り当てIDを含む場合
     */
    public ScheduleSnapshot withChanges(List<FieldChange> changes) {
        Map<Long, Assignment> changed = new LinkedHashMap<>();
        for (FieldChange change : changes) {
            Assignment target = changed.get(change.assignmentId());
            if (target == null) {
                target = findAssignment(change.assignmentId())
                        .orElseThrow(() -> new IllegalArgumentException("割り当てが見つかりません: " + change.assignmentId()))
                        .copy();
                changed.put(change.assignmentId(), target);
            }
            change.applyTo(target);
        }
        List<Assignment> replaced = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            replaced.add(changed.getOrDefault(assignment.getId(), assignment));
        }
        return withAssignments(replaced);
    }

    public List<Assignment> assignments() {
        return assignments;
    }

    /**
     * キャンセル済みを除いた割り当て（入力順）
     */
    public List<Assignment> activeAssignments() {
        return assignments.stream().filter(a -> !a.isCancelled()).toList();
    }

    public List<Worker> workers() {
        return workers;
    }

    /**
     * 稼働中の清掃員（名簿順）
     */
    public List<Worker> activeWorkers() {
        return workers.stream().filter(Worker::isAvailableForWork).toList();
    }

    public List<Site> sites() {
        return sites;
    }

    public Optional<Worker> findWorker(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workersByName.get(name.trim()));
    }

    public Optional<Site> findSite(String clientName, String siteName) {
        return Optional.ofNullable(sitesByKey.get(siteKey(clientName, siteName)));
    }

    public Optional<Assignment> findAssignment(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return assignments.stream().filter(a -> Objects.equals(a.getId(), id)).findFirst();
    }

    /**
     * 割り当て先現場の要求クリアランス。台帳に無い、または要求なしの場合は空。
     */
    public Optional<Clearance> requiredClearance(Assignment assignment) {
        return findSite(assignment.getClientName(), assignment.getSiteName())
                .map(Site::getRequiredClearance);
    }

    /**
     * 清掃員がこの割り当ての現場に入れるか
     */
    public boolean canServe(Worker worker, Assignment assignment) {
        Clearance required = requiredClearance(assignment).orElse(null);
        return worker.effectiveClearance().satisfies(required);
    }

    private static String siteKey(String clientName, String siteName) {
        return (clientName == null ? "" : clientName.trim()) + "|" + (siteName == null ? "" : siteName.trim());
    }

    private static <T> List<T> withoutNulls(List<T> source) {
        List<T> result = new ArrayList<>(source.size());
        for (T item : source) {
            if (item != null) {
                result.add(item);
            }
        }
        return List.copyOf(result);
    }
}
