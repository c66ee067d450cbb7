package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.cleanersched.conflict.ScheduleFixtures.assignment;
import static com.example.cleanersched.conflict.ScheduleFixtures.snapshot;
import static com.example.cleanersched.conflict.ScheduleFixtures.worker;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WorkloadImbalanceDetectorTest {

    private final WorkloadImbalanceDetector detector =
            new WorkloadImbalanceDetector(WorkloadAttribution.EVEN_SPLIT, 0.3);

    private final List<Worker> roster = List.of(
            worker("A", Clearance.LOW), worker("B", Clearance.LOW), worker("C", Clearance.LOW));

    private List<Assignment> unevenWeek() {
        return List.of(
                assignment(1, MONDAY, "Acme", "Tower", 10, null, "A"),
                assignment(2, TUESDAY, "Acme", "Tower", 10, null, "A"),
                assignment(3, MONDAY, "Globex", "Office", 10, null, "B"),
                assignment(4, WEDNESDAY, "Globex", "Office", 10, null, "B"),
                assignment(5, MONDAY, "Initech", "Warehouse", 2, null, "C"));
    }

    @Test
    void detect_twoOverloadedOneUnderloaded_reportsSingleMediumConflict() {
        ScheduleSnapshot snapshot = snapshot(unevenWeek(), roster, List.of());

        List<Conflict> conflicts = detector.detect(ScheduleIndex.of(snapshot));

        assertThat(conflicts).hasSize(1);
        Conflict conflict = conflicts.get(0);
        assertThat(conflict.id()).isEqualTo("workload-imbalance");
        assertThat(conflict.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(conflict.impact()).isEqualTo(new EstimatedImpact(0, 50, 10));
        assertThat(conflict.affectedAssignmentIds()).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
    }

    @Test
    void detect_resolutionsMoveWorkToDaysTheUnderloadedWorkerHasFree() {
        ScheduleSnapshot snapshot = snapshot(unevenWeek(), roster, List.of());

        Conflict conflict = detector.detect(ScheduleIndex.of(snapshot)).get(0);

        assertThat(conflict.resolutions()).extracting(Resolution::id)
                .containsExactly("rebalance-2-C", "rebalance-4-C");
        assertThat(conflict.resolutions()).flatExtracting(Resolution::changes)
                .containsExactly(FieldChange.reassign(2L, "A", "C"), FieldChange.reassign(4L, "B", "C"));
    }

    @Test
    void detect_balancedWeek_noConflict() {
        ScheduleSnapshot snapshot = snapshot(List.of(
                        assignment(1, MONDAY, "Acme", "Tower", 8, null, "A"),
                        assignment(2, MONDAY, "Globex", "Office", 8, null, "B"),
                        assignment(3, MONDAY, "Initech", "Warehouse", 8, null, "C")),
                roster, List.of());

        assertThat(detector.detect(ScheduleIndex.of(snapshot))).isEmpty();
    }

    @Test
    void balance_crewHoursAreSplitEvenly() {
        ScheduleSnapshot snapshot = snapshot(
                List.of(assignment(1, MONDAY, "Acme", "Tower", 8, null, "A", "B")), roster, List.of());

        WorkloadBalance balance = WorkloadBalance.of(snapshot, WorkloadAttribution.EVEN_SPLIT, 0.3);

        assertThat(balance.loads()).extracting(WorkloadBalance.WorkerLoad::hours).containsExactly(4.0, 4.0, 0.0);
        assertThat(balance.mean()).isCloseTo(8.0 / 3, within(1e-9));
        assertThat(balance.underloaded()).extracting(WorkloadBalance.WorkerLoad::workerName).containsExactly("C");
    }

    @Test
    void balance_ignoresWorkersOutsideActiveRoster() {
        ScheduleSnapshot snapshot = snapshot(List.of(
                        assignment(1, MONDAY, "Acme", "Tower", 8, null, "A"),
                        assignment(2, MONDAY, "Acme", "Tower", 30, null, "Temp")),
                roster, List.of());

        WorkloadBalance balance = WorkloadBalance.of(snapshot, WorkloadAttribution.EVEN_SPLIT, 0.3);

        assertThat(balance.loads()).extracting(WorkloadBalance.WorkerLoad::workerName).containsExactly("A", "B", "C");
        assertThat(balance.overloaded()).extracting(WorkloadBalance.WorkerLoad::workerName).containsExactly("A");
    }
}
