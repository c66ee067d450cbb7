package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.WorkloadAttribution;
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

class WorkloadRebalanceHeuristicTest {

    private final WorkloadRebalanceHeuristic heuristic =
            new WorkloadRebalanceHeuristic(WorkloadAttribution.EVEN_SPLIT, 0.2);

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
    void propose_movesFirstTransferableAssignmentOfEachOverloadedWorker() {
        List<Suggestion> suggestions = heuristic.propose(ScheduleIndex.of(snapshot(unevenWeek(), roster, List.of())));

        assertThat(suggestions).extracting(Suggestion::id).containsExactly("workload-2-C", "workload-4-C");
        assertThat(suggestions.get(0).changes()).containsExactly(FieldChange.reassign(2L, "A", "C"));
        assertThat(suggestions.get(0).tier()).isEqualTo(ImpactTier.MEDIUM);
        assertThat(suggestions.get(0).savings()).isEqualTo(new EstimatedSavings(0, 25));
    }

    @Test
    void propose_recurringAssignmentsAreNotMoved() {
        List<Assignment> assignments = unevenWeek();
        assignments.get(1).setRecurring(true);

        List<Suggestion> suggestions = heuristic.propose(ScheduleIndex.of(snapshot(assignments, roster, List.of())));

        assertThat(suggestions).extracting(Suggestion::id).containsExactly("workload-4-C");
    }

    @Test
    void propose_balancedWeek_hasNoSuggestion() {
        List<Assignment> balanced = List.of(
                assignment(1, MONDAY, "Acme", "Tower", 8, null, "A"),
                assignment(2, MONDAY, "Globex", "Office", 8, null, "B"),
                assignment(3, MONDAY, "Initech", "Warehouse", 7, null, "C"));

        assertThat(heuristic.propose(ScheduleIndex.of(snapshot(balanced, roster, List.of())))).isEmpty();
    }
}
