package com.example.cleanersched.suggestion;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.config.ConflictSettings;
import com.example.cleanersched.conflict.ConflictDetectionEngine;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.ScheduleSnapshot;
import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.example.cleanersched.conflict.ScheduleFixtures.assignment;
import static com.example.cleanersched.conflict.ScheduleFixtures.snapshot;
import static com.example.cleanersched.conflict.ScheduleFixtures.worker;
import static java.time.DayOfWeek.MONDAY;
import static org.assertj.core.api.Assertions.assertThat;

class SuggestionEngineTest {

    private final ConflictSettings settings = ConflictSettings.defaults();
    private final ConflictDetectionEngine detectionEngine = new ConflictDetectionEngine(settings);
    private final SuggestionEngine engine = new SuggestionEngine(detectionEngine, settings);

    // W1〜W6 がそれぞれ月曜に2件ずつ持ち、F1〜F3 は空いている週
    private ScheduleSnapshot crowdedMonday() {
        List<Assignment> assignments = new ArrayList<>();
        List<Worker> workers = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            String name = "W" + i;
            workers.add(worker(name, Clearance.LOW));
            assignments.add(assignment(2L * i - 1, MONDAY, "Acme", "Site " + i + "-a", 1, null, name));
            assignments.add(assignment(2L * i, MONDAY, "Acme", "Site " + i + "-b", 1, null, name));
        }
        for (int i = 1; i <= 3; i++) {
            workers.add(worker("F" + i, Clearance.LOW));
        }
        return snapshot(assignments, workers, List.of());
    }

    @Test
    void generate_capsResultAtConfiguredMaximum() {
        List<Suggestion> suggestions = engine.generate(crowdedMonday(), Set.of());

        assertThat(suggestions).hasSize(8);
        assertThat(suggestions).allSatisfy(s -> {
            assertThat(s.kind()).isEqualTo(SuggestionKind.CONFLICT_RESOLUTION);
            assertThat(s.priority()).isEqualTo(SuggestionPriority.HIGH_DOUBLE_BOOKING);
        });
        assertThat(suggestions).isSortedAccordingTo(SuggestionRanking.ORDER);
    }

    @Test
    void generate_dismissedIdsAreNeverOfferedAgain() {
        ScheduleSnapshot snapshot = crowdedMonday();
        String dismissed = engine.generate(snapshot, Set.of()).get(0).id();

        List<Suggestion> again = engine.generate(snapshot, Set.of(dismissed));

        assertThat(again).hasSize(8);
        assertThat(again).extracting(Suggestion::id).doesNotContain(dismissed);
    }

    @Test
    void generate_conflictResolutionsPrecedeOptimizations_andDuplicatesAreDropped() {
        SuggestionEngine uncapped = new SuggestionEngine(detectionEngine, SuggestionEngine.defaultHeuristics(settings), 50);

        List<Suggestion> suggestions = uncapped.generate(crowdedMonday(), Set.of());
        List<String> ids = suggestions.stream().map(Suggestion::id).toList();

        assertThat(suggestions).isSortedAccordingTo(SuggestionRanking.ORDER);
        assertThat(ids).doesNotHaveDuplicates();
        assertThat(ids).contains("rebalance-1-F1", "workload-3-F1", "day-1-TUESDAY");
        // 競合の解決策と同じ変更内容の最適化提案は出さない
        assertThat(ids).doesNotContain("workload-1-F1");
        int lastResolution = -1;
        int firstOptimization = suggestions.size();
        for (int i = 0; i < suggestions.size(); i++) {
            if (suggestions.get(i).kind().isConflictResolution()) {
                lastResolution = i;
            } else if (firstOptimization == suggestions.size()) {
                firstOptimization = i;
            }
        }
        assertThat(lastResolution).isLessThan(firstOptimization);
    }

    @Test
    void generate_conflictSuggestionsCarrySeverityAndTier() {
        SuggestionEngine uncapped = new SuggestionEngine(detectionEngine, List.of(), 50);

        List<Suggestion> suggestions = uncapped.generate(crowdedMonday(), Set.of());

        Suggestion rebalance = suggestions.stream().filter(s -> s.id().equals("rebalance-1-F1")).findFirst().orElseThrow();
        assertThat(rebalance.priority()).isEqualTo(SuggestionPriority.MEDIUM);
        assertThat(rebalance.tier()).isEqualTo(ImpactTier.MEDIUM);
        assertThat(rebalance.severity()).isNotNull();
        assertThat(suggestions.get(0).tier()).isEqualTo(ImpactTier.HIGH);
        assertThat(suggestions.get(0).savings()).isEqualTo(new EstimatedSavings(30, 50));
    }

    @Test
    void generate_failingHeuristicDoesNotHideOtherSuggestions() {
        OptimizationHeuristic broken = new OptimizationHeuristic() {
            @Override
            public SuggestionKind kind() {
                return SuggestionKind.TRAVEL_GROUPING;
            }

            @Override
            public List<Suggestion> propose(ScheduleIndex index) {
                throw new IllegalStateException("boom");
            }
        };
        ErrorLogBuffer errorLogBuffer = new ErrorLogBuffer();
        SuggestionEngine withBroken = new SuggestionEngine(detectionEngine, List.of(broken), 8, errorLogBuffer);

        assertThat(withBroken.generate(crowdedMonday(), Set.of())).hasSize(8);
        assertThat(errorLogBuffer.recent()).singleElement()
                .satisfies(entry -> assertThat(entry.source()).isEqualTo("TRAVEL_GROUPING"));
    }

    @Test
    void generate_emptyWeek_hasNoSuggestions() {
        assertThat(engine.generate(ScheduleSnapshot.empty(), Set.of())).isEmpty();
        assertThat(engine.generate(null, null)).isEmpty();
    }

    @Test
    void generate_respectsSmallerConfiguredMaximum() {
        ConflictSettings small = new ConflictSettings(0.3, 8, 0.2, 0.25, "MONDAY,TUESDAY", 3);
        SuggestionEngine limited = new SuggestionEngine(new ConflictDetectionEngine(small), small);

        assertThat(limited.generate(crowdedMonday(), null)).hasSize(3);
    }
}
