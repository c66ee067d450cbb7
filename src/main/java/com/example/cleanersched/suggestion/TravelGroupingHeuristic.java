package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.WorkerDay;
import com.example.cleanersched.schedule.Assignment;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 同じ日に同じ顧客の作業が他の顧客の作業を挟んで分かれている場合に、連続実施を提案する。
 * <p>
 * 挟まれた区間の先頭（その顧客の最も早い開始時刻）から、その顧客の作業 → 挟まれていた作業の順に
 * 詰め直す。区間外の作業は動かさない。
 */
public class TravelGroupingHeuristic implements OptimizationHeuristic {

    static final int LIMIT = 3;

    @Override
    public SuggestionKind kind() {
        return SuggestionKind.TRAVEL_GROUPING;
    }

    @Override
    public List<Suggestion> propose(ScheduleIndex index) {
        List<Suggestion> suggestions = new ArrayList<>();
        for (Map.Entry<WorkerDay, List<Assignment>> group : index.groups().entrySet()) {
            List<Assignment> timed = group.getValue().stream()
                    .filter(a -> a.getStartTime() != null && a.hoursOrZero() > 0)
                    .sorted(Comparator.comparing(Assignment::getStartTime))
                    .toList();
            if (timed.size() < 3) {
                continue;
            }
            Set<String> clients = new LinkedHashSet<>();
            timed.forEach(a -> clients.add(a.getClientName()));
            for (String client : clients) {
                if (suggestions.size() >= LIMIT) {
                    return suggestions;
                }
                int first = -1;
                int last = -1;
                for (int i = 0; i < timed.size(); i++) {
                    if (Objects.equals(timed.get(i).getClientName(), client)) {
                        if (first < 0) first = i;
                        last = i;
                    }
                }
                List<Assignment> span = timed.subList(first, last + 1);
                List<Assignment> own = span.stream().filter(a -> Objects.equals(a.getClientName(), client)).toList();
                if (own.size() == span.size()) {
                    continue;
                }
                List<Assignment> reordered = new ArrayList<>(own);
                span.stream().filter(a -> !Objects.equals(a.getClientName(), client)).forEach(reordered::add);

                List<FieldChange> changes = new ArrayList<>();
                LocalTime slot = span.get(0).getStartTime();
                for (Assignment assignment : reordered) {
                    if (!slot.equals(assignment.getStartTime())) {
                        changes.add(FieldChange.reschedule(assignment.getId(), slot));
                    }
                    slot = slot.plusMinutes(Math.round(assignment.hoursOrZero() * 60));
                }
                if (changes.isEmpty()) {
                    continue;
                }
                WorkerDay key = group.getKey();
                int extra = own.size() - 1;
                suggestions.add(new Suggestion(
                        "travel-" + key.key() + "-" + client,
                        SuggestionKind.TRAVEL_GROUPING,
                        "移動時間の短縮",
                        key.label() + " の " + client + " の作業 " + own.size() + " 件を "
                                + span.get(0).getStartTime() + " から連続で実施",
                        SuggestionPriority.TRAVEL_GROUPING,
                        ImpactTier.MEDIUM,
                        null,
                        changes,
                        new EstimatedSavings(15 * extra, 10 * extra)));
            }
        }
        return suggestions;
    }
}
