package com.example.cleanersched.suggestion;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.config.ConflictSettings;
import com.example.cleanersched.conflict.Conflict;
import com.example.cleanersched.conflict.ConflictDetectionEngine;
import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.Resolution;
import com.example.cleanersched.conflict.ScheduleIndex;
import com.example.cleanersched.conflict.ScheduleSnapshot;
import com.example.cleanersched.conflict.WorkloadAttribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 競合の解決策と最適化ヒューリスティックの提案を1つの一覧にまとめる。
 * <p>
 * 手順: 競合由来の提案を作る → 各ヒューリスティックを実行 → 並べ替え → 同一IDと
 * 競合由来と同じ変更内容の最適化提案を除く → 却下済みIDを除く → 上限件数で切る。
 */
@Service
public class SuggestionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionEngine.class);

    private final ConflictDetectionEngine detectionEngine;
    private final List<OptimizationHeuristic> heuristics;
    private final int maxResults;
    private final ErrorLogBuffer errorLogBuffer;

    @Autowired
    public SuggestionEngine(ConflictDetectionEngine detectionEngine, ConflictSettings settings,
                            ErrorLogBuffer errorLogBuffer) {
        this(detectionEngine, defaultHeuristics(settings), settings.getMaxSuggestions(), errorLogBuffer);
    }

    public SuggestionEngine(ConflictDetectionEngine detectionEngine, ConflictSettings settings) {
        this(detectionEngine, defaultHeuristics(settings), settings.getMaxSuggestions(), null);
    }

    SuggestionEngine(ConflictDetectionEngine detectionEngine, List<OptimizationHeuristic> heuristics, int maxResults) {
        this(detectionEngine, heuristics, maxResults, null);
    }

    SuggestionEngine(ConflictDetectionEngine detectionEngine, List<OptimizationHeuristic> heuristics, int maxResults,
                     ErrorLogBuffer errorLogBuffer) {
        this.detectionEngine = detectionEngine;
        this.heuristics = List.copyOf(heuristics);
        this.maxResults = maxResults;
        this.errorLogBuffer = errorLogBuffer;
    }

    public static List<OptimizationHeuristic> defaultHeuristics(ConflictSettings settings) {
        return List.of(
                new TravelGroupingHeuristic(),
                new WorkloadRebalanceHeuristic(WorkloadAttribution.EVEN_SPLIT, settings.getSuggestionWorkloadThreshold()),
                new DayUtilizationHeuristic(settings.getWorkingDays(), settings.getDayThreshold()));
    }

    public List<Suggestion> generate(ScheduleSnapshot snapshot, Set<String> dismissedIds) {
        if (snapshot == null) {
            return List.of();
        }
        return generate(snapshot, detectionEngine.detectConflicts(snapshot), dismissedIds);
    }

    /**
     * 検出済みの競合を使って提案を作る
     */
    public List<Suggestion> generate(ScheduleSnapshot snapshot, List<Conflict> conflicts, Set<String> dismissedIds) {
        List<Suggestion> candidates = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            for (Resolution resolution : conflict.resolutions()) {
                candidates.add(fromResolution(conflict, resolution));
            }
        }
        ScheduleIndex index = ScheduleIndex.of(snapshot);
        for (OptimizationHeuristic heuristic : heuristics) {
            try {
                candidates.addAll(heuristic.propose(index));
            } catch (RuntimeException e) {
                String message = heuristic.kind() + " の提案生成中にエラーが発生しました";
                logger.error(message, e);
                if (errorLogBuffer != null) {
                    errorLogBuffer.addError(heuristic.kind().name(), message, e);
                }
            }
        }
        candidates.sort(SuggestionRanking.ORDER);

        Map<String, Suggestion> unique = new LinkedHashMap<>();
        Set<List<FieldChange>> resolutionChanges = new HashSet<>();
        for (Suggestion suggestion : candidates) {
            if (unique.containsKey(suggestion.id())) {
                continue;
            }
            if (suggestion.kind().isConflictResolution()) {
                resolutionChanges.add(suggestion.changes());
            } else if (resolutionChanges.contains(suggestion.changes())) {
                continue;
            }
            unique.put(suggestion.id(), suggestion);
        }

        Set<String> dismissed = dismissedIds == null ? Set.of() : dismissedIds;
        List<Suggestion> result = unique.values().stream()
                .filter(s -> !dismissed.contains(s.id()))
                .limit(maxResults)
                .toList();
        logger.debug("提案生成: 候補={} 却下済み={} 提示={}", candidates.size(), dismissed.size(), result.size());
        return result;
    }

    private static Suggestion fromResolution(Conflict conflict, Resolution resolution) {
        return new Suggestion(
                resolution.id(),
                SuggestionKind.CONFLICT_RESOLUTION,
                resolution.title(),
                conflict.title() + ": " + resolution.description(),
                SuggestionPriority.forConflict(conflict),
                ImpactTier.fromSeverity(conflict.severity()),
                conflict.severity(),
                resolution.changes(),
                new EstimatedSavings(resolution.benefit().timeSaved(), resolution.benefit().costReduction()));
    }
}
