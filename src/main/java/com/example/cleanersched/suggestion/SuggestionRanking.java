package com.example.cleanersched.suggestion;

import java.util.Comparator;

/**
 * 提案の並び順。競合由来 → 優先度 → 効果の大きさ → 削減見込み（時間+費用）の順で降順、
 * 最後に ID で全順序にする。
 */
public final class SuggestionRanking {

    public static final Comparator<Suggestion> ORDER = Comparator
            .comparing((Suggestion s) -> !s.kind().isConflictResolution())
            .thenComparing(Comparator.comparingInt(Suggestion::priority).reversed())
            .thenComparing(Comparator.comparingInt((Suggestion s) -> s.tier().rank()).reversed())
            .thenComparing(Comparator.comparingInt((Suggestion s) -> s.savings() == null ? 0 : s.savings().total()).reversed())
            .thenComparing(Suggestion::id);

    private SuggestionRanking() {
    }
}
