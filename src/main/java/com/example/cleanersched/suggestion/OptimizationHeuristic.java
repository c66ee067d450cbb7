package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.ScheduleIndex;

import java.util.List;

/**
 * 競合ではないが改善の余地がある箇所を提案する。件数の上限は実装ごとに持つ。
 */
public interface OptimizationHeuristic {

    SuggestionKind kind();

    List<Suggestion> propose(ScheduleIndex index);
}
