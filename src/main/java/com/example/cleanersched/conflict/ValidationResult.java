package com.example.cleanersched.conflict;

import java.util.ArrayList;
import java.util.List;

/**
 * 変更の事前検証結果。{@code canProceed} が false の変更は確定してはならない。
 */
public record ValidationResult(
        boolean hasConflicts,
        List<Conflict> conflicts,
        boolean canProceed,
        List<String> warnings
) {

    public ValidationResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult permissive() {
        return new ValidationResult(false, List.of(), true, List.of());
    }

    public static ValidationResult incomplete(String warning) {
        return new ValidationResult(false, List.of(), true, List.of(warning));
    }

    public List<Conflict> blockingConflicts() {
        return conflicts.stream().filter(c -> c.severity().isBlocking()).toList();
    }

    /**
     * 警告を追加した結果を返す（競合と可否はそのまま）
     */
    public ValidationResult withWarnings(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extra);
        return new ValidationResult(hasConflicts, conflicts, canProceed, merged);
    }

    /**
     * 複数の割り当てに対する検証結果をまとめる。競合IDの重複は1件にする。
     */
    public static ValidationResult combine(List<ValidationResult> results) {
        List<Conflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean canProceed = true;
        for (ValidationResult result : results) {
            for (Conflict conflict : result.conflicts()) {
                if (conflicts.stream().noneMatch(c -> c.id().equals(conflict.id()))) {
                    conflicts.add(conflict);
                }
            }
            for (String warning : result.warnings()) {
                if (!warnings.contains(warning)) warnings.add(warning);
            }
            canProceed &= result.canProceed();
        }
        return new ValidationResult(!conflicts.isEmpty(), conflicts, canProceed, warnings);
    }
}
