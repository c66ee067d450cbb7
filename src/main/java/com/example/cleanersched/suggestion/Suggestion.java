package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.FieldChange;
import com.example.cleanersched.conflict.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 画面に提示する改善提案。ID はスナップショットから決定的に決まるため、
 * 再計算しても却下済みの提案を識別できる。
 * <p>
 * {@code severity} は競合由来の提案のみ設定される。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Suggestion(
        String id,
        SuggestionKind kind,
        String title,
        String description,
        int priority,
        ImpactTier tier,
        Severity severity,
        List<FieldChange> changes,
        EstimatedSavings savings
) {

    public Suggestion {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
