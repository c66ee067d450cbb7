package com.example.cleanersched.conflict;

import java.util.List;

/**
 * 競合を解消するための候補。割り当てはIDで参照するだけで、直接変更はしない。
 */
public record Resolution(
        String id,
        ResolutionType type,
        String title,
        String description,
        List<FieldChange> changes,
        EstimatedBenefit benefit
) {

    /** 1件の競合に付ける解決策の上限 */
    public static final int MAX_PER_CONFLICT = 3;

    public Resolution {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
