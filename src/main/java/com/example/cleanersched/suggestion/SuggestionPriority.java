package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.Conflict;
import com.example.cleanersched.conflict.ConflictType;

/**
 * 提案の優先度。競合由来はすべての最適化提案より上になるよう値を取る。
 */
public final class SuggestionPriority {

    public static final int CRITICAL = 100;
    public static final int HIGH_DOUBLE_BOOKING = 90;
    public static final int HIGH_OTHER = 85;
    public static final int MEDIUM = 70;
    public static final int LOW = 50;

    public static final int TRAVEL_GROUPING = 45;
    public static final int WORKLOAD_REBALANCE = 40;
    public static final int DAY_UTILIZATION = 25;

    private SuggestionPriority() {
    }

    public static int forConflict(Conflict conflict) {
        return switch (conflict.severity()) {
            case CRITICAL -> CRITICAL;
            case HIGH -> conflict.type() == ConflictType.DOUBLE_BOOKING ? HIGH_DOUBLE_BOOKING : HIGH_OTHER;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
