package com.example.cleanersched.suggestion;

public enum SuggestionKind {
    CONFLICT_RESOLUTION,
    TRAVEL_GROUPING,
    WORKLOAD_REBALANCE,
    DAY_UTILIZATION;

    public boolean isConflictResolution() {
        return this == CONFLICT_RESOLUTION;
    }
}
