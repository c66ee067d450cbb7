package com.example.cleanersched.suggestion;

import com.example.cleanersched.conflict.Severity;

/**
 * 提案の効果の大きさ。{@code rank} が大きいほど上位。
 */
public enum ImpactTier {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    ImpactTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static ImpactTier fromSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
