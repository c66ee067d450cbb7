package com.example.cleanersched.conflict;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * CRITICAL / HIGH は確定前に変更を止める
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == HIGH;
    }
}
