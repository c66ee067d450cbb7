package com.example.cleanersched.schedule;

public enum AssignmentStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
