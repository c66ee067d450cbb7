package com.example.cleanersched.conflict;

public enum ResolutionType {
    REASSIGN,
    RESCHEDULE,
    SPLIT,
    MERGE
}
