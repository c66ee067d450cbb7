package com.example.cleanersched.vacation;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 指定日に清掃員が休暇中かを調べる。
 */
public interface VacationLookup {

    Optional<Vacation> find(String workerName, LocalDate date);
}
