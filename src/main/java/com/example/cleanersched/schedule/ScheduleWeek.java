package com.example.cleanersched.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 週間グリッドの日付計算。週は月曜始まり。
 */
public final class ScheduleWeek {

    private ScheduleWeek() {
    }

    public static LocalDate mondayOf(LocalDate date) {
        LocalDate base = date == null ? LocalDate.now() : date;
        return base.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate dateOf(LocalDate weekStart, DayOfWeek day) {
        return mondayOf(weekStart).plusDays(day.getValue() - 1L);
    }

    public static String label(DayOfWeek day) {
        return day == null ? "-" : day.getDisplayName(TextStyle.FULL, Locale.JAPAN);
    }
}
