package com.example.cleanersched.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 競合検出と改善提案のしきい値。
 * <p>
 * しきい値は平均からの割合（0.3 = ±30%）。
 */
@Component
public class ConflictSettings {

    private static final String DEFAULT_WORKING_DAYS = "MONDAY,TUESDAY,WEDNESDAY,THURSDAY,FRIDAY";

    private final double workloadThreshold;
    private final int groupingStartHour;
    private final double suggestionWorkloadThreshold;
    private final double dayThreshold;
    private final List<DayOfWeek> workingDays;
    private final int maxSuggestions;

    public ConflictSettings(
            @Value("${scheduling.conflict.workload-threshold:0.3}") double workloadThreshold,
            @Value("${scheduling.conflict.grouping-start-hour:8}") int groupingStartHour,
            @Value("${scheduling.suggestion.workload-threshold:0.2}") double suggestionWorkloadThreshold,
            @Value("${scheduling.suggestion.day-threshold:0.25}") double dayThreshold,
            @Value("${scheduling.suggestion.working-days:" + DEFAULT_WORKING_DAYS + "}") String workingDays,
            @Value("${scheduling.suggestion.max-results:8}") int maxSuggestions) {
        if (workloadThreshold < 0 || suggestionWorkloadThreshold < 0 || dayThreshold < 0) {
            throw new IllegalArgumentException("しきい値は0以上で指定してください");
        }
        if (groupingStartHour < 0 || groupingStartHour > 23) {
            throw new IllegalArgumentException("grouping-start-hour は0〜23で指定してください: " + groupingStartHour);
        }
        if (maxSuggestions < 1) {
            throw new IllegalArgumentException("max-results は1以上で指定してください: " + maxSuggestions);
        }
        this.workloadThreshold = workloadThreshold;
        this.groupingStartHour = groupingStartHour;
        this.suggestionWorkloadThreshold = suggestionWorkloadThreshold;
        this.dayThreshold = dayThreshold;
        this.workingDays = parseDays(workingDays);
        this.maxSuggestions = maxSuggestions;
    }

    public static ConflictSettings defaults() {
        return new ConflictSettings(0.3, 8, 0.2, 0.25, DEFAULT_WORKING_DAYS, 8);
    }

    public double getWorkloadThreshold() { return workloadThreshold; }
    public int getGroupingStartHour() { return groupingStartHour; }
    public double getSuggestionWorkloadThreshold() { return suggestionWorkloadThreshold; }
    public double getDayThreshold() { return dayThreshold; }
    public List<DayOfWeek> getWorkingDays() { return workingDays; }
    public int getMaxSuggestions() { return maxSuggestions; }

    private static List<DayOfWeek> parseDays(String raw) {
        List<DayOfWeek> days = new ArrayList<>();
        if (raw != null) {
            for (String token : raw.split(",")) {
                String t = token.trim();
                if (t.isEmpty()) continue;
                DayOfWeek day = DayOfWeek.valueOf(t.toUpperCase(Locale.ROOT));
                if (!days.contains(day)) days.add(day);
            }
        }
        if (days.isEmpty()) {
            throw new IllegalArgumentException("working-days が空です");
        }
        return List.copyOf(days);
    }
}
