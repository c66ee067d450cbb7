package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.ScheduleWeek;

import java.time.DayOfWeek;

/**
 * 清掃員×曜日のグルーピングキー
 */
public record WorkerDay(String workerName, DayOfWeek day) {

    public String key() {
        return workerName + "-" + day;
    }

    public String label() {
        return workerName + "（" + ScheduleWeek.label(day) + "）";
    }
}
