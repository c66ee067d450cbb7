package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.Assignment;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 1件の割り当てに対する最小限の項目変更。
 * <p>
 * {@code replacedWorker} が指定された場合はその清掃員だけを {@code newWorker} に差し替え、
 * 未指定の場合は担当者全体を {@code newWorker} 1名に置き換える。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldChange(
        Long assignmentId,
        String replacedWorker,
        String newWorker,
        DayOfWeek newDay,
        @JsonFormat(pattern = "HH:mm") LocalTime newTime,
        Double newHours
) {

    public static FieldChange reassign(Long assignmentId, String replacedWorker, String newWorker) {
        return new FieldChange(assignmentId, replacedWorker, newWorker, null, null, null);
    }

    public static FieldChange reschedule(Long assignmentId, LocalTime newTime) {
        return new FieldChange(assignmentId, null, null, null, newTime, null);
    }

    public static FieldChange moveToDay(Long assignmentId, DayOfWeek newDay) {
        return new FieldChange(assignmentId, null, null, newDay, null, null);
    }

    /**
     * 変更内容を割り当てに反映する。呼び出し側で複製を渡すこと。
     *
     * @throws IllegalArgumentException 差し替え元の清掃員が担当者に含まれていない場合
     */
    public void applyTo(Assignment target) {
        if (newWorker != null && !newWorker.isBlank()) {
            String incoming = newWorker.trim();
            if (replacedWorker != null) {
                String outgoing = replacedWorker.trim();
                if (!target.hasWorker(outgoing)) {
                    throw new IllegalArgumentException(
                            outgoing + " は割り当て " + assignmentId + " の担当者ではありません");
                }
                List<String> names = new ArrayList<>();
                for (String name : target.assignedWorkers()) {
                    names.add(name.equals(outgoing) ? incoming : name);
                }
                target.setWorkerNames(names);
            } else {
                target.setWorkerNames(List.of(incoming));
            }
        }
        if (newDay != null) target.setDay(newDay);
        if (newTime != null) target.setStartTime(newTime);
        if (newHours != null) target.setHours(newHours);
    }
}
