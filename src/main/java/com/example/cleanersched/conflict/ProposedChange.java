package com.example.cleanersched.conflict;

import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.schedule.AssignmentStatus;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * 事前検証にかける割り当ての部分情報。指定された項目だけが元の割り当てに上書きされる。
 */
public record ProposedChange(
        DayOfWeek day,
        String clientName,
        String siteName,
        List<String> workerNames,
        Double hours,
        @JsonFormat(pattern = "HH:mm") LocalTime startTime,
        AssignmentStatus status,
        Boolean recurring,
        String notes
) {

    public static ProposedChange notesOnly(String notes) {
        return new ProposedChange(null, null, null, null, null, null, null, null, notes);
    }

    /**
     * 曜日・顧客・現場がそろっているか
     */
    public boolean isComplete() {
        return day != null && hasText(clientName) && hasText(siteName);
    }

    /**
     * 指定項目を割り当てへ上書きする。呼び出し側で複製を渡すこと。
     */
    public void mergeInto(Assignment target) {
        if (day != null) target.setDay(day);
        if (clientName != null) target.setClientName(clientName.trim());
        if (siteName != null) target.setSiteName(siteName.trim());
        if (workerNames != null) target.setWorkerNames(workerNames);
        if (hours != null) target.setHours(hours);
        if (startTime != null) target.setStartTime(startTime);
        if (status != null) target.setStatus(status);
        if (recurring != null) target.setRecurring(recurring);
        if (notes != null) target.setNotes(notes);
    }

    /**
     * 新規割り当てとして組み立てる（状態は SCHEDULED）
     */
    public Assignment toNewAssignment(Long id) {
        Assignment assignment = new Assignment(day, trim(clientName), trim(siteName), workerNames,
                hours == null ? 0.0 : hours, startTime);
        assignment.setId(id);
        assignment.setStatus(AssignmentStatus.SCHEDULED);
        assignment.setRecurring(Boolean.TRUE.equals(recurring));
        assignment.setNotes(notes);
        return assignment;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
