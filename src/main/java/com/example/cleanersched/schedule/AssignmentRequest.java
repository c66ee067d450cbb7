package com.example.cleanersched.schedule;

import com.example.cleanersched.conflict.ProposedChange;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 割り当て作成リクエスト。{@code weekStart} 未指定時は今週。
 */
public record AssignmentRequest(
        LocalDate weekStart,
        @NotNull(message = "曜日は必須です") DayOfWeek day,
        @NotBlank(message = "顧客名は必須です") String clientName,
        @NotBlank(message = "現場名は必須です") String siteName,
        List<String> workerNames,
        @NotNull(message = "時間数は必須です")
        @PositiveOrZero(message = "時間数は0以上で入力してください")
        @DecimalMax(value = "24.0", message = "時間数は24以下で入力してください") Double hours,
        @JsonFormat(pattern = "HH:mm") LocalTime startTime,
        Boolean recurring,
        String notes
) {

    public ProposedChange toProposedChange() {
        return new ProposedChange(day, clientName, siteName, workerNames == null ? List.of() : workerNames,
                hours, startTime, AssignmentStatus.SCHEDULED, recurring, notes);
    }
}
