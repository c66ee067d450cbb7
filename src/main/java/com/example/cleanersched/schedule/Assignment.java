package com.example.cleanersched.schedule;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 週間グリッド上の1件の清掃割り当て。
 * <p>
 * 時間数は割り当て全体に対する値で、清掃員ごとの値ではない。
 */
@Entity
@Table(name = "assignments")
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 週の月曜日
    @Column(name = "week_start")
    private LocalDate weekStart;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 16)
    private DayOfWeek day;

    @Column(name = "client_name", nullable = false)
    private String clientName;

    @Column(name = "site_name", nullable = false)
    private String siteName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "assignment_workers", joinColumns = @JoinColumn(name = "assignment_id"))
    @OrderColumn(name = "worker_order")
    @Column(name = "worker_name", nullable = false)
    private List<String> workerNames = new ArrayList<>();

    @Column(name = "planned_hours", nullable = false)
    private Double hours = 0.0;

    @JsonFormat(pattern = "HH:mm")
    @Column(name = "start_time")
    private LocalTime startTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AssignmentStatus status = AssignmentStatus.SCHEDULED;

    @Column(name = "recurring")
    private Boolean recurring = false;

    @Column(name = "notes", length = 500)
    private String notes;

    protected Assignment() {
    }

    public Assignment(DayOfWeek day, String clientName, String siteName, List<String> workerNames,
                      double hours, LocalTime startTime) {
        this.day = day;
        this.clientName = clientName;
        this.siteName = siteName;
        setWorkerNames(workerNames);
        this.hours = hours;
        this.startTime = startTime;
    }

    /**
     * 永続化コンテキストから切り離した複製を作成（仮スナップショット用）
     */
    public Assignment copy() {
        Assignment copy = new Assignment(day, clientName, siteName, workerNames,
                hours == null ? 0.0 : hours, startTime);
        copy.id = id;
        copy.weekStart = weekStart;
        copy.status = status;
        copy.recurring = recurring;
        copy.notes = notes;
        return copy;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDate getWeekStart() { return weekStart; }
    public void setWeekStart(LocalDate weekStart) { this.weekStart = weekStart; }

    public DayOfWeek getDay() { return day; }
    public void setDay(DayOfWeek day) { this.day = day; }

    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }

    public String getSiteName() { return siteName; }
    public void setSiteName(String siteName) { this.siteName = siteName; }

    public List<String> getWorkerNames() { return workerNames; }

    public void setWorkerNames(List<String> workerNames) {
        this.workerNames = workerNames == null ? new ArrayList<>() : new ArrayList<>(workerNames);
    }

    public Double getHours() { return hours; }
    public void setHours(Double hours) { this.hours = hours; }

    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }

    public AssignmentStatus getStatus() { return status; }
    public void setStatus(AssignmentStatus status) { this.status = status; }

    public Boolean getRecurring() { return recurring; }
    public void setRecurring(Boolean recurring) { this.recurring = recurring; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    /**
     * 空白・重複を除いた担当清掃員名
     */
    public List<String> assignedWorkers() {
        if (workerNames == null || workerNames.isEmpty()) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : workerNames) {
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        return List.copyOf(names);
    }

    public boolean hasWorker(String workerName) {
        return workerName != null && assignedWorkers().contains(workerName.trim());
    }

    public double hoursOrZero() {
        return hours == null ? 0.0 : hours;
    }

    /**
     * 開始時刻 + 時間数。24時を超える場合は日付を跨いで折り返す。
     */
    public Optional<LocalTime> endTime() {
        if (startTime == null || hoursOrZero() <= 0) {
            return Optional.empty();
        }
        return Optional.of(startTime.plusMinutes(Math.round(hoursOrZero() * 60)));
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == AssignmentStatus.CANCELLED;
    }

    @JsonIgnore
    public boolean isMovable() {
        return status == AssignmentStatus.SCHEDULED && !Boolean.TRUE.equals(recurring);
    }

    /**
     * 同一割り当てか（ID 未採番のものはインスタンスで比較）
     */
    public boolean isSameAs(Assignment other) {
        if (other == null) {
            return false;
        }
        if (id == null || other.id == null) {
            return this == other;
        }
        return Objects.equals(id, other.id);
    }

    @Override
    public String toString() {
        return "Assignment{id=" + id + ", day=" + day + ", client=" + clientName + ", site=" + siteName
                + ", workers=" + workerNames + ", hours=" + hours + ", start=" + startTime + ", status=" + status + "}";
    }
}
