package com.example.cleanersched.suggestion;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 週ごとに却下された提案ID。提案は永続化しないため、IDだけを保持する。
 */
@Entity
@Table(name = "suggestion_dismissals",
        uniqueConstraints = @UniqueConstraint(columnNames = {"week_start", "suggestion_id"}))
public class SuggestionDismissal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "suggestion_id", nullable = false, length = 255)
    private String suggestionId;

    @Column(name = "dismissed_at")
    private LocalDateTime dismissedAt;

    protected SuggestionDismissal() {}

    public SuggestionDismissal(LocalDate weekStart, String suggestionId) {
        this.weekStart = weekStart;
        this.suggestionId = suggestionId;
    }

    @PrePersist
    protected void onCreate() { this.dismissedAt = LocalDateTime.now(); }

    public Long getId() { return id; }
    public LocalDate getWeekStart() { return weekStart; }
    public String getSuggestionId() { return suggestionId; }
    public LocalDateTime getDismissedAt() { return dismissedAt; }
}
