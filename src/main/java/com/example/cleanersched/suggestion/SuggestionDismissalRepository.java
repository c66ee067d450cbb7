package com.example.cleanersched.suggestion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface SuggestionDismissalRepository extends JpaRepository<SuggestionDismissal, Long> {
    List<SuggestionDismissal> findByWeekStart(LocalDate weekStart);
    boolean existsByWeekStartAndSuggestionId(LocalDate weekStart, String suggestionId);
}
