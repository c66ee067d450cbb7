package com.example.cleanersched.vacation;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 承認済みの休暇だけを対象にする。
 */
@Component
public class RepositoryVacationLookup implements VacationLookup {

    private final VacationRepository vacationRepository;

    public RepositoryVacationLookup(VacationRepository vacationRepository) {
        this.vacationRepository = vacationRepository;
    }

    @Override
    public Optional<Vacation> find(String workerName, LocalDate date) {
        if (workerName == null || date == null) {
            return Optional.empty();
        }
        return vacationRepository
                .findByWorkerNameAndStatusAndStartDateLessThanEqualAndEndDateGreaterThanEqualOrderByStartDateAsc(
                        workerName.trim(), Vacation.Status.APPROVED, date, date)
                .stream()
                .findFirst();
    }
}
