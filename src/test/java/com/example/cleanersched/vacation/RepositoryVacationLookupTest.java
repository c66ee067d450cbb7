package com.example.cleanersched.vacation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepositoryVacationLookupTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 4);

    @Mock
    private VacationRepository vacationRepository;

    @InjectMocks
    private RepositoryVacationLookup lookup;

    @Test
    void find_returnsFirstApprovedVacationCoveringDate() {
        Vacation first = new Vacation("Ann", DAY.minusDays(1), DAY, Vacation.Status.APPROVED, "通院");
        Vacation second = new Vacation("Ann", DAY, DAY.plusDays(2), Vacation.Status.APPROVED, null);
        when(vacationRepository.findByWorkerNameAndStatusAndStartDateLessThanEqualAndEndDateGreaterThanEqualOrderByStartDateAsc(
                "Ann", Vacation.Status.APPROVED, DAY, DAY)).thenReturn(List.of(first, second));

        assertThat(lookup.find(" Ann ", DAY)).contains(first);
    }

    @Test
    void find_missingArguments_returnsEmptyWithoutQuery() {
        assertThat(lookup.find(null, DAY)).isEmpty();
        assertThat(lookup.find("Ann", null)).isEmpty();
        verifyNoInteractions(vacationRepository);
    }

    @Test
    void covers_includesBothEnds() {
        Vacation vacation = new Vacation("Ann", DAY, DAY.plusDays(1), Vacation.Status.APPROVED, null);

        assertThat(vacation.covers(DAY)).isTrue();
        assertThat(vacation.covers(DAY.plusDays(1))).isTrue();
        assertThat(vacation.covers(DAY.plusDays(2))).isFalse();
        assertThat(vacation.covers(DAY.minusDays(1))).isFalse();
    }
}
