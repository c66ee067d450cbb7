package com.example.cleanersched.conflict;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.config.ConflictSettings;
import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.WorkerRepository;
import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.site.SiteRepository;
import com.example.cleanersched.vacation.Vacation;
import com.example.cleanersched.vacation.VacationLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.example.cleanersched.conflict.ScheduleFixtures.WEEK;
import static com.example.cleanersched.conflict.ScheduleFixtures.assignment;
import static com.example.cleanersched.conflict.ScheduleFixtures.at;
import static com.example.cleanersched.conflict.ScheduleFixtures.worker;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleConflictServiceTest {

    private static final LocalDate WEDNESDAY_DATE = LocalDate.of(2025, 6, 4);

    @Mock
    private AssignmentRepository assignmentRepository;

    @Mock
    private WorkerRepository workerRepository;

    @Mock
    private SiteRepository siteRepository;

    @Mock
    private VacationLookup vacationLookup;

    private ErrorLogBuffer errorLogBuffer;
    private ScheduleConflictService service;

    @BeforeEach
    void setUp() {
        errorLogBuffer = new ErrorLogBuffer();
        ConflictDetectionEngine engine = new ConflictDetectionEngine(ConflictSettings.defaults(), errorLogBuffer);
        service = new ScheduleConflictService(assignmentRepository, workerRepository, siteRepository,
                engine, new ScheduleChangeValidator(engine, errorLogBuffer), vacationLookup, errorLogBuffer);
    }

    private static ProposedChange wednesdayFor(String workerName) {
        return new ProposedChange(WEDNESDAY, "Acme", "Tower", List.of(workerName), 2.0, at(9, 0),
                null, null, null);
    }

    @Test
    void validate_workerOnApprovedVacation_addsNonBlockingWarning() {
        when(assignmentRepository.findByWeekStartOrderByIdAsc(WEEK)).thenReturn(List.of());
        when(workerRepository.findAllByOrderByIdAsc()).thenReturn(List.of(worker("Ann", Clearance.LOW)));
        when(siteRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        Vacation vacation = new Vacation("Ann", WEDNESDAY_DATE, WEDNESDAY_DATE.plusDays(1),
                Vacation.Status.APPROVED, "通院");
        when(vacationLookup.find("Ann", WEDNESDAY_DATE)).thenReturn(Optional.of(vacation));

        ValidationResult result = service.validate(WEEK, wednesdayFor("Ann"), null);

        assertThat(result.canProceed()).isTrue();
        assertThat(result.warnings()).containsExactly("Ann は 2025-06-04 に休暇予定です（通院）");
    }

    @Test
    void validate_vacationLookupFailure_isRecordedAndDoesNotBlock() {
        when(assignmentRepository.findByWeekStartOrderByIdAsc(WEEK)).thenReturn(List.of());
        when(workerRepository.findAllByOrderByIdAsc()).thenReturn(List.of(worker("Ann", Clearance.LOW)));
        when(siteRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        when(vacationLookup.find(anyString(), any(LocalDate.class))).thenThrow(new IllegalStateException("down"));

        ValidationResult result = service.validate(WEEK, wednesdayFor("Ann"), null);

        assertThat(result.canProceed()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(errorLogBuffer.recent()).extracting(ErrorLogBuffer.Entry::source).containsExactly("VacationLookup");
    }

    @Test
    void validate_incompleteChange_skipsVacationLookup() {
        when(assignmentRepository.findByWeekStartOrderByIdAsc(WEEK)).thenReturn(List.of());
        when(workerRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        when(siteRepository.findAllByOrderByIdAsc()).thenReturn(List.of());

        ValidationResult result = service.validate(WEEK, ProposedChange.notesOnly("memo"), null);

        assertThat(result).isEqualTo(ValidationResult.permissive());
        verify(vacationLookup, never()).find(anyString(), any(LocalDate.class));
    }

    @Test
    void findConflicts_filtersBySeverityWorkerAndAssignment() {
        when(assignmentRepository.findByWeekStartOrderByIdAsc(WEEK)).thenReturn(List.of(
                assignment(1, MONDAY, "Acme", "Tower", 3, at(9, 0), "Ann"),
                assignment(2, MONDAY, "Globex", "Office", 2, at(11, 0), "Ann"),
                assignment(3, WEDNESDAY, "Acme", "Tower", 2, at(9, 0), "Ben")));
        when(workerRepository.findAllByOrderByIdAsc())
                .thenReturn(List.of(worker("Ann", Clearance.LOW), worker("Ben", Clearance.LOW)));
        when(siteRepository.findAllByOrderByIdAsc()).thenReturn(List.of());

        assertThat(service.findConflicts(WEEK, Severity.HIGH, null, null)).extracting(Conflict::type)
                .containsExactly(ConflictType.DOUBLE_BOOKING, ConflictType.TIME_OVERLAP);
        assertThat(service.findConflicts(WEEK, null, "Ben", null)).extracting(Conflict::type)
                .containsExactly(ConflictType.WORKLOAD_IMBALANCE);
        assertThat(service.findConflicts(WEEK, Severity.LOW, "Ann", 2L)).extracting(Conflict::type)
                .containsExactly(ConflictType.ROUTING_INEFFICIENCY);
        assertThat(service.findConflicts(WEEK, Severity.CRITICAL, null, null)).isEmpty();
    }

    @Test
    void validateChanges_unknownAssignment_isRejected() {
        when(assignmentRepository.findByWeekStartOrderByIdAsc(WEEK)).thenReturn(List.of());
        when(workerRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        when(siteRepository.findAllByOrderByIdAsc()).thenReturn(List.of());

        assertThatThrownBy(() -> service.validateChanges(WEEK, List.of(FieldChange.reschedule(42L, at(8, 0)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("42");
    }
}
