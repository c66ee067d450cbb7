package com.example.cleanersched.suggestion;

import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.roster.WorkerRepository;
import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.site.SiteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class SuggestionControllerTest {

    private static final LocalDate WEEK = LocalDate.of(2025, 6, 2);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private WorkerRepository workerRepository;

    @Autowired
    private SiteRepository siteRepository;

    @Autowired
    private SuggestionDismissalRepository dismissalRepository;

    private Assignment tower;
    private Assignment office;

    @BeforeEach
    void setUp() {
        assignmentRepository.deleteAll();
        dismissalRepository.deleteAll();
        workerRepository.deleteAll();
        siteRepository.deleteAll();
        workerRepository.saveAll(List.of(new Worker("Ann", Clearance.LOW), new Worker("Ben", Clearance.LOW)));
        tower = new Assignment(DayOfWeek.MONDAY, "Acme", "Tower", List.of("Ann"), 2, LocalTime.of(9, 0));
        tower.setWeekStart(WEEK);
        office = new Assignment(DayOfWeek.MONDAY, "Globex", "Office", List.of("Ann"), 2, LocalTime.of(13, 0));
        office.setWeekStart(WEEK);
        assignmentRepository.saveAll(List.of(tower, office));
    }

    @Test
    void listSuggestions_conflictResolutionComesFirst() throws Exception {
        mockMvc.perform(get("/api/suggestions").param("week", "2025-06-02"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].id").value("reassign-" + office.getId() + "-Ben"))
            .andExpect(jsonPath("$.data[0].kind").value("CONFLICT_RESOLUTION"))
            .andExpect(jsonPath("$.data[0].severity").value("HIGH"))
            .andExpect(jsonPath("$.data[0].priority").value(90))
            .andExpect(jsonPath("$.data[1].id").value("rebalance-" + tower.getId() + "-Ben"))
            .andExpect(jsonPath("$.data[?(@.id == 'workload-" + tower.getId() + "-Ben')]").isEmpty())
            .andExpect(jsonPath("$.data[2].kind").value("DAY_UTILIZATION"));
    }

    @Test
    void dismissSuggestion_isNotOfferedAgain() throws Exception {
        String id = "reassign-" + office.getId() + "-Ben";

        mockMvc.perform(post("/api/suggestions/" + id + "/dismiss").param("week", "2025-06-02"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("提案を却下しました"));

        mockMvc.perform(post("/api/suggestions/" + id + "/dismiss").param("week", "2025-06-02"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("既に却下済みです"));

        mockMvc.perform(get("/api/suggestions").param("week", "2025-06-02"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[?(@.id == '" + id + "')]").isEmpty())
            .andExpect(jsonPath("$.data[0].id").value("rebalance-" + tower.getId() + "-Ben"));

        assertThat(dismissalRepository.findByWeekStart(WEEK)).hasSize(1);
    }

    @Test
    void applySuggestion_updatesAssignmentsAndClearsConflict() throws Exception {
        String payload = "[{\"assignmentId\": " + office.getId() + ", \"replacedWorker\": \"Ann\", \"newWorker\": \"Ben\"}]";

        mockMvc.perform(post("/api/suggestions/apply").param("week", "2025-06-02")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.assignments[0].workerNames[0]").value("Ben"));

        assertThat(assignmentRepository.findById(office.getId()).orElseThrow().getWorkerNames()).containsExactly("Ben");
        mockMvc.perform(get("/api/conflicts").param("week", "2025-06-02").param("severity", "HIGH"))
            .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void applySuggestion_blockingChange_isRejectedAndNothingChanges() throws Exception {
        String payload = "[{\"assignmentId\": " + office.getId() + ", \"newTime\": \"10:00\"}]";

        mockMvc.perform(post("/api/suggestions/apply").param("week", "2025-06-02")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.data.canProceed").value(false));

        assertThat(assignmentRepository.findById(office.getId()).orElseThrow().getStartTime())
                .isEqualTo(LocalTime.of(13, 0));
    }

    @Test
    void applySuggestion_replacedWorkerNoLongerOnCrew_returnsBadRequest() throws Exception {
        String payload = "[{\"assignmentId\": " + office.getId() + ", \"replacedWorker\": \"Ben\", \"newWorker\": \"Ann\"}]";

        mockMvc.perform(post("/api/suggestions/apply").param("week", "2025-06-02")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest());

        assertThat(assignmentRepository.findById(office.getId()).orElseThrow().getWorkerNames()).containsExactly("Ann");
    }

    @Test
    void applySuggestion_unknownAssignment_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/suggestions/apply").param("week", "2025-06-02")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"assignmentId\": 999999, \"newDay\": \"FRIDAY\"}]"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/suggestions/apply").param("week", "2025-06-02")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[]"))
            .andExpect(status().isBadRequest());
    }
}
