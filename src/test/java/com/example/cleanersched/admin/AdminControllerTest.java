package com.example.cleanersched.admin;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @BeforeEach
    void setUp() {
        errorLogBuffer.clear();
    }

    @Test
    void errorLogs_areListedWithLimitAndCleared() throws Exception {
        errorLogBuffer.addError("TEST", "first", new IllegalStateException("a"));
        errorLogBuffer.addError("TEST", "second", new IllegalStateException("b"));

        mockMvc.perform(get("/api/admin/error-logs").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.count").value(1))
            .andExpect(jsonPath("$.data.items[0].message").value("second"));

        mockMvc.perform(delete("/api/admin/error-logs"))
            .andExpect(status().isOk());

        assertThat(errorLogBuffer.recent()).isEmpty();
    }

    @Test
    void status_reportsRequestedWeek() throws Exception {
        mockMvc.perform(get("/api/admin/status").param("week", "2025-06-05"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.week").value("2025-06-02"))
            .andExpect(jsonPath("$.data.recentErrorCount").value(0));
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"));
    }
}
