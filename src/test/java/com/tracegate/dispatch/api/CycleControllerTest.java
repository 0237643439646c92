package com.tracegate.dispatch.api;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.model.Execution;
import com.tracegate.core.model.ExecutionResult;
import com.tracegate.core.plan.CarryForwardFilter;
import com.tracegate.core.plan.CycleExecutionService;
import com.tracegate.core.plan.CyclePopulation;
import com.tracegate.core.plan.ExecutionDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CycleController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CycleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CycleExecutionService cycles;

    @Test
    @DisplayName("POST /cycles/{id}/populate returns created and skipped counts")
    void populate() throws Exception {
        when(cycles.populateFromPlan("C1")).thenReturn(new CyclePopulation("C1", null, 3, 1, 4));

        mockMvc.perform(post("/api/v1/cycles/C1/populate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(3))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.source_total").value(4));
    }

    @Test
    @DisplayName("carry-forward defaults to failed and blocked results")
    void carryForwardDefaultFilter() throws Exception {
        when(cycles.carryForward("C2", "C1", CarryForwardFilter.FAILED_BLOCKED))
                .thenReturn(new CyclePopulation("C2", "C1", 2, 0, 2));

        mockMvc.perform(post("/api/v1/cycles/C2/carry-forward/C1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source_cycle_id").value("C1"))
                .andExpect(jsonPath("$.created").value(2));

        verify(cycles).carryForward("C2", "C1", CarryForwardFilter.FAILED_BLOCKED);
    }

    @Test
    @DisplayName("carry-forward honours an explicit filter and rejects unknown ones")
    void carryForwardFilter() throws Exception {
        when(cycles.carryForward("C2", "C1", CarryForwardFilter.ALL))
                .thenReturn(new CyclePopulation("C2", "C1", 5, 0, 5));

        mockMvc.perform(post("/api/v1/cycles/C2/carry-forward/C1").param("filter", "all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(5));

        mockMvc.perform(post("/api/v1/cycles/C2/carry-forward/C1").param("filter", "passed"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown carry-forward filter: passed"));
    }

    @Test
    @DisplayName("POST /cycles/{id}/executions returns 201 with the stored execution")
    void record() throws Exception {
        Instant at = Instant.parse("2026-03-01T09:30:00Z");
        ExecutionDraft draft = new ExecutionDraft("TC-1", ExecutionResult.FAIL, at, "dana");
        when(cycles.recordResult("C1", draft))
                .thenReturn(new Execution(7L, "C1", "TC-1", ExecutionResult.FAIL, at, "dana"));

        mockMvc.perform(post("/api/v1/cycles/C1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_artifact_id\":\"TC-1\",\"result\":\"fail\","
                                + "\"executed_at\":\"2026-03-01T09:30:00Z\",\"executed_by\":\"dana\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.result").value("fail"))
                .andExpect(jsonPath("$.executed_at").value("2026-03-01T09:30:00Z"));
    }

    @Test
    @DisplayName("recording against an unknown cycle is 404")
    void unknownCycle() throws Exception {
        when(cycles.populateFromPlan("C-404")).thenThrow(new NotFoundException("Test cycle", "C-404"));

        mockMvc.perform(post("/api/v1/cycles/C-404/populate"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("an unknown result code is 400")
    void unknownResult() throws Exception {
        mockMvc.perform(post("/api/v1/cycles/C1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_artifact_id\":\"TC-1\",\"result\":\"skipped\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(cycles);
    }
}
