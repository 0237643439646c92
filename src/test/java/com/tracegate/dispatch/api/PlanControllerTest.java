package com.tracegate.dispatch.api;

import com.tracegate.core.coverage.CoverageAggregator;
import com.tracegate.core.coverage.CoverageReport;
import com.tracegate.core.coverage.CoverageSummary;
import com.tracegate.core.coverage.PlanCoverageReport;
import com.tracegate.core.error.DuplicateAssociationException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.gate.*;
import com.tracegate.core.model.*;
import com.tracegate.core.plan.*;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.suggest.CandidateSuggestionEngine;
import com.tracegate.core.suggest.Suggestion;
import com.tracegate.core.suggest.SuggestionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PlanController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PlanControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CandidateSuggestionEngine suggestionEngine;

    @MockitoBean
    private CoverageAggregator coverageAggregator;

    @MockitoBean
    private ExitGateEvaluator exitGateEvaluator;

    @MockitoBean
    private ScopeDeclarationService declarations;

    @MockitoBean
    private PlanMembershipService membership;

    @MockitoBean
    private DataReadinessCheck dataReadinessCheck;

    @MockitoBean
    private EntityGraphStore store;

    private static ScopeDeclaration declaration(String id, String priority) {
        return new ScopeDeclaration(id, "PLAN-1", ScopeSourceType.PROCESS_ANCHOR, "L3-042",
                "L3-042", "Order to cash", priority, "high", CoverageStatus.NOT_CALCULATED);
    }

    // ── Declarations ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Scope declarations")
    class Declarations {

        @Test
        @DisplayName("POST /declarations returns 201 with the stored declaration")
        void declare() throws Exception {
            when(declarations.declare(eq("PLAN-1"), any(DeclarationDraft.class)))
                    .thenReturn(declaration("DECL-9", "p1"));

            mockMvc.perform(post("/api/v1/plans/PLAN-1/declarations")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"source_type\":\"process_anchor\",\"source_id\":\"L3-042\",\"priority\":\"p1\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("DECL-9"))
                    .andExpect(jsonPath("$.source_type").value("process_anchor"))
                    .andExpect(jsonPath("$.coverage_status").value("not_calculated"));

            verify(declarations).declare("PLAN-1",
                    new DeclarationDraft(ScopeSourceType.PROCESS_ANCHOR, "L3-042", "p1", null));
        }

        @Test
        @DisplayName("POST /declarations with an unknown source type is 400")
        void unknownSourceType() throws Exception {
            mockMvc.perform(post("/api/v1/plans/PLAN-1/declarations")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"source_type\":\"epic\",\"source_id\":\"E-1\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("POST /declarations twice for the same source is 409")
        void duplicate() throws Exception {
            when(declarations.declare(eq("PLAN-1"), any(DeclarationDraft.class)))
                    .thenThrow(new DuplicateAssociationException("process_anchor L3-042 is already declared on PLAN-1"));

            mockMvc.perform(post("/api/v1/plans/PLAN-1/declarations")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"source_type\":\"process_anchor\",\"source_id\":\"L3-042\"}"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("PATCH /declarations/{id} edits planning fields only")
        void updatePlanning() throws Exception {
            when(declarations.updatePlanning("PLAN-1", "DECL-1", "p2", null))
                    .thenReturn(declaration("DECL-1", "p2"));

            mockMvc.perform(patch("/api/v1/plans/PLAN-1/declarations/DECL-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"priority\":\"p2\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.priority").value("p2"))
                    .andExpect(jsonPath("$.risk_level").value("high"));
        }

        @Test
        @DisplayName("DELETE /declarations/{id} returns 204; unknown id is 404")
        void remove() throws Exception {
            mockMvc.perform(delete("/api/v1/plans/PLAN-1/declarations/DECL-1"))
                    .andExpect(status().isNoContent());
            verify(declarations).remove("PLAN-1", "DECL-1");

            doThrow(new NotFoundException("Scope declaration", "DECL-404"))
                    .when(declarations).remove("PLAN-1", "DECL-404");
            mockMvc.perform(delete("/api/v1/plans/PLAN-1/declarations/DECL-404"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("Scope declaration not found: DECL-404"));
        }

        @Test
        @DisplayName("GET /declarations lists the plan's declarations")
        void list() throws Exception {
            when(declarations.list("PLAN-1")).thenReturn(List.of(declaration("DECL-1", "p1")));

            mockMvc.perform(get("/api/v1/plans/PLAN-1/declarations"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(1)))
                    .andExpect(jsonPath("$[0].display_code").value("L3-042"));
        }
    }

    // ── Working set ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Working set")
    class WorkingSet {

        @Test
        @DisplayName("POST /entries returns 201")
        void addEntry() throws Exception {
            when(membership.addEntry(eq("PLAN-1"), any(PlanEntryDraft.class)))
                    .thenReturn(PlanCaseEntry.of("PLAN-1", "TC-3", PlanEntryMethod.MANUAL, NOW));

            mockMvc.perform(post("/api/v1/plans/PLAN-1/entries")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"test_artifact_id\":\"TC-3\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.test_artifact_id").value("TC-3"))
                    .andExpect(jsonPath("$.added_method").value("manual"));
        }

        @Test
        @DisplayName("DELETE /entries/{artifactId} returns 204")
        void removeEntry() throws Exception {
            mockMvc.perform(delete("/api/v1/plans/PLAN-1/entries/TC-3"))
                    .andExpect(status().isNoContent());
            verify(membership).removeEntry("PLAN-1", "TC-3");
        }

        @Test
        @DisplayName("GET /suggestions returns the candidate list")
        void suggestions() throws Exception {
            Suggestion s = new Suggestion("TC-3", "TC-3", "Create order", TestLayer.SYSTEM_INTEGRATION,
                    "DECL-1", "Anchored to process L3-042", false);
            when(suggestionEngine.suggest("PLAN-1"))
                    .thenReturn(new SuggestionResult("PLAN-1", List.of(s), 1, 1, 0, null));

            mockMvc.perform(get("/api/v1/plans/PLAN-1/suggestions"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.new_count").value(1))
                    .andExpect(jsonPath("$.suggestions[0].test_layer").value("sit"))
                    .andExpect(jsonPath("$.suggestions[0].matched_declaration_id").value("DECL-1"));
        }

        @Test
        @DisplayName("POST /suggestions/accept without a body accepts every new suggestion")
        void acceptAll() throws Exception {
            when(membership.acceptSuggestions("PLAN-1", null))
                    .thenReturn(new BulkAddResult("PLAN-1", 2, 0, List.of("TC-3", "TC-4")));

            mockMvc.perform(post("/api/v1/plans/PLAN-1/suggestions/accept"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.added").value(2))
                    .andExpect(jsonPath("$.added_ids", hasSize(2)));
        }

        @Test
        @DisplayName("POST /import-suite/{suiteId} reports added and skipped counts")
        void importSuite() throws Exception {
            when(membership.importFromSuite("PLAN-1", "S-A"))
                    .thenReturn(new BulkAddResult("PLAN-1", 1, 1, List.of("TC-3")));

            mockMvc.perform(post("/api/v1/plans/PLAN-1/import-suite/S-A"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.skipped").value(1));
        }
    }

    // ── Coverage & gate ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Coverage and exit gate")
    class CoverageAndGate {

        @Test
        @DisplayName("GET /coverage returns rows and summary")
        void coverage() throws Exception {
            CoverageReport row = new CoverageReport("DECL-1", "PLAN-1", ScopeSourceType.PROCESS_ANCHOR,
                    "L3-042", "L3-042", 3, 2, 2, 1, 1, 0, 66.7, 100.0, 50.0, CoverageStatus.PARTIAL, false, null);
            CoverageSummary summary = new CoverageSummary(1, 0, 1, 0, 0, 3, 2, 2, 1, 66.7, 100.0, 50.0);
            when(coverageAggregator.computePlanCoverage("PLAN-1"))
                    .thenReturn(new PlanCoverageReport("PLAN-1", List.of(row), summary));

            mockMvc.perform(get("/api/v1/plans/PLAN-1/coverage"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.per_declaration[0].coverage_status").value("partial"))
                    .andExpect(jsonPath("$.per_declaration[0].coverage_pct").value(66.7))
                    .andExpect(jsonPath("$.summary.partial_coverage").value(1));
        }

        @Test
        @DisplayName("GET /coverage for an unknown plan is 404")
        void coverageUnknownPlan() throws Exception {
            when(coverageAggregator.computePlanCoverage("PLAN-404"))
                    .thenThrow(new NotFoundException("Test plan", "PLAN-404"));

            mockMvc.perform(get("/api/v1/plans/PLAN-404/coverage"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("not_found"));
        }

        @Test
        @DisplayName("GET /exit-gate returns the verdict with every gate")
        void exitGate() throws Exception {
            List<GateResult> gates = List.of(
                    new GateResult("pass_rate", "Pass rate >= 95.0%", "92.0%", false),
                    new GateResult("open_p1_defects", "No open P1 defects", "0", true));
            GateStats stats = new GateStats(25, 23, 2, 0, 0, 92.0, 100.0, 0, 1);
            when(exitGateEvaluator.evaluateExit("PLAN-1"))
                    .thenReturn(new ExitGateReport("PLAN-1", GateVerdict.FAIL, gates, stats));

            mockMvc.perform(get("/api/v1/plans/PLAN-1/exit-gate"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.overall").value("FAIL"))
                    .andExpect(jsonPath("$.gates", hasSize(2)))
                    .andExpect(jsonPath("$.gates[0].measured_value").value("92.0%"))
                    .andExpect(jsonPath("$.stats.open_p2").value(1));
        }

        @Test
        @DisplayName("GET /data-readiness checks the plan exists first")
        void dataReadiness() throws Exception {
            when(store.findPlan("PLAN-1")).thenReturn(Optional.of(new TestPlan("PLAN-1", "PRJ-1", "Release 1")));
            when(dataReadinessCheck.check("PLAN-1")).thenReturn(new DataReadiness("PLAN-1", true,
                    List.of(new DataSetStatus("DS-1", "Customers", "ready", "QA", true, true))));

            mockMvc.perform(get("/api/v1/plans/PLAN-1/data-readiness"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.all_mandatory_ready").value(true))
                    .andExpect(jsonPath("$.data_sets[0].data_set_id").value("DS-1"));

            when(store.findPlan("PLAN-404")).thenReturn(Optional.empty());
            mockMvc.perform(get("/api/v1/plans/PLAN-404/data-readiness"))
                    .andExpect(status().isNotFound());
        }
    }
}
