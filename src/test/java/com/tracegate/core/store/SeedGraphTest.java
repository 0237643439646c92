package com.tracegate.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracegate.core.coverage.CoverageAggregator;
import com.tracegate.core.coverage.CoverageReport;
import com.tracegate.core.coverage.PlanCoverageReport;
import com.tracegate.core.gate.ExitGateEvaluator;
import com.tracegate.core.gate.ExitGateReport;
import com.tracegate.core.gate.GateProperties;
import com.tracegate.core.gate.PlanDataSetReadinessCheck;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.CoverageStatus;
import com.tracegate.core.model.DefectSeverity;
import com.tracegate.core.model.Execution;
import com.tracegate.core.model.TestLayer;
import com.tracegate.core.resolve.ProcessHierarchy;
import com.tracegate.core.suggest.CandidateSuggestionEngine;
import com.tracegate.core.suggest.ForwardTracer;
import com.tracegate.core.suggest.SuggestionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the bundled demo graph the way the in-memory store bean does and runs the plan services over it.
 */
class SeedGraphTest {

    private InMemoryEntityGraphStore store;
    private TracegateMetrics metrics;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        store = new InMemoryEntityGraphStore();
        metrics = new TracegateMetrics(new SimpleMeterRegistry());
        try (InputStream in = getClass().getResourceAsStream("/seed/demo-graph.json")) {
            assertNotNull(in, "seed file should be on the classpath");
            mapper.readValue(in, GraphSnapshot.class).loadInto(store);
        }
    }

    @Test
    @DisplayName("every section of the seed file is loaded")
    void loadsAllSections() {
        assertTrue(store.findNode("L3-042").isPresent());
        assertEquals(TestLayer.ACCEPTANCE, store.findTestArtifact("TC-2").orElseThrow().testLayer());
        assertEquals(2, store.findLinksForSuite("S-A").size());
        assertEquals(2, store.findCycles("PLAN-1").size());
        assertEquals(2, store.findScopeDeclarations("PLAN-1").size());
        assertEquals(2, store.findPlanCaseEntries("PLAN-1").size());
        assertEquals(2, store.findExecutions("TC-1").size());
        assertEquals(1, store.findOpenDefects("PRJ-1", DefectSeverity.P2).size());
        assertEquals(2, store.findPlanDataSets("PLAN-1").size());
    }

    @Test
    @DisplayName("preset execution ids keep the sequence ahead of them")
    void executionSequenceContinues() {
        var next = store.insertExecution(Execution.planned("C2", "TC-2", "bob"));
        assertEquals(4L, next.id());
    }

    @Test
    @DisplayName("plan coverage over the demo graph")
    void demoCoverage() {
        var aggregator = new CoverageAggregator(store, new ForwardTracer(store, new ProcessHierarchy(store)), metrics);

        PlanCoverageReport report = aggregator.computePlanCoverage("PLAN-1");

        CoverageReport anchorRow = report.perDeclaration().stream()
                .filter(r -> r.declarationId().equals("DECL-1")).findFirst().orElseThrow();
        assertEquals(1, anchorRow.totalTraceable());
        assertEquals(1, anchorRow.inPlan());
        assertEquals(CoverageStatus.FULL, anchorRow.coverageStatus());

        CoverageReport requirementRow = report.perDeclaration().stream()
                .filter(r -> r.declarationId().equals("DECL-2")).findFirst().orElseThrow();
        assertEquals(1, requirementRow.totalTraceable());
        assertEquals(0, requirementRow.inPlan());
        assertEquals(CoverageStatus.NONE, requirementRow.coverageStatus());

        assertEquals(2, report.summary().totalDeclarations());
    }

    @Test
    @DisplayName("suggestions over the demo graph offer the invoice test")
    void demoSuggestions() {
        var engine = new CandidateSuggestionEngine(store, new ForwardTracer(store, new ProcessHierarchy(store)), metrics);

        SuggestionResult result = engine.suggest("PLAN-1");

        assertTrue(result.suggestions().stream()
                .anyMatch(s -> s.testArtifactId().equals("TC-5") && !s.alreadyInPlan()));
        assertTrue(result.suggestions().stream()
                .anyMatch(s -> s.testArtifactId().equals("TC-1") && s.alreadyInPlan()));
    }

    @Test
    @DisplayName("exit gate over the demo graph sees the open P2 defect")
    void demoGate() {
        var evaluator = new ExitGateEvaluator(store, new PlanDataSetReadinessCheck(store), new GateProperties(), metrics);

        ExitGateReport report = evaluator.evaluateExit("PLAN-1");

        assertEquals(0, report.stats().openP1());
        assertEquals(1, report.stats().openP2());
        assertFalse(report.gate("open_p2_defects").passed());
    }
}
