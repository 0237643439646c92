package com.tracegate.core.coverage;

import com.tracegate.core.GraphFixture;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.*;
import com.tracegate.core.resolve.ProcessHierarchy;
import com.tracegate.core.store.InMemoryEntityGraphStore;
import com.tracegate.core.suggest.ForwardTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tracegate.core.GraphFixture.PLAN;
import static com.tracegate.core.GraphFixture.execution;
import static org.junit.jupiter.api.Assertions.*;

class CoverageAggregatorTest {

    private InMemoryEntityGraphStore store;
    private SimpleMeterRegistry registry;
    private CoverageAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = GraphFixture.withPlan();
        registry = new SimpleMeterRegistry();
        aggregator = new CoverageAggregator(store, new ForwardTracer(store, new ProcessHierarchy(store)),
                new TracegateMetrics(registry));
    }

    private void threeAnchoredArtifactsTwoPlanned() {
        store.saveTestArtifact(GraphFixture.anchored("TC-1", "L3-042"));
        store.saveTestArtifact(GraphFixture.anchored("TC-2", "L3-042"));
        store.saveTestArtifact(GraphFixture.anchored("TC-3", "L3-042"));
        store.insertPlanCaseEntry(GraphFixture.entry("TC-1"));
        store.insertPlanCaseEntry(GraphFixture.entry("TC-2"));
        store.insertExecution(execution("C1", "TC-1", ExecutionResult.PASS, "2026-02-01T10:00:00Z"));
        store.insertExecution(execution("C1", "TC-2", ExecutionResult.NOT_RUN, null));
    }

    @Nested
    @DisplayName("Anchor coverage")
    class Anchor {

        @Test
        @DisplayName("3 traceable, 2 planned, 1 executed and passed")
        void partialCoverage() {
            threeAnchoredArtifactsTwoPlanned();

            CoverageReport report = aggregator.computeAnchorCoverage(PLAN, "L3-042");

            assertEquals(3, report.totalTraceable());
            assertEquals(2, report.inPlan());
            assertEquals(1, report.executed());
            assertEquals(1, report.passed());
            assertEquals(1, report.notRun());
            assertEquals(66.7, report.coveragePct());
            assertEquals(50.0, report.executionPct());
            assertEquals(100.0, report.passRate());
            assertEquals(CoverageStatus.PARTIAL, report.coverageStatus());
            assertFalse(report.dataIncomplete());
        }

        @Test
        @DisplayName("matching process-anchor declaration gets its status cached")
        void writesDeclarationStatus() {
            threeAnchoredArtifactsTwoPlanned();
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-1", ScopeSourceType.PROCESS_ANCHOR, "L3-042"));

            aggregator.computeAnchorCoverage(PLAN, "L3-042");

            assertEquals(CoverageStatus.PARTIAL, store.findScopeDeclaration("DECL-1").orElseThrow().coverageStatus());
        }

        @Test
        @DisplayName("anchor with no traceable artifacts is 0% and NONE")
        void nothingTraceable() {
            CoverageReport report = aggregator.computeAnchorCoverage(PLAN, "L3-050");
            assertEquals(0, report.totalTraceable());
            assertEquals(0.0, report.coveragePct());
            assertEquals(CoverageStatus.NONE, report.coverageStatus());
        }

        @Test
        @DisplayName("unknown plan is not found")
        void unknownPlan() {
            assertThrows(NotFoundException.class, () -> aggregator.computeAnchorCoverage("PLAN-404", "L3-042"));
        }
    }

    @Nested
    @DisplayName("Latest execution")
    class Latest {

        @Test
        @DisplayName("a later pass supersedes an earlier failure")
        void laterPassWins() {
            store.saveTestArtifact(GraphFixture.anchored("TC-1", "L3-042"));
            store.insertPlanCaseEntry(GraphFixture.entry("TC-1"));
            store.insertExecution(execution("C1", "TC-1", ExecutionResult.FAIL, "2026-02-01T10:00:00Z"));
            store.insertExecution(execution("C2", "TC-1", ExecutionResult.PASS, "2026-02-08T10:00:00Z"));

            CoverageReport report = aggregator.computeAnchorCoverage(PLAN, "L3-042");

            assertEquals(1, report.passed());
            assertEquals(0, report.failedOrBlocked());
            assertEquals(CoverageStatus.FULL, report.coverageStatus());
            assertEquals(100.0, report.coveragePct());
        }

        @Test
        @DisplayName("executions in another plan's cycles are ignored")
        void otherPlanIgnored() {
            store.savePlan(new TestPlan("PLAN-2", GraphFixture.PROJECT, "UAT"));
            store.saveCycle(new TestCycle("U1", "PLAN-2", "UAT 1", 1));
            store.saveTestArtifact(GraphFixture.anchored("TC-1", "L3-042"));
            store.insertPlanCaseEntry(GraphFixture.entry("TC-1"));
            store.insertExecution(execution("U1", "TC-1", ExecutionResult.BLOCKED, "2026-02-01T10:00:00Z"));

            CoverageReport report = aggregator.computeAnchorCoverage(PLAN, "L3-042");

            assertEquals(0, report.executed());
            assertEquals(1, report.notRun());
            assertEquals(0.0, report.passRate());
        }
    }

    @Nested
    @DisplayName("Plan coverage")
    class Plan {

        @Test
        @DisplayName("one row per declaration and a distinct roll-up")
        void distinctRollUp() {
            threeAnchoredArtifactsTwoPlanned();
            store.saveTestArtifact(GraphFixture.artifact("TC-4", TestLayer.COMPONENT, "L3-042", "D9", null));
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-1", ScopeSourceType.PROCESS_ANCHOR, "L3-042"));
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-2", ScopeSourceType.DEVELOPMENT_ITEM, "D9"));

            PlanCoverageReport report = aggregator.computePlanCoverage(PLAN);

            assertEquals(2, report.perDeclaration().size());
            CoverageSummary summary = report.summary();
            assertEquals(2, summary.totalDeclarations());
            assertEquals(4, summary.totalTraceable());
            assertEquals(2, summary.inPlan());
            assertEquals(50.0, summary.coveragePct());
            assertEquals(1, summary.partialCoverage());
            assertEquals(1, summary.noCoverage());
        }

        @Test
        @DisplayName("declaration on a deleted source yields an incomplete row, others still computed")
        void dataIncomplete() {
            threeAnchoredArtifactsTwoPlanned();
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-1", ScopeSourceType.PROCESS_ANCHOR, "L3-042"));
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-2", ScopeSourceType.REQUIREMENT, "R-GONE"));

            PlanCoverageReport report = aggregator.computePlanCoverage(PLAN);

            CoverageReport missing = report.perDeclaration().get(1);
            assertTrue(missing.dataIncomplete());
            assertEquals(CoverageStatus.NONE, missing.coverageStatus());
            assertNotNull(missing.note());
            assertFalse(report.perDeclaration().get(0).dataIncomplete());
            assertEquals(1, report.summary().dataIncomplete());
            assertEquals(CoverageStatus.NONE, store.findScopeDeclaration("DECL-2").orElseThrow().coverageStatus());
        }

        @Test
        @DisplayName("percentages stay within bounds")
        void bounds() {
            threeAnchoredArtifactsTwoPlanned();
            store.insertScopeDeclaration(GraphFixture.declaration("DECL-1", ScopeSourceType.PROCESS_ANCHOR, "L3-042"));

            for (CoverageReport row : aggregator.computePlanCoverage(PLAN).perDeclaration()) {
                assertTrue(row.inPlan() <= row.totalTraceable());
                assertTrue(row.executed() <= row.inPlan());
                assertTrue(row.passed() <= row.executed());
                assertTrue(row.coveragePct() >= 0.0 && row.coveragePct() <= 100.0);
            }
        }

        @Test
        @DisplayName("computation time is recorded")
        void recordsTimer() {
            aggregator.computePlanCoverage(PLAN);
            var timer = registry.find("tracegate.coverage.duration").tag("scope", "plan").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }
    }
}
