package com.tracegate.core.coverage;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.*;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.suggest.ForwardTracer;
import com.tracegate.core.suggest.TraceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes how much of a plan's declared scope is covered by its working set and how far
 * execution has progressed.
 * <p>
 * The traceable set of each scope comes from {@link ForwardTracer}, so coverage and suggestions
 * always agree. An artifact's state is taken from its latest execution in the plan's cycles
 * (latest timestamp, ties broken by highest id). Every computation rewrites the cached
 * {@link CoverageStatus} of the declarations involved. A row that cannot be traced is reported
 * as data-incomplete; it never aborts the rest of the report.
 */
@Service
public class CoverageAggregator {

    private static final Logger log = LoggerFactory.getLogger(CoverageAggregator.class);

    private final EntityGraphStore store;
    private final ForwardTracer tracer;
    private final TracegateMetrics metrics;

    public CoverageAggregator(EntityGraphStore store, ForwardTracer tracer, TracegateMetrics metrics) {
        this.store = store;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * Coverage of a single process anchor against a plan's working set. Declarations of the plan
     * that point at the same anchor get their cached status updated.
     *
     * @throws NotFoundException if the plan does not exist
     */
    public CoverageReport computeAnchorCoverage(String planId, String anchorId) {
        long start = System.currentTimeMillis();
        PlanContext context = loadContext(planId);
        MdcContext.setPlan(planId);
        try {
            String label = store.findNode(anchorId).map(ProcessNode::code).orElse(anchorId);
            TraceResult trace = tracer.traceAnchor(anchorId, label);
            CoverageReport report = trace.sourceFound()
                    ? measure(context, null, ScopeSourceType.PROCESS_ANCHOR, anchorId, label, trace.artifactIds())
                    : incomplete(planId, null, ScopeSourceType.PROCESS_ANCHOR, anchorId, label,
                            "Process node " + anchorId + " no longer exists");
            for (ScopeDeclaration declaration : store.findScopeDeclarations(planId)) {
                if (declaration.sourceType() == ScopeSourceType.PROCESS_ANCHOR
                        && anchorId.equals(declaration.sourceId())) {
                    store.writeCoverageStatus(declaration.id(), report.coverageStatus());
                }
            }
            log.info("Anchor {} in plan {}: {}% covered ({}/{})", anchorId, planId,
                    report.coveragePct(), report.inPlan(), report.totalTraceable());
            return report;
        } finally {
            MdcContext.clear();
            metrics.recordCoverageComputation("anchor", System.currentTimeMillis() - start);
        }
    }

    /**
     * One report per scope declaration plus a roll-up over distinct artifacts.
     *
     * @throws NotFoundException if the plan does not exist
     */
    public PlanCoverageReport computePlanCoverage(String planId) {
        long start = System.currentTimeMillis();
        PlanContext context = loadContext(planId);
        MdcContext.setPlan(planId);
        try {
            List<CoverageReport> rows = new ArrayList<>();
            Set<String> allTraceable = new LinkedHashSet<>();
            for (ScopeDeclaration declaration : store.findScopeDeclarations(planId)) {
                CoverageReport row = computeRow(context, declaration, allTraceable);
                store.writeCoverageStatus(declaration.id(), row.coverageStatus());
                rows.add(row);
            }
            CoverageSummary summary = summarize(context, rows, allTraceable);
            log.info("Plan {} coverage: {} declarations ({} full, {} partial, {} none, {} incomplete)",
                    planId, summary.totalDeclarations(), summary.fullCoverage(), summary.partialCoverage(),
                    summary.noCoverage(), summary.dataIncomplete());
            return new PlanCoverageReport(planId, List.copyOf(rows), summary);
        } finally {
            MdcContext.clear();
            metrics.recordCoverageComputation("plan", System.currentTimeMillis() - start);
        }
    }

    private CoverageReport computeRow(PlanContext context, ScopeDeclaration declaration, Set<String> allTraceable) {
        try {
            TraceResult trace = tracer.trace(declaration);
            if (!trace.sourceFound()) {
                log.warn("Declaration {} points at missing {} {}", declaration.id(),
                        declaration.sourceType().code(), declaration.sourceId());
                return incomplete(context.planId(), declaration.id(), declaration.sourceType(),
                        declaration.sourceId(), declaration.label(),
                        "Source " + declaration.sourceType().code() + " " + declaration.sourceId()
                                + " no longer exists");
            }
            Set<String> traceable = trace.artifactIds();
            allTraceable.addAll(traceable);
            return measure(context, declaration.id(), declaration.sourceType(), declaration.sourceId(),
                    declaration.label(), traceable);
        } catch (RuntimeException e) {
            log.warn("Coverage for declaration {} could not be computed: {}", declaration.id(), e.getMessage());
            return incomplete(context.planId(), declaration.id(), declaration.sourceType(),
                    declaration.sourceId(), declaration.label(), "Coverage could not be computed: " + e.getMessage());
        }
    }

    private CoverageReport measure(PlanContext context, String declarationId, ScopeSourceType sourceType,
                                   String sourceId, String label, Set<String> traceable) {
        Counts counts = count(context, traceable);
        return new CoverageReport(declarationId, context.planId(), sourceType, sourceId, label,
                traceable.size(), counts.inPlan(), counts.executed(), counts.passed(),
                counts.failedOrBlocked(), counts.notRun(),
                Percentages.of(counts.inPlan(), traceable.size()),
                Percentages.of(counts.executed(), counts.inPlan()),
                Percentages.of(counts.passed(), counts.executed()),
                CoverageStatus.fromCounts(counts.inPlan(), traceable.size()),
                false, null);
    }

    private CoverageSummary summarize(PlanContext context, List<CoverageReport> rows, Set<String> allTraceable) {
        int full = 0, partial = 0, none = 0, incomplete = 0;
        for (CoverageReport row : rows) {
            if (row.dataIncomplete()) {
                incomplete++;
            }
            switch (row.coverageStatus()) {
                case FULL -> full++;
                case PARTIAL -> partial++;
                default -> none++;
            }
        }
        Counts counts = count(context, allTraceable);
        return new CoverageSummary(rows.size(), full, partial, none, incomplete,
                allTraceable.size(), counts.inPlan(), counts.executed(), counts.passed(),
                Percentages.of(counts.inPlan(), allTraceable.size()),
                Percentages.of(counts.executed(), counts.inPlan()),
                Percentages.of(counts.passed(), counts.executed()));
    }

    private Counts count(PlanContext context, Set<String> traceable) {
        int inPlan = 0, executed = 0, passed = 0, failedOrBlocked = 0;
        for (String artifactId : traceable) {
            if (!context.entries().contains(artifactId)) {
                continue;
            }
            inPlan++;
            ExecutionResult latest = context.latestResult(artifactId);
            if (latest.isExecuted()) {
                executed++;
                if (latest == ExecutionResult.PASS) {
                    passed++;
                } else {
                    failedOrBlocked++;
                }
            }
        }
        return new Counts(inPlan, executed, passed, failedOrBlocked, inPlan - executed);
    }

    private static CoverageReport incomplete(String planId, String declarationId, ScopeSourceType sourceType,
                                             String sourceId, String label, String note) {
        return new CoverageReport(declarationId, planId, sourceType, sourceId, label,
                0, 0, 0, 0, 0, 0, 0.0, 0.0, 0.0, CoverageStatus.NONE, true, note);
    }

    private PlanContext loadContext(String planId) {
        if (store.findPlan(planId).isEmpty()) {
            throw new NotFoundException("Test plan", planId);
        }
        Set<String> cycleIds = store.findCycles(planId).stream()
                .map(TestCycle::id)
                .collect(Collectors.toSet());
        Set<String> entries = store.findPlanCaseEntries(planId).stream()
                .map(PlanCaseEntry::testArtifactId)
                .collect(Collectors.toSet());
        return new PlanContext(planId, cycleIds, entries, new HashMap<>());
    }

    private record Counts(int inPlan, int executed, int passed, int failedOrBlocked, int notRun) {}

    /**
     * Per-computation view of a plan. Latest results are memoised for the lifetime of one call.
     */
    private final class PlanContext {

        private final String planId;
        private final Set<String> cycleIds;
        private final Set<String> entries;
        private final Map<String, ExecutionResult> latest;

        PlanContext(String planId, Set<String> cycleIds, Set<String> entries, Map<String, ExecutionResult> latest) {
            this.planId = planId;
            this.cycleIds = cycleIds;
            this.entries = entries;
            this.latest = latest;
        }

        String planId() {
            return planId;
        }

        Set<String> entries() {
            return entries;
        }

        ExecutionResult latestResult(String artifactId) {
            return latest.computeIfAbsent(artifactId, id -> store.findExecutions(id).stream()
                    .filter(e -> cycleIds.contains(e.cycleId()))
                    .max(Execution.CHRONOLOGICAL)
                    .map(Execution::result)
                    .orElse(ExecutionResult.NOT_RUN));
        }
    }
}
