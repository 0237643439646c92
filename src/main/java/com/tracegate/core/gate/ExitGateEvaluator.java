package com.tracegate.core.gate;

import com.tracegate.core.coverage.Percentages;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.*;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates a plan's exit criteria.
 * <p>
 * The gate set is fixed: pass rate, open P1 defects, open P2 defects, completion and data
 * readiness. Every gate is always reported. A gate whose value cannot be determined fails with
 * an {@code unknown: ...} value instead of raising, so the overall verdict turns FAIL.
 */
@Service
public class ExitGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExitGateEvaluator.class);

    public static final String PASS_RATE = "pass_rate";
    public static final String OPEN_P1 = "open_p1_defects";
    public static final String OPEN_P2 = "open_p2_defects";
    public static final String COMPLETION = "completion";
    public static final String DATA_READINESS = "data_readiness";

    private final EntityGraphStore store;
    private final DataReadinessCheck dataReadinessCheck;
    private final GateProperties properties;
    private final TracegateMetrics metrics;

    public ExitGateEvaluator(EntityGraphStore store, DataReadinessCheck dataReadinessCheck,
                             GateProperties properties, TracegateMetrics metrics) {
        this.store = store;
        this.dataReadinessCheck = dataReadinessCheck;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @throws NotFoundException if the plan does not exist
     */
    public ExitGateReport evaluateExit(String planId) {
        TestPlan plan = store.findPlan(planId)
                .orElseThrow(() -> new NotFoundException("Test plan", planId));
        MdcContext.setPlan(planId);
        try {
            ExecutionTally tally = tallyExecutions(planId);
            Integer openP1 = countOpenDefects(plan, DefectSeverity.P1);
            Integer openP2 = countOpenDefects(plan, DefectSeverity.P2);

            List<GateResult> gates = new ArrayList<>();
            gates.add(passRateGate(tally));
            gates.add(defectGate(OPEN_P1, "Zero open P1 defects", plan, openP1));
            gates.add(defectGate(OPEN_P2, "Zero open P2 defects", plan, openP2));
            gates.add(completionGate(tally));
            gates.add(dataReadinessGate(planId));

            boolean allPassed = gates.stream().allMatch(GateResult::passed);
            GateVerdict overall = allPassed ? GateVerdict.PASS : GateVerdict.FAIL;
            metrics.recordGateVerdict(allPassed);
            log.info("Exit gate for plan {}: {} ({} of {} gates passed)", planId, overall,
                    gates.stream().filter(GateResult::passed).count(), gates.size());

            var stats = new GateStats(tally.total(), tally.passed(), tally.failed(), tally.blocked(),
                    tally.notRun(), tally.passRate(), tally.completionRate(), openP1, openP2);
            return new ExitGateReport(planId, overall, List.copyOf(gates), stats);
        } finally {
            MdcContext.clear();
        }
    }

    private GateResult passRateGate(ExecutionTally tally) {
        String label = String.format(Locale.ROOT, "Pass rate >= %.1f%%", properties.getPassRateThreshold());
        if (tally.failure() != null) {
            return GateResult.unknown(PASS_RATE, label, tally.failure());
        }
        if (tally.passed() + tally.failed() == 0) {
            return GateResult.unknown(PASS_RATE, label, "no pass or fail results recorded");
        }
        double rate = tally.passRate();
        return new GateResult(PASS_RATE, label, rate + "%", rate >= properties.getPassRateThreshold());
    }

    private GateResult completionGate(ExecutionTally tally) {
        String label = String.format(Locale.ROOT, "Completion >= %.1f%%", properties.getCompletionThreshold());
        if (tally.failure() != null) {
            return GateResult.unknown(COMPLETION, label, tally.failure());
        }
        if (tally.total() == 0) {
            return GateResult.unknown(COMPLETION, label, "no executions planned in this plan's cycles");
        }
        double rate = tally.completionRate();
        return new GateResult(COMPLETION, label, rate + "%", rate >= properties.getCompletionThreshold());
    }

    private GateResult defectGate(String name, String label, TestPlan plan, Integer open) {
        if (open == null) {
            String reason = plan.projectId() == null || plan.projectId().isBlank()
                    ? "plan has no project"
                    : "defects of project " + plan.projectId() + " could not be read";
            return GateResult.unknown(name, label, reason);
        }
        return new GateResult(name, label, String.valueOf(open), open == 0);
    }

    private GateResult dataReadinessGate(String planId) {
        String label = "All mandatory data sets ready";
        try {
            boolean ready = dataReadinessCheck.check(planId).allMandatoryReady();
            return new GateResult(DATA_READINESS, label, String.valueOf(ready), ready);
        } catch (RuntimeException e) {
            log.warn("Data readiness for plan {} could not be determined: {}", planId, e.getMessage());
            return GateResult.unknown(DATA_READINESS, label, e.getMessage());
        }
    }

    private Integer countOpenDefects(TestPlan plan, DefectSeverity severity) {
        if (plan.projectId() == null || plan.projectId().isBlank()) {
            return null;
        }
        try {
            return store.findOpenDefects(plan.projectId(), severity).size();
        } catch (RuntimeException e) {
            log.warn("Open {} defects of project {} could not be read: {}", severity, plan.projectId(),
                    e.getMessage());
            return null;
        }
    }

    /**
     * Counts the latest execution of each artifact in each of the plan's cycles. A re-run
     * artifact counts once per cycle, with its most recent result.
     */
    private ExecutionTally tallyExecutions(String planId) {
        int passed = 0, failed = 0, blocked = 0, notRun = 0;
        try {
            for (TestCycle cycle : store.findCycles(planId)) {
                for (Execution execution : Execution.latestPerArtifact(store.findExecutionsForCycle(cycle.id()))) {
                    ExecutionResult result = execution.result() != null ? execution.result() : ExecutionResult.NOT_RUN;
                    switch (result) {
                        case PASS -> passed++;
                        case FAIL -> failed++;
                        case BLOCKED -> blocked++;
                        case NOT_RUN -> notRun++;
                    }
                }
            }
        } catch (RuntimeException e) {
            log.warn("Executions of plan {} could not be read: {}", planId, e.getMessage());
            return new ExecutionTally(0, 0, 0, 0, "executions could not be read");
        }
        return new ExecutionTally(passed, failed, blocked, notRun, null);
    }

    /**
     * @param failure why the executions could not be counted; null when the counts are real
     */
    private record ExecutionTally(int passed, int failed, int blocked, int notRun, String failure) {

        int total() {
            return passed + failed + blocked + notRun;
        }

        double passRate() {
            return Percentages.of(passed, passed + failed);
        }

        double completionRate() {
            return Percentages.of(total() - notRun, total());
        }
    }
}
