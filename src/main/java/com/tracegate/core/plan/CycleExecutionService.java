package com.tracegate.core.plan;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.model.*;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fills test cycles with planned executions and records execution results.
 * <p>
 * A cycle holds one execution per artifact. Population never creates a second one, and
 * recording a result overwrites the artifact's execution in that cycle, creating it only when the
 * artifact was never planned there.
 */
@Service
public class CycleExecutionService {

    private static final Logger log = LoggerFactory.getLogger(CycleExecutionService.class);

    private final EntityGraphStore store;
    private final Clock clock;

    public CycleExecutionService(EntityGraphStore store) {
        this(store, Clock.systemUTC());
    }

    CycleExecutionService(EntityGraphStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Creates a {@code not_run} execution for every plan entry, assigned to its planned owner.
     */
    public CyclePopulation populateFromPlan(String cycleId) {
        TestCycle cycle = requireCycle(cycleId);
        MdcContext.setPlan(cycle.planId());
        try {
            List<PlanCaseEntry> entries = store.findPlanCaseEntries(cycle.planId());
            Set<String> present = artifactsIn(cycleId);
            int created = 0;
            for (PlanCaseEntry entry : entries) {
                if (present.add(entry.testArtifactId())) {
                    store.insertExecution(Execution.planned(cycleId, entry.testArtifactId(), entry.plannedOwner()));
                    created++;
                }
            }
            log.info("Populated cycle {} from plan {}: {} created", cycleId, cycle.planId(), created);
            return new CyclePopulation(cycleId, null, created, entries.size() - created, entries.size());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Carries executions of a previous cycle whose result matches {@code filter} into this cycle
     * as {@code not_run}, keeping the previous assignee.
     */
    public CyclePopulation carryForward(String cycleId, String previousCycleId, CarryForwardFilter filter) {
        TestCycle cycle = requireCycle(cycleId);
        requireCycle(previousCycleId);
        CarryForwardFilter effective = filter != null ? filter : CarryForwardFilter.FAILED_BLOCKED;
        MdcContext.setPlan(cycle.planId());
        try {
            List<Execution> candidates = Execution.latestPerArtifact(store.findExecutionsForCycle(previousCycleId))
                    .stream()
                    .filter(e -> effective.matches(e.result()))
                    .toList();
            Set<String> present = artifactsIn(cycleId);
            int created = 0;
            for (Execution previous : candidates) {
                if (present.add(previous.testArtifactId())) {
                    store.insertExecution(Execution.planned(cycleId, previous.testArtifactId(), previous.executedBy()));
                    created++;
                }
            }
            log.info("Carried {} executions from cycle {} into {} (filter {})", created, previousCycleId,
                    cycleId, effective.code());
            return new CyclePopulation(cycleId, previousCycleId, created, candidates.size() - created,
                    candidates.size());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records the outcome of running an artifact in a cycle. A re-run replaces the earlier
     * result, so only the latest outcome feeds carry-forward and the exit gate.
     *
     * @throws NotFoundException        if the cycle or the artifact does not exist
     * @throws IllegalArgumentException if the result is missing
     */
    public Execution recordResult(String cycleId, ExecutionDraft draft) {
        requireCycle(cycleId);
        if (draft.testArtifactId() == null || store.findTestArtifact(draft.testArtifactId()).isEmpty()) {
            throw new NotFoundException("Test artifact", draft.testArtifactId());
        }
        if (draft.result() == null) {
            throw new IllegalArgumentException("result is required");
        }
        Instant executedAt = draft.executedAt();
        if (executedAt == null && draft.result().isExecuted()) {
            executedAt = clock.instant();
        }
        Optional<Execution> current = Execution.latestPerArtifact(store.findExecutionsForCycle(cycleId)).stream()
                .filter(e -> e.testArtifactId().equals(draft.testArtifactId()))
                .findFirst();
        String executedBy = draft.executedBy() != null ? draft.executedBy()
                : current.map(Execution::executedBy).orElse("");
        Execution recorded = new Execution(current.map(Execution::id).orElse(null), cycleId,
                draft.testArtifactId(), draft.result(), executedAt, executedBy);
        Execution stored = current.isPresent() ? store.updateExecution(recorded) : store.insertExecution(recorded);
        log.info("Recorded {} for {} in cycle {} (execution {}, {})", stored.result().code(),
                stored.testArtifactId(), cycleId, stored.id(), current.isPresent() ? "updated" : "created");
        return stored;
    }

    private Set<String> artifactsIn(String cycleId) {
        Set<String> ids = new HashSet<>();
        store.findExecutionsForCycle(cycleId).forEach(e -> ids.add(e.testArtifactId()));
        return ids;
    }

    private TestCycle requireCycle(String cycleId) {
        return store.findCycle(cycleId).orElseThrow(() -> new NotFoundException("Test cycle", cycleId));
    }
}
