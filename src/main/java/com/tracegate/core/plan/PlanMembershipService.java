package com.tracegate.core.plan;

import com.tracegate.core.error.DuplicateAssociationException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.CaseSuiteLink;
import com.tracegate.core.model.PlanCaseEntry;
import com.tracegate.core.model.PlanEntryMethod;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.store.UniqueViolationException;
import com.tracegate.core.suggest.CandidateSuggestionEngine;
import com.tracegate.core.suggest.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Manages a plan's working set of test artifacts.
 * <p>
 * Single additions report duplicates as {@link DuplicateAssociationException}; bulk additions
 * (accepting suggestions, importing a suite) skip artifacts already in the plan and count them.
 */
@Service
public class PlanMembershipService {

    private static final Logger log = LoggerFactory.getLogger(PlanMembershipService.class);

    private final EntityGraphStore store;
    private final CandidateSuggestionEngine suggestionEngine;
    private final TracegateMetrics metrics;
    private final Clock clock;

    public PlanMembershipService(EntityGraphStore store, CandidateSuggestionEngine suggestionEngine,
                                 TracegateMetrics metrics) {
        this(store, suggestionEngine, metrics, Clock.systemUTC());
    }

    PlanMembershipService(EntityGraphStore store, CandidateSuggestionEngine suggestionEngine,
                          TracegateMetrics metrics, Clock clock) {
        this.store = store;
        this.suggestionEngine = suggestionEngine;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<PlanCaseEntry> listEntries(String planId) {
        requirePlan(planId);
        return store.findPlanCaseEntries(planId);
    }

    /**
     * @throws NotFoundException             if the plan, the artifact or the target cycle does not exist
     * @throws DuplicateAssociationException if the artifact is already in the plan
     */
    public PlanCaseEntry addEntry(String planId, PlanEntryDraft draft) {
        requirePlan(planId);
        requireArtifact(draft.testArtifactId());
        if (draft.targetCycleId() != null && store.findCycle(draft.targetCycleId())
                .filter(c -> c.planId().equals(planId)).isEmpty()) {
            throw new NotFoundException("Test cycle", draft.targetCycleId());
        }
        var entry = new PlanCaseEntry(planId, draft.testArtifactId(),
                draft.addedMethod() != null ? draft.addedMethod() : PlanEntryMethod.MANUAL,
                draft.priorityOverride(), draft.plannedOwner(), draft.targetCycleId(),
                draft.effortHours(), draft.executionOrder(), clock.instant());
        try {
            PlanCaseEntry stored = store.insertPlanCaseEntry(entry);
            log.info("Added {} to plan {} ({})", draft.testArtifactId(), planId, stored.addedMethod().code());
            return stored;
        } catch (UniqueViolationException e) {
            metrics.recordDuplicateAssociation("plan_entry");
            throw new DuplicateAssociationException(
                    "Test artifact " + draft.testArtifactId() + " is already in plan " + planId, e);
        }
    }

    public void removeEntry(String planId, String testArtifactId) {
        requirePlan(planId);
        if (!store.deletePlanCaseEntry(planId, testArtifactId)) {
            throw new NotFoundException("Test artifact " + testArtifactId + " is not in plan " + planId);
        }
        log.info("Removed {} from plan {}", testArtifactId, planId);
    }

    /**
     * Adds suggested artifacts to the plan.
     *
     * @param testArtifactIds artifacts to accept; null or empty accepts every suggestion not yet
     *                        in the plan
     */
    public BulkAddResult acceptSuggestions(String planId, List<String> testArtifactIds) {
        List<String> ids = testArtifactIds;
        if (ids == null || ids.isEmpty()) {
            ids = suggestionEngine.suggest(planId).suggestions().stream()
                    .filter(s -> !s.alreadyInPlan())
                    .map(Suggestion::testArtifactId)
                    .toList();
        } else {
            requirePlan(planId);
            ids.forEach(this::requireArtifact);
        }
        return addAll(planId, ids, PlanEntryMethod.SUGGESTION);
    }

    /**
     * Adds every member of a suite to the plan with provenance {@code suite_import}.
     */
    public BulkAddResult importFromSuite(String planId, String suiteId) {
        requirePlan(planId);
        if (store.findSuite(suiteId).isEmpty()) {
            throw new NotFoundException("Suite", suiteId);
        }
        List<String> ids = store.findLinksForSuite(suiteId).stream()
                .map(CaseSuiteLink::testArtifactId)
                .toList();
        BulkAddResult result = addAll(planId, ids, PlanEntryMethod.SUITE_IMPORT);
        log.info("Imported suite {} into plan {}: {} added, {} skipped", suiteId, planId,
                result.added(), result.skipped());
        return result;
    }

    private BulkAddResult addAll(String planId, List<String> testArtifactIds, PlanEntryMethod method) {
        MdcContext.setPlan(planId);
        try {
            List<String> added = new ArrayList<>();
            int skipped = 0;
            for (String artifactId : testArtifactIds) {
                try {
                    store.insertPlanCaseEntry(PlanCaseEntry.of(planId, artifactId, method, clock.instant()));
                    added.add(artifactId);
                } catch (UniqueViolationException e) {
                    log.debug("{} already in plan {}; skipped", artifactId, planId);
                    skipped++;
                }
            }
            return new BulkAddResult(planId, added.size(), skipped, List.copyOf(added));
        } finally {
            MdcContext.clear();
        }
    }

    private void requireArtifact(String testArtifactId) {
        if (testArtifactId == null || store.findTestArtifact(testArtifactId).isEmpty()) {
            throw new NotFoundException("Test artifact", testArtifactId);
        }
    }

    private void requirePlan(String planId) {
        if (store.findPlan(planId).isEmpty()) {
            throw new NotFoundException("Test plan", planId);
        }
    }
}
