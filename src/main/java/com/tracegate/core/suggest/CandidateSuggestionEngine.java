package com.tracegate.core.suggest;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.PlanCaseEntry;
import com.tracegate.core.model.ScopeDeclaration;
import com.tracegate.core.model.TestArtifact;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Proposes test artifacts for a plan by forward-tracing each of its scope declarations.
 * <p>
 * Candidates are merged across declarations with a seen-set: the first declaration to reach an
 * artifact supplies its reason, later matches are dropped. Read-only; repeated calls over the
 * same data give the same list.
 */
@Service
public class CandidateSuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(CandidateSuggestionEngine.class);

    static final String NO_SCOPE_MESSAGE =
            "No scope declarations defined for this plan. Declare scope items first.";

    private final EntityGraphStore store;
    private final ForwardTracer tracer;
    private final TracegateMetrics metrics;

    public CandidateSuggestionEngine(EntityGraphStore store, ForwardTracer tracer, TracegateMetrics metrics) {
        this.store = store;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * @throws NotFoundException if the plan does not exist
     */
    public SuggestionResult suggest(String planId) {
        if (store.findPlan(planId).isEmpty()) {
            throw new NotFoundException("Test plan", planId);
        }
        MdcContext.setPlan(planId);
        try {
            List<ScopeDeclaration> declarations = store.findScopeDeclarations(planId);
            if (declarations.isEmpty()) {
                return new SuggestionResult(planId, List.of(), 0, 0, 0, NO_SCOPE_MESSAGE);
            }

            Set<String> inPlan = store.findPlanCaseEntries(planId).stream()
                    .map(PlanCaseEntry::testArtifactId)
                    .collect(Collectors.toSet());

            Set<String> seen = new HashSet<>();
            List<Suggestion> suggestions = new ArrayList<>();
            for (ScopeDeclaration declaration : declarations) {
                TraceResult trace = tracer.trace(declaration);
                if (!trace.sourceFound()) {
                    log.warn("Scope declaration {} points at missing {} {}; skipped",
                            declaration.id(), declaration.sourceType().code(), declaration.sourceId());
                    continue;
                }
                for (TraceHit hit : trace.hits()) {
                    TestArtifact artifact = hit.artifact();
                    if (seen.add(artifact.id())) {
                        suggestions.add(new Suggestion(artifact.id(), artifact.code(), artifact.title(),
                                artifact.testLayer(), declaration.id(), hit.reason(),
                                inPlan.contains(artifact.id())));
                    }
                }
            }

            int already = (int) suggestions.stream().filter(Suggestion::alreadyInPlan).count();
            int newCount = suggestions.size() - already;
            metrics.recordSuggestions(suggestions.size(), newCount);
            log.info("Suggested {} candidates for plan {} ({} new, {} already in plan)",
                    suggestions.size(), planId, newCount, already);
            String message = String.format("Found %d candidate test artifacts (%d new)",
                    suggestions.size(), newCount);
            return new SuggestionResult(planId, List.copyOf(suggestions), suggestions.size(),
                    newCount, already, message);
        } finally {
            MdcContext.clear();
        }
    }
}
