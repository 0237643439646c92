package com.tracegate.dispatch.api;

import com.tracegate.core.coverage.CoverageAggregator;
import com.tracegate.core.coverage.CoverageReport;
import com.tracegate.core.coverage.PlanCoverageReport;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.gate.DataReadiness;
import com.tracegate.core.gate.DataReadinessCheck;
import com.tracegate.core.gate.ExitGateEvaluator;
import com.tracegate.core.gate.ExitGateReport;
import com.tracegate.core.model.PlanCaseEntry;
import com.tracegate.core.model.ScopeDeclaration;
import com.tracegate.core.plan.*;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.suggest.CandidateSuggestionEngine;
import com.tracegate.core.suggest.SuggestionResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for plan scoping, membership, coverage and the exit gate.
 */
@RestController
@RequestMapping("/api/v1/plans/{planId}")
public class PlanController {

    private final CandidateSuggestionEngine suggestionEngine;
    private final CoverageAggregator coverageAggregator;
    private final ExitGateEvaluator exitGateEvaluator;
    private final ScopeDeclarationService declarations;
    private final PlanMembershipService membership;
    private final DataReadinessCheck dataReadinessCheck;
    private final EntityGraphStore store;

    public PlanController(CandidateSuggestionEngine suggestionEngine,
                          CoverageAggregator coverageAggregator,
                          ExitGateEvaluator exitGateEvaluator,
                          ScopeDeclarationService declarations,
                          PlanMembershipService membership,
                          DataReadinessCheck dataReadinessCheck,
                          EntityGraphStore store) {
        this.suggestionEngine = suggestionEngine;
        this.coverageAggregator = coverageAggregator;
        this.exitGateEvaluator = exitGateEvaluator;
        this.declarations = declarations;
        this.membership = membership;
        this.dataReadinessCheck = dataReadinessCheck;
        this.store = store;
    }

    // ── Scope declarations ──────────────────────────────────────────────

    @GetMapping("/declarations")
    public ResponseEntity<List<ScopeDeclaration>> listDeclarations(@PathVariable String planId) {
        return ResponseEntity.ok(declarations.list(planId));
    }

    @PostMapping("/declarations")
    public ResponseEntity<ScopeDeclaration> declare(@PathVariable String planId,
                                                    @RequestBody DeclarationDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(declarations.declare(planId, draft));
    }

    @PatchMapping("/declarations/{declarationId}")
    public ResponseEntity<ScopeDeclaration> updateDeclaration(@PathVariable String planId,
                                                              @PathVariable String declarationId,
                                                              @RequestBody PlanningUpdateRequest request) {
        return ResponseEntity.ok(declarations.updatePlanning(planId, declarationId,
                request.priority(), request.riskLevel()));
    }

    @DeleteMapping("/declarations/{declarationId}")
    public ResponseEntity<Void> removeDeclaration(@PathVariable String planId,
                                                  @PathVariable String declarationId) {
        declarations.remove(planId, declarationId);
        return ResponseEntity.noContent().build();
    }

    // ── Working set ─────────────────────────────────────────────────────

    @GetMapping("/entries")
    public ResponseEntity<List<PlanCaseEntry>> listEntries(@PathVariable String planId) {
        return ResponseEntity.ok(membership.listEntries(planId));
    }

    @PostMapping("/entries")
    public ResponseEntity<PlanCaseEntry> addEntry(@PathVariable String planId, @RequestBody PlanEntryDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(membership.addEntry(planId, draft));
    }

    @DeleteMapping("/entries/{artifactId}")
    public ResponseEntity<Void> removeEntry(@PathVariable String planId, @PathVariable String artifactId) {
        membership.removeEntry(planId, artifactId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/suggestions")
    public ResponseEntity<SuggestionResult> suggestions(@PathVariable String planId) {
        return ResponseEntity.ok(suggestionEngine.suggest(planId));
    }

    @PostMapping("/suggestions/accept")
    public ResponseEntity<BulkAddResult> acceptSuggestions(@PathVariable String planId,
                                                           @RequestBody(required = false) AcceptSuggestionsRequest request) {
        List<String> ids = request != null ? request.testArtifactIds() : null;
        return ResponseEntity.ok(membership.acceptSuggestions(planId, ids));
    }

    @PostMapping("/import-suite/{suiteId}")
    public ResponseEntity<BulkAddResult> importSuite(@PathVariable String planId, @PathVariable String suiteId) {
        return ResponseEntity.ok(membership.importFromSuite(planId, suiteId));
    }

    // ── Coverage & gate ─────────────────────────────────────────────────

    @GetMapping("/coverage")
    public ResponseEntity<PlanCoverageReport> coverage(@PathVariable String planId) {
        return ResponseEntity.ok(coverageAggregator.computePlanCoverage(planId));
    }

    @GetMapping("/coverage/anchors/{anchorId}")
    public ResponseEntity<CoverageReport> anchorCoverage(@PathVariable String planId,
                                                         @PathVariable String anchorId) {
        return ResponseEntity.ok(coverageAggregator.computeAnchorCoverage(planId, anchorId));
    }

    @GetMapping("/exit-gate")
    public ResponseEntity<ExitGateReport> exitGate(@PathVariable String planId) {
        return ResponseEntity.ok(exitGateEvaluator.evaluateExit(planId));
    }

    @GetMapping("/data-readiness")
    public ResponseEntity<DataReadiness> dataReadiness(@PathVariable String planId) {
        if (store.findPlan(planId).isEmpty()) {
            throw new NotFoundException("Test plan", planId);
        }
        return ResponseEntity.ok(dataReadinessCheck.check(planId));
    }
}
