package com.tracegate.core.plan;

import com.tracegate.core.error.DuplicateAssociationException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.CoverageStatus;
import com.tracegate.core.model.ScopeDeclaration;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.store.UniqueViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Declares, edits and removes the scope items of a plan.
 * <p>
 * The source entity must exist when declared; its code and title are copied onto the
 * declaration for display. Edits touch priority and risk only; the cached coverage status
 * belongs to the coverage aggregator.
 */
@Service
public class ScopeDeclarationService {

    private static final Logger log = LoggerFactory.getLogger(ScopeDeclarationService.class);

    private final EntityGraphStore store;
    private final TracegateMetrics metrics;

    public ScopeDeclarationService(EntityGraphStore store, TracegateMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public List<ScopeDeclaration> list(String planId) {
        requirePlan(planId);
        return store.findScopeDeclarations(planId);
    }

    /**
     * @throws NotFoundException             if the plan or the source entity does not exist
     * @throws DuplicateAssociationException if the source is already declared on the plan
     * @throws IllegalArgumentException      if the source type or id is missing
     */
    public ScopeDeclaration declare(String planId, DeclarationDraft draft) {
        requirePlan(planId);
        if (draft.sourceType() == null || draft.sourceId() == null || draft.sourceId().isBlank()) {
            throw new IllegalArgumentException("source_type and source_id are required");
        }
        String[] display = describeSource(draft);
        var declaration = new ScopeDeclaration(UUID.randomUUID().toString(), planId, draft.sourceType(),
                draft.sourceId(), display[0], display[1], draft.priority(), draft.riskLevel(),
                CoverageStatus.NOT_CALCULATED);
        try {
            ScopeDeclaration stored = store.insertScopeDeclaration(declaration);
            log.info("Declared {} {} on plan {}", draft.sourceType().code(), draft.sourceId(), planId);
            return stored;
        } catch (UniqueViolationException e) {
            metrics.recordDuplicateAssociation("declaration");
            throw new DuplicateAssociationException(
                    draft.sourceType().code() + " " + draft.sourceId() + " is already in scope of plan " + planId, e);
        }
    }

    public ScopeDeclaration updatePlanning(String planId, String declarationId, String priority, String riskLevel) {
        ScopeDeclaration existing = requireDeclaration(planId, declarationId);
        return store.updateScopeDeclaration(existing.withPlanning(priority, riskLevel));
    }

    public void remove(String planId, String declarationId) {
        requireDeclaration(planId, declarationId);
        store.deleteScopeDeclaration(declarationId);
        log.info("Removed scope declaration {} from plan {}", declarationId, planId);
    }

    private String[] describeSource(DeclarationDraft draft) {
        String id = draft.sourceId();
        return switch (draft.sourceType()) {
            case PROCESS_ANCHOR, SCENARIO -> store.findNode(id)
                    .map(n -> new String[]{n.code(), n.title()})
                    .orElseThrow(() -> new NotFoundException("Process node", id));
            case REQUIREMENT -> store.findRequirement(id)
                    .map(r -> new String[]{r.code(), r.title()})
                    .orElseThrow(() -> new NotFoundException("Requirement", id));
            case DEVELOPMENT_ITEM -> store.findDevelopmentItem(id)
                    .map(d -> new String[]{d.code(), d.title()})
                    .orElseThrow(() -> new NotFoundException("Development item", id));
        };
    }

    private ScopeDeclaration requireDeclaration(String planId, String declarationId) {
        return store.findScopeDeclaration(declarationId)
                .filter(d -> d.planId().equals(planId))
                .orElseThrow(() -> new NotFoundException("Scope declaration", declarationId));
    }

    private void requirePlan(String planId) {
        if (store.findPlan(planId).isEmpty()) {
            throw new NotFoundException("Test plan", planId);
        }
    }
}
